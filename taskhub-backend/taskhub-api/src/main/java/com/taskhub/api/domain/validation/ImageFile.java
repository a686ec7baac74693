package com.taskhub.api.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated upload, when present, must be an image (jpeg, png, bmp, gif, svg or webp)
 * no larger than {@code taskhub.storage.max-avatar-size}. A missing or empty upload is valid.
 */
@Documented
@Constraint(validatedBy = ImageFileValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ImageFile {

    String message() default "The {field} field must be an image.";

    String field() default "avatar";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
