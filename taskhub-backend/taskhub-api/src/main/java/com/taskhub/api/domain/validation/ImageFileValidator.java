package com.taskhub.api.domain.validation;

import com.taskhub.api.config.TaskHubProperties;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class ImageFileValidator implements ConstraintValidator<ImageFile, MultipartFile> {

    private static final int HEADER_BYTES = 512;

    private final long maxBytes;
    private String field;

    public ImageFileValidator(TaskHubProperties properties) {
        this.maxBytes = properties.getStorage().getMaxAvatarSize().toBytes();
    }

    @Override
    public void initialize(ImageFile constraint) {
        this.field = constraint.field();
    }

    @Override
    public boolean isValid(MultipartFile file, ConstraintValidatorContext context) {
        if (file == null || file.isEmpty()) {
            return true;
        }

        if (file.getSize() > maxBytes) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(
                            "The " + field + " field must not be greater than " + (maxBytes / 1024) + " kilobytes.")
                    .addConstraintViolation();
            return false;
        }

        if (!ImageFormat.isSupportedMimeType(file.getContentType())) {
            log.debug("[IMAGE_REJECTED] Unsupported content type | field={} | contentType={}",
                    field, file.getContentType());
            return reject(context);
        }

        try (InputStream in = file.getInputStream()) {
            byte[] header = in.readNBytes(HEADER_BYTES);
            if (ImageFormat.detect(header).isEmpty()) {
                log.debug("[IMAGE_REJECTED] Content does not match an image signature | field={}", field);
                return reject(context);
            }
        } catch (IOException e) {
            log.warn("[IMAGE_UNREADABLE] Uploaded file could not be read | field={} | error={}", field, e.getMessage());
            return reject(context);
        }
        return true;
    }

    private boolean reject(ConstraintValidatorContext context) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate("The " + field + " field must be an image.")
                .addConstraintViolation();
        return false;
    }
}
