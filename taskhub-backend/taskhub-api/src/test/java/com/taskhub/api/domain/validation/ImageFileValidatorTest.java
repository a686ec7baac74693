package com.taskhub.api.domain.validation;

import com.taskhub.api.config.TaskHubProperties;
import jakarta.validation.ConstraintValidatorContext;
import jakarta.validation.ConstraintValidatorContext.ConstraintViolationBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ImageFileValidator")
class ImageFileValidatorTest {

    static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0};

    @Mock
    private ConstraintValidatorContext context;

    @Mock
    private ConstraintViolationBuilder builder;

    private ImageFileValidator validator;

    @BeforeEach
    void setUp() throws NoSuchFieldException {
        TaskHubProperties properties = new TaskHubProperties();
        properties.getStorage().setMaxAvatarSize(DataSize.ofKilobytes(1));
        validator = new ImageFileValidator(properties);
        validator.initialize(Form.class.getDeclaredField("avatar").getAnnotation(ImageFile.class));

        given(context.buildConstraintViolationWithTemplate(anyString())).willReturn(builder);
    }

    @Test
    @DisplayName("a missing or empty upload is valid")
    void absentIsValid() {
        assertThat(validator.isValid(null, context)).isTrue();
        assertThat(validator.isValid(new MockMultipartFile("avatar", new byte[0]), context)).isTrue();
    }

    @Test
    @DisplayName("accepts a PNG whose bytes match its content type")
    void acceptsPng() {
        assertThat(validator.isValid(new MockMultipartFile("avatar", "a.png", "image/png", PNG), context)).isTrue();
        verify(context, never()).buildConstraintViolationWithTemplate(anyString());
    }

    @Test
    @DisplayName("accepts an SVG document")
    void acceptsSvg() {
        byte[] svg = "<svg xmlns=\"http://www.w3.org/2000/svg\"></svg>".getBytes(StandardCharsets.UTF_8);

        assertThat(validator.isValid(new MockMultipartFile("avatar", "a.svg", "image/svg+xml", svg), context)).isTrue();
    }

    @Test
    @DisplayName("rejects a text file declared as an image")
    void rejectsDisguisedFile() {
        byte[] text = "hello world".getBytes(StandardCharsets.UTF_8);

        assertThat(validator.isValid(new MockMultipartFile("avatar", "a.png", "image/png", text), context)).isFalse();
        verify(context).buildConstraintViolationWithTemplate("The avatar field must be an image.");
    }

    @Test
    @DisplayName("rejects a non-image content type")
    void rejectsPdf() {
        assertThat(validator.isValid(new MockMultipartFile("avatar", "a.pdf", "application/pdf", PNG), context)).isFalse();
    }

    @Test
    @DisplayName("rejects files over the size limit with the kilobyte message")
    void rejectsOversized() {
        byte[] big = new byte[2048];
        System.arraycopy(PNG, 0, big, 0, PNG.length);

        assertThat(validator.isValid(new MockMultipartFile("avatar", "a.png", "image/png", big), context)).isFalse();
        verify(context).buildConstraintViolationWithTemplate("The avatar field must not be greater than 1 kilobytes.");
    }

    static class Form {
        @ImageFile
        Object avatar;
    }
}
