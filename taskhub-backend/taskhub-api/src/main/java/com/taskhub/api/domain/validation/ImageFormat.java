package com.taskhub.api.domain.validation;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats accepted for avatars, recognised by their leading bytes.
 */
public enum ImageFormat {
    JPEG("jpg", "image/jpeg"),
    PNG("png", "image/png"),
    GIF("gif", "image/gif"),
    BMP("bmp", "image/bmp"),
    WEBP("webp", "image/webp"),
    SVG("svg", "image/svg+xml");

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final String extension;
    private final String mimeType;

    ImageFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String getExtension() {
        return extension;
    }

    public static boolean isSupportedMimeType(String contentType) {
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT).split(";")[0].trim();
        if ("image/jpg".equals(normalized) || "image/pjpeg".equals(normalized)) {
            return true;
        }
        return Arrays.stream(values()).anyMatch(format -> format.mimeType.equals(normalized));
    }

    /**
     * Detect the format from the first bytes of the file.
     */
    public static Optional<ImageFormat> detect(byte[] header) {
        if (header == null || header.length < 2) {
            return Optional.empty();
        }
        if (startsWith(header, (byte) 0xFF, (byte) 0xD8, (byte) 0xFF)) {
            return Optional.of(JPEG);
        }
        if (startsWith(header, PNG_SIGNATURE)) {
            return Optional.of(PNG);
        }
        if (startsWithAscii(header, "GIF87a") || startsWithAscii(header, "GIF89a")) {
            return Optional.of(GIF);
        }
        if (startsWithAscii(header, "BM")) {
            return Optional.of(BMP);
        }
        if (header.length >= 12 && startsWithAscii(header, "RIFF")
                && "WEBP".equals(new String(header, 8, 4, StandardCharsets.US_ASCII))) {
            return Optional.of(WEBP);
        }
        String text = new String(header, StandardCharsets.UTF_8).stripLeading().toLowerCase(Locale.ROOT);
        if ((text.startsWith("<?xml") || text.startsWith("<svg") || text.startsWith("<!doctype svg"))
                && text.contains("<svg")) {
            return Optional.of(SVG);
        }
        return Optional.empty();
    }

    private static boolean startsWithAscii(byte[] header, String prefix) {
        return startsWith(header, prefix.getBytes(StandardCharsets.US_ASCII));
    }

    private static boolean startsWith(byte[] header, byte... prefix) {
        if (header.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (header[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
