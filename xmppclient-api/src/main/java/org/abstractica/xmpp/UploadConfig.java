package org.abstractica.xmpp;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Limits and extra request headers applied to attachment uploads.
 *
 * @param maxFileSize      largest accepted attachment, in bytes
 * @param allowedMimeTypes content types accepted for upload
 * @param headers          extra headers sent with every upload PUT
 */
public record UploadConfig(
        long maxFileSize,
        Set<String> allowedMimeTypes,
        Map<String, String> headers
)
{
    /**
     * Default maximum attachment size (10 MiB).
     */
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    /**
     * Content types accepted when none are configured.
     */
    public static final Set<String> DEFAULT_MIME_TYPES = Set.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "image/webp",
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "text/plain",
            "text/markdown",
            "application/zip",
            "application/x-rar-compressed",
            "application/x-7z-compressed"
    );

    public UploadConfig
    {
        if (maxFileSize <= 0)
        {
            throw new IllegalArgumentException("maxFileSize must be positive: " + maxFileSize);
        }
        allowedMimeTypes = Set.copyOf(new LinkedHashSet<>(Objects.requireNonNull(allowedMimeTypes, "allowedMimeTypes")));
        headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
    }

    /**
     * Returns the default upload configuration.
     *
     * @return 10 MiB limit, the default content types, no extra headers
     */
    public static UploadConfig defaults()
    {
        return new UploadConfig(DEFAULT_MAX_FILE_SIZE, DEFAULT_MIME_TYPES, Map.of());
    }

    public boolean allows(String mimeType)
    {
        return mimeType != null && allowedMimeTypes.contains(mimeType);
    }
}
