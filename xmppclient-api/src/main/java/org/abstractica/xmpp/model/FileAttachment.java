package org.abstractica.xmpp.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A local file to be sent as an attachment.
 *
 * @param name        file name announced to the recipient
 * @param contentType MIME type of the content
 * @param content     file bytes
 */
public record FileAttachment(
        String name,
        String contentType,
        byte[] content
)
{
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public FileAttachment
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Reads a file from disk, probing its content type.
     *
     * @param path the file
     * @return the attachment
     * @throws IOException if the file cannot be read
     */
    public static FileAttachment fromPath(Path path) throws IOException
    {
        Objects.requireNonNull(path, "path");
        String contentType = Files.probeContentType(path);
        return new FileAttachment(
                path.getFileName().toString(),
                contentType != null ? contentType : DEFAULT_CONTENT_TYPE,
                Files.readAllBytes(path)
        );
    }

    public long size()
    {
        return content.length;
    }
}
