package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A message announcing an uploaded file.
 *
 * @param url      download URL of the file
 * @param name     file name
 * @param size     size as announced by the sender, in bytes; the raw attribute text
 * @param mimeType content type as announced by the sender
 */
public record FileMessage(
        String id,
        Optional<String> archiveId,
        String from,
        String to,
        Instant timestamp,
        String body,
        Optional<ReadStatus> readStatus,
        String url,
        String name,
        String size,
        String mimeType
) implements DomainMessage
{
    public FileMessage
    {
        Objects.requireNonNull(archiveId, "archiveId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(readStatus, "readStatus");
    }

    @Override
    public FileMessage withReadStatus(ReadStatus status)
    {
        return new FileMessage(id, archiveId, from, to, timestamp, body, Optional.of(status),
                url, name, size, mimeType);
    }
}
