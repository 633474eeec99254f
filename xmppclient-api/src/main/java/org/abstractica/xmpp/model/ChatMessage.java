package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A one-to-one text message.
 */
public record ChatMessage(
        String id,
        Optional<String> archiveId,
        String from,
        String to,
        Instant timestamp,
        String body,
        Optional<ReadStatus> readStatus
) implements DomainMessage
{
    public ChatMessage
    {
        Objects.requireNonNull(archiveId, "archiveId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(readStatus, "readStatus");
    }

    @Override
    public ChatMessage withReadStatus(ReadStatus status)
    {
        return new ChatMessage(id, archiveId, from, to, timestamp, body, Optional.of(status));
    }
}
