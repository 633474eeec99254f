package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A message sent to a multi-user chat room.
 *
 * @param roomAddress bare address of the room
 * @param nickname    occupant nickname of the sender, empty if the room itself sent it
 */
public record GroupChatMessage(
        String id,
        Optional<String> archiveId,
        String from,
        String to,
        Instant timestamp,
        String body,
        Optional<ReadStatus> readStatus,
        String roomAddress,
        String nickname
) implements DomainMessage
{
    public GroupChatMessage
    {
        Objects.requireNonNull(archiveId, "archiveId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(readStatus, "readStatus");
        Objects.requireNonNull(roomAddress, "roomAddress");
        Objects.requireNonNull(nickname, "nickname");
    }

    @Override
    public GroupChatMessage withReadStatus(ReadStatus status)
    {
        return new GroupChatMessage(id, archiveId, from, to, timestamp, body, Optional.of(status),
                roomAddress, nickname);
    }
}
