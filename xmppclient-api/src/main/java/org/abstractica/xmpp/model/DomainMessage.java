package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A message received from, or archived by, the server.
 *
 * <p>Sealed over the three message shapes the client understands, enabling
 * exhaustive handling of chat, file and group-chat messages.</p>
 */
public sealed interface DomainMessage permits ChatMessage, FileMessage, GroupChatMessage
{
    /**
     * Returns the sender-assigned message id.
     *
     * @return the id, may be null if the sender did not assign one
     */
    String id();

    /**
     * Returns the server-assigned archive id ({@code stanza-id}), if any.
     *
     * @return the archive id
     */
    Optional<String> archiveId();

    String from();

    String to();

    /**
     * Returns when the message was sent, taken from its delay stamp when
     * present and otherwise from the time it was parsed.
     *
     * @return the timestamp
     */
    Instant timestamp();

    String body();

    /**
     * Returns the read status looked up for this message, if resolved.
     *
     * @return the status
     */
    Optional<ReadStatus> readStatus();

    /**
     * Returns a copy of this message carrying the given read status.
     *
     * @param status the resolved status
     * @return the new message
     */
    DomainMessage withReadStatus(ReadStatus status);
}
