package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivery and read state recorded by the server for one message.
 *
 * @param delivered whether the recipient's client acknowledged delivery
 * @param read      whether the recipient displayed the message
 * @param timestamp when the status last changed, if the server reported it
 */
public record ReadStatus(
        boolean delivered,
        boolean read,
        Optional<Instant> timestamp
)
{
    /**
     * Status of a message the server has no record for.
     */
    public static final ReadStatus UNKNOWN = new ReadStatus(false, false, Optional.empty());

    public ReadStatus
    {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
