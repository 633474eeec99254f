package org.abstractica.xmpp.model;

import java.util.Objects;

/**
 * Acknowledgement that a recipient received or displayed a message.
 *
 * @param from address of the acknowledging recipient
 * @param id   id of the acknowledged message
 * @param type receipt kind
 */
public record Receipt(
        String from,
        String id,
        ReceiptType type
)
{
    public Receipt
    {
        Objects.requireNonNull(type, "type");
    }
}
