package org.abstractica.xmpp.impl.stanza;

import org.abstractica.xmpp.model.DomainMessage;

import java.util.Objects;

/**
 * One archived message delivered as part of an archive query result.
 *
 * @param queryId id of the query the item belongs to
 * @param message the archived message
 */
public record ArchiveItem(
        String queryId,
        DomainMessage message
)
{
    public ArchiveItem
    {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(message, "message");
    }
}
