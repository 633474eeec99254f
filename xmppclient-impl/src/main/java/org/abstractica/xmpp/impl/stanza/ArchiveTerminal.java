package org.abstractica.xmpp.impl.stanza;

import org.abstractica.xmpp.model.PagingCursor;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code fin} element closing an archive query result.
 *
 * @param queryId  id of the finished query
 * @param complete whether the server reports the last page
 * @param paging   result set markers, if present
 */
public record ArchiveTerminal(
        String queryId,
        boolean complete,
        Optional<PagingCursor> paging
)
{
    public ArchiveTerminal
    {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(paging, "paging");
    }
}
