package org.abstractica.xmpp.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete result of one archive query.
 *
 * <p>Only emitted once the server has sent the terminating {@code fin}
 * element; partial results are never exposed.</p>
 *
 * @param queryId  id of the query this result answers
 * @param complete whether the server reports this as the last page
 * @param messages messages in the order the server sent them
 * @param paging   result set markers, if the server included them
 */
public record ArchiveResult(
        String queryId,
        boolean complete,
        List<DomainMessage> messages,
        Optional<PagingCursor> paging
)
{
    public ArchiveResult
    {
        Objects.requireNonNull(queryId, "queryId");
        messages = List.copyOf(messages);
        Objects.requireNonNull(paging, "paging");
    }

    /**
     * Returns a copy of this result with its messages replaced.
     *
     * @param messages the new messages
     * @return the new result
     */
    public ArchiveResult withMessages(List<DomainMessage> messages)
    {
        return new ArchiveResult(queryId, complete, messages, paging);
    }
}
