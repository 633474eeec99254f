package org.abstractica.xmpp.impl.archive;

import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.PagingCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects archive result items per query until the query's terminal
 * element arrives.
 *
 * <p>Items keep their arrival order; nothing is reordered or deduplicated.
 * A terminal for an unknown query yields an empty result. Not thread-safe:
 * use from the connection's event loop only.</p>
 */
public class ArchiveResultAggregator
{
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveResultAggregator.class);

    private final Map<String, List<DomainMessage>> partials;

    public ArchiveResultAggregator()
    {
        this.partials = new LinkedHashMap<>();
    }

    /**
     * Appends one item to the partial result of a query.
     *
     * @param queryId the query id
     * @param message the archived message
     */
    public void onItem(String queryId, DomainMessage message)
    {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(message, "message");
        partials.computeIfAbsent(queryId, id -> new ArrayList<>()).add(message);
    }

    /**
     * Completes a query, removing its partial result.
     *
     * @param queryId  the query id
     * @param complete whether the server reports the last page
     * @param paging   result set markers
     * @return the complete result, with no messages if none were collected
     */
    public ArchiveResult onTerminal(String queryId, boolean complete, Optional<PagingCursor> paging)
    {
        Objects.requireNonNull(queryId, "queryId");
        List<DomainMessage> messages = partials.remove(queryId);
        if (messages == null)
        {
            LOG.debug("Terminal for query {} without collected items", queryId);
            messages = List.of();
        }
        return new ArchiveResult(queryId, complete, messages, paging);
    }

    /**
     * Discards every partial result. Queries in flight are not resumed.
     */
    public void reset()
    {
        if (!partials.isEmpty())
        {
            LOG.debug("Discarding {} partial archive results", partials.size());
            partials.clear();
        }
    }

    public boolean isPending(String queryId)
    {
        return partials.containsKey(queryId);
    }

    public int pendingCount()
    {
        return partials.size();
    }
}
