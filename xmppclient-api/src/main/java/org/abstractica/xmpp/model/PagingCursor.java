package org.abstractica.xmpp.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result set markers returned with a completed archive query.
 *
 * @param first archive id of the first message in the page
 * @param last  archive id of the last message in the page
 * @param count total number of items matching the query, if reported
 */
public record PagingCursor(
        Optional<String> first,
        Optional<String> last,
        Optional<Integer> count
)
{
    public PagingCursor
    {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
        Objects.requireNonNull(count, "count");
    }
}
