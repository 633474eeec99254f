package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A message archive query.
 *
 * <p>Build with {@link #builder()}. When no query id is supplied a random one
 * is assigned; the id must stay unique while the query's result is being
 * collected.</p>
 *
 * <pre>{@code
 * ArchiveQuery query = ArchiveQuery.builder()
 *     .with("bob@example.com")
 *     .start(Instant.parse("2024-01-01T00:00:00Z"))
 *     .page(PageRequest.latest(50))
 *     .build();
 * }</pre>
 *
 * @param queryId   id echoed by every result frame
 * @param with      restrict to conversations with this address
 * @param start     earliest message timestamp
 * @param end       latest message timestamp
 * @param fullText  full-text search term
 * @param page      paging controls
 * @param node      archive node, for archives other than the account's own
 * @param namespace archive protocol namespace; empty for the default
 */
public record ArchiveQuery(
        String queryId,
        Optional<String> with,
        Optional<Instant> start,
        Optional<Instant> end,
        Optional<String> fullText,
        Optional<PageRequest> page,
        Optional<String> node,
        Optional<String> namespace
)
{
    public ArchiveQuery
    {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(with, "with");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(fullText, "fullText");
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(namespace, "namespace");
        if (start.isPresent() && end.isPresent() && end.get().isBefore(start.get()))
        {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Returns whether the query carries any filter field.
     *
     * @return true if a data form is needed
     */
    public boolean hasFilter()
    {
        return with.isPresent() || start.isPresent() || end.isPresent() || fullText.isPresent();
    }

    /**
     * Builder for {@link ArchiveQuery}.
     */
    public static final class Builder
    {
        private String queryId;
        private String with;
        private Instant start;
        private Instant end;
        private String fullText;
        private PageRequest page;
        private String node;
        private String namespace;

        private Builder()
        {
        }

        public Builder queryId(String queryId)
        {
            this.queryId = queryId;
            return this;
        }

        public Builder with(String with)
        {
            this.with = with;
            return this;
        }

        public Builder start(Instant start)
        {
            this.start = start;
            return this;
        }

        public Builder end(Instant end)
        {
            this.end = end;
            return this;
        }

        public Builder fullText(String fullText)
        {
            this.fullText = fullText;
            return this;
        }

        public Builder page(PageRequest page)
        {
            this.page = page;
            return this;
        }

        public Builder node(String node)
        {
            this.node = node;
            return this;
        }

        public Builder namespace(String namespace)
        {
            this.namespace = namespace;
            return this;
        }

        public ArchiveQuery build()
        {
            return new ArchiveQuery(
                    queryId != null ? queryId : UUID.randomUUID().toString(),
                    Optional.ofNullable(with),
                    Optional.ofNullable(start),
                    Optional.ofNullable(end),
                    Optional.ofNullable(fullText),
                    Optional.ofNullable(page),
                    Optional.ofNullable(node),
                    Optional.ofNullable(namespace)
            );
        }
    }
}
