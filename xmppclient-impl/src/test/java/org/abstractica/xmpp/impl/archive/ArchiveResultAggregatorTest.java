package org.abstractica.xmpp.impl.archive;

import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.ChatMessage;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.PagingCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ArchiveResultAggregator}.
 */
class ArchiveResultAggregatorTest
{
    private ArchiveResultAggregator aggregator;

    @BeforeEach
    void setUp()
    {
        aggregator = new ArchiveResultAggregator();
    }

    private static DomainMessage message(String body)
    {
        return new ChatMessage("id-" + body, Optional.empty(), "bob@example.com", "alice@example.com",
                Instant.EPOCH, body, Optional.empty());
    }

    @Test
    void terminal_afterItems_returnsItemsInArrivalOrder()
    {
        List<DomainMessage> sent = new ArrayList<>();
        for (int i = 0; i < 5; i++)
        {
            DomainMessage m = message("m" + i);
            sent.add(m);
            aggregator.onItem("q-1", m);
        }

        ArchiveResult result = aggregator.onTerminal("q-1", true, Optional.empty());

        assertEquals("q-1", result.queryId());
        assertTrue(result.complete());
        assertEquals(sent, result.messages());
        assertFalse(aggregator.isPending("q-1"));
    }

    @Test
    void secondTerminal_forSameQuery_isEmpty()
    {
        aggregator.onItem("q-1", message("a"));
        aggregator.onTerminal("q-1", true, Optional.empty());

        ArchiveResult second = aggregator.onTerminal("q-1", true, Optional.empty());

        assertTrue(second.messages().isEmpty());
    }

    @Test
    void terminal_withoutItems_isEmptyResult()
    {
        PagingCursor cursor = new PagingCursor(Optional.empty(), Optional.empty(), Optional.of(0));

        ArchiveResult result = aggregator.onTerminal("unknown", false, Optional.of(cursor));

        assertTrue(result.messages().isEmpty());
        assertFalse(result.complete());
        assertEquals(Optional.of(cursor), result.paging());
    }

    @Test
    void interleavedQueries_areKeptApart()
    {
        aggregator.onItem("q-1", message("a"));
        aggregator.onItem("q-2", message("x"));
        aggregator.onItem("q-1", message("b"));

        assertEquals(2, aggregator.pendingCount());
        assertEquals(List.of(message("a"), message("b")),
                aggregator.onTerminal("q-1", true, Optional.empty()).messages());
        assertEquals(List.of(message("x")),
                aggregator.onTerminal("q-2", true, Optional.empty()).messages());
    }

    @Test
    void duplicates_areKept()
    {
        aggregator.onItem("q-1", message("a"));
        aggregator.onItem("q-1", message("a"));

        assertEquals(2, aggregator.onTerminal("q-1", true, Optional.empty()).messages().size());
    }

    @Test
    void reset_discardsPartials()
    {
        aggregator.onItem("q-1", message("a"));

        aggregator.reset();

        assertEquals(0, aggregator.pendingCount());
        assertTrue(aggregator.onTerminal("q-1", true, Optional.empty()).messages().isEmpty());
    }
}
