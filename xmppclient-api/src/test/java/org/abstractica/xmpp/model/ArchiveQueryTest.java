package org.abstractica.xmpp.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ArchiveQuery} and {@link PageRequest}.
 */
class ArchiveQueryTest
{
    @Test
    void build_withoutQueryId_generatesUniqueIds()
    {
        ArchiveQuery first = ArchiveQuery.builder().build();
        ArchiveQuery second = ArchiveQuery.builder().build();

        assertFalse(first.queryId().isEmpty());
        assertNotEquals(first.queryId(), second.queryId());
        assertFalse(first.hasFilter());
    }

    @Test
    void build_withFilters()
    {
        ArchiveQuery query = ArchiveQuery.builder()
                .queryId("q-1")
                .with("bob@example.com")
                .start(Instant.parse("2024-01-01T00:00:00Z"))
                .page(PageRequest.latest(20))
                .build();

        assertEquals("q-1", query.queryId());
        assertTrue(query.hasFilter());
        assertEquals("bob@example.com", query.with().orElseThrow());
        assertTrue(query.end().isEmpty());
    }

    @Test
    void build_endBeforeStart_throws()
    {
        ArchiveQuery.Builder builder = ArchiveQuery.builder()
                .start(Instant.parse("2024-01-02T00:00:00Z"))
                .end(Instant.parse("2024-01-01T00:00:00Z"));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void pageRequest_latest_usesEmptyBefore()
    {
        PageRequest page = PageRequest.latest(10);

        assertEquals(10, page.max());
        assertEquals("", page.before());
        assertNull(page.after());
    }

    @Test
    void pageRequest_cursors()
    {
        assertEquals("a-5", PageRequest.before("a-5", 3).before());
        assertEquals("a-5", PageRequest.after("a-5", 3).after());
    }

    @Test
    void pageRequest_negativeMax_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(-1, null, null, null));
    }

    @Test
    void readStatus_unknown_isNeitherDeliveredNorRead()
    {
        assertFalse(ReadStatus.UNKNOWN.delivered());
        assertFalse(ReadStatus.UNKNOWN.read());
        assertTrue(ReadStatus.UNKNOWN.timestamp().isEmpty());
    }

    @Test
    void withReadStatus_returnsCopy()
    {
        ChatMessage message = new ChatMessage("m-1", Optional.empty(), "bob@example.com",
                "alice@example.com", Instant.EPOCH, "hi", Optional.empty());

        DomainMessage resolved = message.withReadStatus(ReadStatus.UNKNOWN);

        assertTrue(message.readStatus().isEmpty());
        assertEquals(ReadStatus.UNKNOWN, resolved.readStatus().orElseThrow());
        assertEquals("hi", resolved.body());
    }
}
