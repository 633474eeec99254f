package org.abstractica.xmpp.impl.dispatch;

import org.abstractica.xmpp.ConnectionStatus;
import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.impl.archive.ArchiveResultAggregator;
import org.abstractica.xmpp.impl.stanza.Namespaces;
import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.Presence;
import org.abstractica.xmpp.model.Receipt;
import org.abstractica.xmpp.model.ReceiptType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Dispatcher}.
 */
class DispatcherTest
{
    private ArchiveResultAggregator aggregator;
    private Dispatcher dispatcher;

    private final List<Presence> presences = new ArrayList<>();
    private final List<DomainMessage> messages = new ArrayList<>();
    private final List<Receipt> receipts = new ArrayList<>();
    private final List<ArchiveResult> results = new ArrayList<>();

    @BeforeEach
    void setUp()
    {
        aggregator = new ArchiveResultAggregator();
        dispatcher = new Dispatcher(aggregator, new DispatchListener()
        {
            @Override
            public void onPresence(Presence presence)
            {
                presences.add(presence);
            }

            @Override
            public void onMessage(DomainMessage message)
            {
                messages.add(message);
            }

            @Override
            public void onReceipt(Receipt receipt)
            {
                receipts.add(receipt);
            }

            @Override
            public void onArchiveResult(ArchiveResult result)
            {
                results.add(result);
            }
        });
    }

    private static Frame chat(String id, String body)
    {
        return Frame.builder("message")
                .attribute("id", id)
                .attribute("from", "bob@example.com")
                .attribute("to", "alice@example.com")
                .attribute("type", "chat")
                .textChild("body", body)
                .build();
    }

    private static Frame archiveItem(String queryId, String body)
    {
        return Frame.builder("message")
                .attribute("from", "alice@example.com")
                .child(Frame.builder("result").namespace(Namespaces.MAM).attribute("queryid", queryId)
                        .child(Frame.builder("forwarded").namespace(Namespaces.FORWARD)
                                .child(chat("a-" + body, body))
                                .build())
                        .build())
                .build();
    }

    private static Frame fin(String queryId)
    {
        return Frame.builder("iq")
                .attribute("type", "result")
                .attribute("id", queryId)
                .child(Frame.builder("fin").namespace(Namespaces.MAM).attribute("complete", "true").build())
                .build();
    }

    private static Frame receipt(String marker, String id)
    {
        return Frame.builder("message")
                .attribute("from", "bob@example.com")
                .child(Frame.builder(marker).namespace(Namespaces.RECEIPTS).attribute("id", id).build())
                .build();
    }

    // ========== Classification ==========

    @Test
    void classify_followsPrecedence()
    {
        assertEquals(StanzaKind.PRESENCE, Dispatcher.classify(Frame.builder("presence").build()));
        assertEquals(StanzaKind.ARCHIVE_ITEM, Dispatcher.classify(archiveItem("q", "x")));
        assertEquals(StanzaKind.ARCHIVE_TERMINAL, Dispatcher.classify(fin("q")));
        assertEquals(StanzaKind.RECEIPT, Dispatcher.classify(receipt("received", "m")));
        assertEquals(StanzaKind.RECEIPT, Dispatcher.classify(receipt("displayed", "m")));
        assertEquals(StanzaKind.MESSAGE, Dispatcher.classify(chat("m", "hi")));
        assertEquals(StanzaKind.UNCLASSIFIED, Dispatcher.classify(Frame.builder("iq").attribute("type", "result").build()));
    }

    @Test
    void classify_archiveBeatsReceipt()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("received").namespace(Namespaces.RECEIPTS).attribute("id", "m").build())
                .child(Frame.builder("result").namespace(Namespaces.MAM).attribute("queryid", "q").build())
                .build();

        assertEquals(StanzaKind.ARCHIVE_ITEM, Dispatcher.classify(frame));
    }

    @Test
    void classify_finInMessage_isTerminal()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("fin").namespace(Namespaces.MAM).attribute("queryid", "q").build())
                .build();

        assertEquals(StanzaKind.ARCHIVE_TERMINAL, Dispatcher.classify(frame));
    }

    @Test
    void classify_receiptMarkerInOtherNamespace_isMessage()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("received").namespace("urn:example:other").build())
                .build();

        assertEquals(StanzaKind.MESSAGE, Dispatcher.classify(frame));
    }

    // ========== Routing ==========

    @Test
    void presence_isEmitted()
    {
        dispatcher.onFrame(Frame.builder("presence").attribute("from", "bob@example.com").build());

        assertEquals(1, presences.size());
        assertTrue(messages.isEmpty());
    }

    @Test
    void message_isEmitted()
    {
        dispatcher.onFrame(chat("m-1", "hello"));

        assertEquals(1, messages.size());
        assertEquals("hello", messages.get(0).body());
    }

    @Test
    void receipt_isEmittedNotAsMessage()
    {
        dispatcher.onFrame(receipt("displayed", "m-1"));

        assertEquals(1, receipts.size());
        assertEquals(ReceiptType.DISPLAYED, receipts.get(0).type());
        assertTrue(messages.isEmpty());
    }

    @Test
    void archiveItems_areEmittedOnlyOnTerminal()
    {
        dispatcher.onFrame(archiveItem("q-1", "first"));
        dispatcher.onFrame(archiveItem("q-1", "second"));

        assertTrue(results.isEmpty());
        assertTrue(messages.isEmpty());

        dispatcher.onFrame(fin("q-1"));

        assertEquals(1, results.size());
        ArchiveResult result = results.get(0);
        assertEquals("q-1", result.queryId());
        assertTrue(result.complete());
        assertEquals(List.of("first", "second"), result.messages().stream().map(DomainMessage::body).toList());
    }

    @Test
    void unclassified_isDropped()
    {
        dispatcher.onFrame(Frame.builder("iq").attribute("type", "get").build());

        assertTrue(presences.isEmpty());
        assertTrue(messages.isEmpty());
        assertTrue(receipts.isEmpty());
        assertTrue(results.isEmpty());
    }

    @Test
    void leavingOnline_resetsPartialResults()
    {
        dispatcher.onFrame(archiveItem("q-1", "lost"));
        dispatcher.onStatus(ConnectionStatus.ONLINE);
        assertTrue(aggregator.isPending("q-1"));

        dispatcher.onStatus(ConnectionStatus.ERROR);

        assertFalse(aggregator.isPending("q-1"));
        dispatcher.onFrame(fin("q-1"));
        assertTrue(results.get(0).messages().isEmpty());
    }
}
