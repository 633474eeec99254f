package org.abstractica.xmpp.impl.stanza;

import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.StanzaError;
import org.abstractica.xmpp.model.ChatMessage;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.FileMessage;
import org.abstractica.xmpp.model.GroupChatMessage;
import org.abstractica.xmpp.model.PagingCursor;
import org.abstractica.xmpp.model.Presence;
import org.abstractica.xmpp.model.PresenceType;
import org.abstractica.xmpp.model.ReadStatus;
import org.abstractica.xmpp.model.Receipt;
import org.abstractica.xmpp.model.ReceiptType;
import org.abstractica.xmpp.model.ThreadInfo;
import org.abstractica.xmpp.model.UploadSlot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StanzaParser}.
 */
class StanzaParserTest
{
    private static Frame chat(String body)
    {
        return Frame.builder("message")
                .attribute("id", "m-1")
                .attribute("from", "bob@example.com/phone")
                .attribute("to", "alice@example.com")
                .attribute("type", "chat")
                .textChild("body", body)
                .build();
    }

    // ========== Presence ==========

    @Test
    void parsePresence_available()
    {
        Frame frame = Frame.builder("presence")
                .attribute("from", "bob@example.com/phone")
                .textChild("show", "away")
                .textChild("status", "Lunch")
                .build();

        Presence presence = StanzaParser.parsePresence(frame).orElseThrow();

        assertEquals("bob@example.com/phone", presence.from());
        assertEquals(PresenceType.AVAILABLE, presence.type());
        assertTrue(presence.isAvailable());
        assertEquals(Optional.of("away"), presence.show());
        assertEquals(Optional.of("Lunch"), presence.status());
    }

    @Test
    void parsePresence_typed()
    {
        Frame frame = Frame.builder("presence").attribute("from", "bob@example.com").attribute("type", "subscribe").build();

        assertEquals(PresenceType.SUBSCRIBE, StanzaParser.parsePresence(frame).orElseThrow().type());
    }

    @Test
    void parsePresence_unknownType_isEmpty()
    {
        Frame frame = Frame.builder("presence").attribute("type", "bogus").build();

        assertTrue(StanzaParser.parsePresence(frame).isEmpty());
    }

    @Test
    void parsePresence_notPresence_isEmpty()
    {
        assertTrue(StanzaParser.parsePresence(chat("hi")).isEmpty());
        assertTrue(StanzaParser.parsePresence(null).isEmpty());
    }

    // ========== Messages ==========

    @Test
    void parseMessage_chat()
    {
        Instant before = Instant.now();

        DomainMessage message = StanzaParser.parseMessage(chat("hello")).orElseThrow();

        ChatMessage chat = assertInstanceOf(ChatMessage.class, message);
        assertEquals("m-1", chat.id());
        assertEquals("bob@example.com/phone", chat.from());
        assertEquals("alice@example.com", chat.to());
        assertEquals("hello", chat.body());
        assertTrue(chat.archiveId().isEmpty());
        assertTrue(chat.readStatus().isEmpty());
        assertFalse(chat.timestamp().isBefore(before));
    }

    @Test
    void parseMessage_withoutBody_hasEmptyBody()
    {
        Frame frame = Frame.builder("message").attribute("from", "bob@example.com").build();

        assertEquals("", StanzaParser.parseMessage(frame).orElseThrow().body());
    }

    @Test
    void parseMessage_stanzaIdAndDelay()
    {
        Frame frame = Frame.builder("message")
                .attribute("id", "m-2")
                .attribute("from", "bob@example.com")
                .child(Frame.builder("stanza-id").namespace(Namespaces.STANZA_ID).attribute("id", "arch-9").build())
                .child(Frame.builder("delay").namespace(Namespaces.DELAY).attribute("stamp", "2024-03-01T12:00:00+01:00").build())
                .textChild("body", "late")
                .build();

        DomainMessage message = StanzaParser.parseMessage(frame).orElseThrow();

        assertEquals(Optional.of("arch-9"), message.archiveId());
        assertEquals(Instant.parse("2024-03-01T11:00:00Z"), message.timestamp());
    }

    @Test
    void parseMessage_withUpload_isFileMessage()
    {
        Frame frame = Frame.builder("message")
                .attribute("id", "m-3")
                .attribute("from", "bob@example.com")
                .textChild("body", "see attached")
                .child(Frame.builder("x").namespace(Namespaces.HTTP_UPLOAD)
                        .child(Frame.builder("file")
                                .attribute("name", "report.pdf")
                                .attribute("size", "2048")
                                .attribute("type", "application/pdf")
                                .attribute("url", "https://files.example.com/report.pdf")
                                .build())
                        .build())
                .build();

        FileMessage file = assertInstanceOf(FileMessage.class, StanzaParser.parseMessage(frame).orElseThrow());

        assertEquals("see attached", file.body());
        assertEquals("report.pdf", file.name());
        assertEquals("2048", file.size());
        assertEquals("application/pdf", file.mimeType());
        assertEquals("https://files.example.com/report.pdf", file.url());
    }

    @Test
    void parseMessage_groupchat_splitsRoomAndNickname()
    {
        Frame frame = Frame.builder("message")
                .attribute("from", "room@conference.example.com/bob")
                .attribute("type", "groupchat")
                .textChild("body", "hi all")
                .build();

        GroupChatMessage message = assertInstanceOf(GroupChatMessage.class, StanzaParser.parseMessage(frame).orElseThrow());

        assertEquals("room@conference.example.com", message.roomAddress());
        assertEquals("bob", message.nickname());
    }

    @Test
    void parseMessage_notMessage_isEmpty()
    {
        assertTrue(StanzaParser.parseMessage(Frame.builder("iq").build()).isEmpty());
    }

    @Test
    void messageExtensions_threadReplaceDelay()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("thread").attribute("parent", "t-0").text("t-1").build())
                .child(Frame.builder("replace").namespace(Namespaces.CORRECTION).attribute("id", "old").build())
                .child(Frame.builder("delay").namespace(Namespaces.DELAY).attribute("stamp", "not a date").build())
                .build();

        assertEquals(Optional.of(new ThreadInfo("t-1", Optional.of("t-0"))), StanzaParser.threadOf(frame));
        assertEquals(Optional.of("old"), StanzaParser.replacedIdOf(frame));
        assertTrue(StanzaParser.delayOf(frame).isEmpty());
        assertTrue(StanzaParser.threadOf(chat("x")).isEmpty());
    }

    // ========== Receipts ==========

    @Test
    void parseReceipt_received()
    {
        Frame frame = Frame.builder("message")
                .attribute("from", "bob@example.com/phone")
                .child(Frame.builder("received").namespace(Namespaces.RECEIPTS).attribute("id", "m-1").build())
                .build();

        Receipt receipt = StanzaParser.parseReceipt(frame).orElseThrow();

        assertEquals(new Receipt("bob@example.com/phone", "m-1", ReceiptType.RECEIVED), receipt);
    }

    @Test
    void parseReceipt_chatMarkerDisplayed()
    {
        Frame frame = Frame.builder("message")
                .attribute("from", "bob@example.com")
                .child(Frame.builder("displayed").namespace(Namespaces.CHAT_MARKERS).attribute("id", "m-2").build())
                .build();

        assertEquals(ReceiptType.DISPLAYED, StanzaParser.parseReceipt(frame).orElseThrow().type());
    }

    @Test
    void parseReceipt_withoutMarker_isEmpty()
    {
        assertTrue(StanzaParser.parseReceipt(chat("hi")).isEmpty());
    }

    // ========== Archive ==========

    @Test
    void parseArchiveItem_usesForwardedDelay()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("result").namespace(Namespaces.MAM).attribute("queryid", "q-1").attribute("id", "arch-1")
                        .child(Frame.builder("forwarded").namespace(Namespaces.FORWARD)
                                .child(Frame.builder("delay").namespace(Namespaces.DELAY).attribute("stamp", "2024-01-01T08:00:00Z").build())
                                .child(chat("archived"))
                                .build())
                        .build())
                .build();

        ArchiveItem item = StanzaParser.parseArchiveItem(frame).orElseThrow();

        assertEquals("q-1", item.queryId());
        assertEquals("archived", item.message().body());
        assertEquals(Instant.parse("2024-01-01T08:00:00Z"), item.message().timestamp());
    }

    @Test
    void parseArchiveItem_withoutQueryId_isEmpty()
    {
        Frame frame = Frame.builder("message")
                .child(Frame.builder("result").namespace(Namespaces.MAM)
                        .child(Frame.builder("forwarded").namespace(Namespaces.FORWARD).child(chat("x")).build())
                        .build())
                .build();

        assertTrue(StanzaParser.parseArchiveItem(frame).isEmpty());
    }

    @Test
    void parseArchiveTerminal_prefersFinQueryId()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "result")
                .attribute("id", "iq-1")
                .child(Frame.builder("fin").namespace(Namespaces.MAM).attribute("queryid", "q-1").attribute("complete", "true")
                        .child(Frame.builder("set").namespace(Namespaces.RSM)
                                .textChild("first", "a")
                                .textChild("last", "z")
                                .textChild("count", "26")
                                .build())
                        .build())
                .build();

        ArchiveTerminal terminal = StanzaParser.parseArchiveTerminal(frame).orElseThrow();

        assertEquals("q-1", terminal.queryId());
        assertTrue(terminal.complete());
        assertEquals(Optional.of(new PagingCursor(Optional.of("a"), Optional.of("z"), Optional.of(26))), terminal.paging());
    }

    @Test
    void parseArchiveTerminal_fallsBackToStanzaId()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "result")
                .attribute("id", "q-2")
                .child(Frame.builder("fin").namespace(Namespaces.MAM).build())
                .build();

        ArchiveTerminal terminal = StanzaParser.parseArchiveTerminal(frame).orElseThrow();

        assertEquals("q-2", terminal.queryId());
        assertFalse(terminal.complete());
        assertTrue(terminal.paging().isEmpty());
    }

    // ========== Query Responses ==========

    @Test
    void parseUploadSlot_withHeaders()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "result")
                .child(Frame.builder("slot").namespace(Namespaces.HTTP_UPLOAD)
                        .child(Frame.builder("put").attribute("url", "https://up.example.com/put/1")
                                .child(Frame.builder("header").attribute("name", "Authorization").text("Basic abc").build())
                                .child(Frame.builder("header").attribute("name", "Cookie").build())
                                .build())
                        .child(Frame.builder("get").attribute("url", "https://up.example.com/get/1").build())
                        .build())
                .build();

        UploadSlot slot = StanzaParser.parseUploadSlot(frame).orElseThrow();

        assertEquals("https://up.example.com/put/1", slot.putUrl());
        assertEquals("https://up.example.com/get/1", slot.getUrl());
        assertEquals(Map.of("Authorization", "Basic abc"), slot.putHeaders());
        assertTrue(slot.getHeaders().isEmpty());
    }

    @Test
    void parseUploadSlot_missingGet_isEmpty()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "result")
                .child(Frame.builder("slot").namespace(Namespaces.HTTP_UPLOAD)
                        .child(Frame.builder("put").attribute("url", "https://up.example.com/put/1").build())
                        .build())
                .build();

        assertTrue(StanzaParser.parseUploadSlot(frame).isEmpty());
    }

    @Test
    void parseReadStatus_withTimestamp()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "result")
                .child(Frame.builder("status")
                        .attribute("delivered", "true")
                        .attribute("read", "false")
                        .attribute("timestamp", "1700000000000")
                        .build())
                .build();

        ReadStatus status = StanzaParser.parseReadStatus(frame).orElseThrow();

        assertTrue(status.delivered());
        assertFalse(status.read());
        assertEquals(Optional.of(Instant.ofEpochMilli(1_700_000_000_000L)), status.timestamp());
    }

    @Test
    void parseReadStatus_missingStatus_isEmpty()
    {
        assertTrue(StanzaParser.parseReadStatus(Frame.builder("iq").attribute("type", "result").build()).isEmpty());
    }

    @Test
    void parseStanzaError_conditionTypeAndText()
    {
        Frame frame = Frame.builder("iq")
                .attribute("type", "error")
                .child(Frame.builder("error")
                        .attribute("type", "modify")
                        .child(Frame.builder("bad-request").namespace(Namespaces.STANZA_ERRORS).build())
                        .child(Frame.builder("text").namespace(Namespaces.STANZA_ERRORS).text("Invalid jid").build())
                        .build())
                .build();

        StanzaError error = StanzaParser.parseStanzaError(frame).orElseThrow();

        assertEquals(new StanzaError("bad-request", "modify", "Invalid jid"), error);
    }

    @Test
    void parseStanzaError_withoutCondition_isUndefined()
    {
        Frame frame = Frame.builder("iq").child(Frame.builder("error").build()).build();

        assertEquals(StanzaError.UNDEFINED_CONDITION, StanzaParser.parseStanzaError(frame).orElseThrow().condition());
    }

    @Test
    void parseStanzaError_noErrorElement_isEmpty()
    {
        assertTrue(StanzaParser.parseStanzaError(Frame.builder("iq").build()).isEmpty());
    }
}
