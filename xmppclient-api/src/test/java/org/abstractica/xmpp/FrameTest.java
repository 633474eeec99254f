package org.abstractica.xmpp;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Frame}.
 */
class FrameTest
{
    private static Frame message()
    {
        return Frame.builder("message")
                .attribute("to", "bob@example.com")
                .attribute("type", "chat")
                .attribute("id", null)
                .child(Frame.builder("request").namespace("urn:xmpp:receipts").build())
                .child(Frame.builder("request").namespace("urn:example:other").build())
                .textChild("body", "a < b & \"c\"")
                .build();
    }

    @Test
    void builder_skipsNullAttributes()
    {
        Frame frame = message();

        assertNull(frame.getAttribute("id"));
        assertEquals(List.of("to", "type"), List.copyOf(frame.getAttributes().keySet()));
    }

    @Test
    void getChild_matchesNameAndNamespace()
    {
        Frame frame = message();

        assertEquals("urn:xmpp:receipts", frame.getChild("request").getNamespace());
        assertEquals("urn:example:other", frame.getChild("request", "urn:example:other").getNamespace());
        assertNull(frame.getChild("request", "urn:missing"));
        assertTrue(frame.findChild("request", "urn:missing").isEmpty());
        assertEquals(2, frame.getChildren("request").size());
    }

    @Test
    void getChildText_returnsTextOrNull()
    {
        Frame frame = message();

        assertEquals("a < b & \"c\"", frame.getChildText("body"));
        assertNull(frame.getChildText("subject"));
        assertEquals("", frame.getChild("request").getText());
    }

    @Test
    void withAttribute_returnsModifiedCopy()
    {
        Frame original = Frame.of("iq", Map.of("type", "get"));

        Frame copy = original.withAttribute("id", "q-1");

        assertNull(original.getAttribute("id"));
        assertEquals("q-1", copy.getAttribute("id"));
        assertEquals("get", copy.getAttribute("type"));
    }

    @Test
    void toXml_escapesTextAndAttributes()
    {
        Frame frame = Frame.builder("body").attribute("note", "\"quoted\"").text("1 < 2 & 3").build();

        assertEquals("<body note=\"&quot;quoted&quot;\">1 &lt; 2 &amp; 3</body>", frame.toXml());
        assertEquals("<ping/>", Frame.builder("ping").build().toXml());
    }

    @Test
    void equality_isStructural()
    {
        assertEquals(message(), message());
        assertEquals(message().hashCode(), message().hashCode());
        assertNotEquals(message(), message().withAttribute("id", "x"));
    }

    @Test
    void attributesAndChildren_areImmutable()
    {
        Frame frame = message();

        assertThrows(UnsupportedOperationException.class, () -> frame.getAttributes().put("x", "y"));
        assertThrows(UnsupportedOperationException.class, () -> frame.getChildren().add("text"));
    }
}
