package org.abstractica.xmpp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable XML element as exchanged with the XMPP engine.
 *
 * <p>A frame has a name, an ordered attribute map and ordered children, each
 * child being either a {@link String} text node or a nested frame. The
 * namespace of an element is its {@code xmlns} attribute; children without
 * one are matched by name only.</p>
 *
 * <pre>{@code
 * Frame message = Frame.builder("message")
 *     .attribute("to", "bob@example.com")
 *     .attribute("type", "chat")
 *     .child(Frame.builder("body").text("hi").build())
 *     .build();
 * }</pre>
 */
public final class Frame
{
    private final String name;
    private final Map<String, String> attributes;
    private final List<Object> children;

    private Frame(String name, Map<String, String> attributes, List<Object> children)
    {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = List.copyOf(children);
    }

    /**
     * Creates a builder for an element with the given name.
     *
     * @param name the element name
     * @return a new builder
     */
    public static Builder builder(String name)
    {
        return new Builder(name);
    }

    /**
     * Creates a childless element with the given attributes.
     *
     * @param name       the element name
     * @param attributes attribute map, copied
     * @return the frame
     */
    public static Frame of(String name, Map<String, String> attributes)
    {
        return builder(name).attributes(attributes).build();
    }

    public String getName()
    {
        return name;
    }

    public boolean is(String name)
    {
        return this.name.equals(name);
    }

    public Map<String, String> getAttributes()
    {
        return attributes;
    }

    /**
     * Returns an attribute value.
     *
     * @param name the attribute name
     * @return the value, or null if absent
     */
    public String getAttribute(String name)
    {
        return attributes.get(name);
    }

    /**
     * Returns the {@code xmlns} attribute of this element.
     *
     * @return the namespace, or null if not declared on this element
     */
    public String getNamespace()
    {
        return attributes.get("xmlns");
    }

    public List<Object> getChildren()
    {
        return children;
    }

    /**
     * Returns the first child element with the given name.
     *
     * @param name the child element name
     * @return the child, or null if absent
     */
    public Frame getChild(String name)
    {
        for (Object child : children)
        {
            if (child instanceof Frame frame && frame.is(name))
            {
                return frame;
            }
        }
        return null;
    }

    /**
     * Returns the first child element with the given name and namespace.
     *
     * @param name      the child element name
     * @param namespace the required {@code xmlns} value
     * @return the child, or null if absent
     */
    public Frame getChild(String name, String namespace)
    {
        for (Object child : children)
        {
            if (child instanceof Frame frame && frame.is(name) && namespace.equals(frame.getNamespace()))
            {
                return frame;
            }
        }
        return null;
    }

    public Optional<Frame> findChild(String name, String namespace)
    {
        return Optional.ofNullable(getChild(name, namespace));
    }

    /**
     * Returns all child elements with the given name, in document order.
     *
     * @param name the child element name
     * @return matching children, possibly empty
     */
    public List<Frame> getChildren(String name)
    {
        List<Frame> result = new ArrayList<>();
        for (Object child : children)
        {
            if (child instanceof Frame frame && frame.is(name))
            {
                result.add(frame);
            }
        }
        return result;
    }

    /**
     * Returns the concatenated text children of this element.
     *
     * @return the text, empty if there are no text children
     */
    public String getText()
    {
        StringBuilder sb = new StringBuilder();
        for (Object child : children)
        {
            if (child instanceof String text)
            {
                sb.append(text);
            }
        }
        return sb.toString();
    }

    /**
     * Returns the text of the first child element with the given name.
     *
     * @param name the child element name
     * @return the text, or null if the child is absent
     */
    public String getChildText(String name)
    {
        Frame child = getChild(name);
        return child != null ? child.getText() : null;
    }

    /**
     * Returns a copy of this frame with one attribute set or replaced.
     *
     * @param name  the attribute name
     * @param value the attribute value
     * @return the new frame
     */
    public Frame withAttribute(String name, String value)
    {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return new Frame(this.name, copy, children);
    }

    /**
     * Renders this frame as compact XML, for logging.
     *
     * @return the XML string
     */
    public String toXml()
    {
        StringBuilder sb = new StringBuilder();
        appendXml(sb);
        return sb.toString();
    }

    private void appendXml(StringBuilder sb)
    {
        sb.append('<').append(name);
        for (Map.Entry<String, String> entry : attributes.entrySet())
        {
            sb.append(' ').append(entry.getKey()).append("=\"").append(escape(entry.getValue())).append('"');
        }
        if (children.isEmpty())
        {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (Object child : children)
        {
            if (child instanceof Frame frame)
            {
                frame.appendXml(sb);
            }
            else
            {
                sb.append(escape((String) child));
            }
        }
        sb.append("</").append(name).append('>');
    }

    private static String escape(String value)
    {
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof Frame other))
        {
            return false;
        }
        return name.equals(other.name)
                && attributes.equals(other.attributes)
                && children.equals(other.children);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, attributes, children);
    }

    @Override
    public String toString()
    {
        return toXml();
    }

    /**
     * Builder for frames. Attributes keep insertion order; null attribute
     * values are skipped so optional attributes can be set unconditionally.
     */
    public static final class Builder
    {
        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Object> children = new ArrayList<>();

        private Builder(String name)
        {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder attribute(String name, String value)
        {
            Objects.requireNonNull(name, "name");
            if (value != null)
            {
                attributes.put(name, value);
            }
            return this;
        }

        public Builder attributes(Map<String, String> attributes)
        {
            attributes.forEach(this::attribute);
            return this;
        }

        public Builder namespace(String namespace)
        {
            return attribute("xmlns", namespace);
        }

        public Builder child(Frame child)
        {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder text(String text)
        {
            children.add(Objects.requireNonNull(text, "text"));
            return this;
        }

        /**
         * Appends a child element containing only text.
         *
         * @param name the child element name
         * @param text the text content
         * @return this builder
         */
        public Builder textChild(String name, String text)
        {
            return child(new Builder(name).text(text).build());
        }

        public Frame build()
        {
            return new Frame(name, attributes, children);
        }
    }
}
