package org.abstractica.xmpp.model;

/**
 * Presence stanza types. {@link #AVAILABLE} is sent without a type attribute.
 */
public enum PresenceType
{
    AVAILABLE(null),
    UNAVAILABLE("unavailable"),
    SUBSCRIBE("subscribe"),
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBE("unsubscribe"),
    UNSUBSCRIBED("unsubscribed"),
    PROBE("probe"),
    ERROR("error");

    private final String wireValue;

    PresenceType(String wireValue)
    {
        this.wireValue = wireValue;
    }

    /**
     * Returns the value of the {@code type} attribute.
     *
     * @return the attribute value, or null for available presence
     */
    public String getWireValue()
    {
        return wireValue;
    }

    /**
     * Maps a {@code type} attribute to a presence type.
     *
     * @param value the attribute value, null for available presence
     * @return the type
     * @throws IllegalArgumentException if the value is not a presence type
     */
    public static PresenceType fromWire(String value)
    {
        if (value == null || value.isEmpty())
        {
            return AVAILABLE;
        }
        for (PresenceType type : values())
        {
            if (value.equals(type.wireValue))
            {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown presence type: " + value);
    }
}
