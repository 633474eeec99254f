package org.abstractica.xmpp;

import java.util.Objects;

/**
 * Error reported by the server in an {@code iq type="error"} response.
 *
 * @param condition the defined condition element name, e.g. {@code item-not-found}
 * @param type      the error type attribute ({@code cancel}, {@code auth}, ...), may be null
 * @param text      the optional human-readable text, may be null
 */
public record StanzaError(
        String condition,
        String type,
        String text
)
{
    /**
     * Condition used when a response carries no recognisable error element.
     */
    public static final String UNDEFINED_CONDITION = "undefined-condition";

    public StanzaError
    {
        Objects.requireNonNull(condition, "condition");
    }

    public boolean is(String condition)
    {
        return this.condition.equals(condition);
    }
}
