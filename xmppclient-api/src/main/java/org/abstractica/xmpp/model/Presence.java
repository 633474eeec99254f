package org.abstractica.xmpp.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Presence received from a contact or room occupant.
 *
 * @param from   full address of the sender
 * @param type   presence type
 * @param show   availability sub-state ({@code away}, {@code dnd}, ...), if given
 * @param status free-text status, if given
 */
public record Presence(
        String from,
        PresenceType type,
        Optional<String> show,
        Optional<String> status
)
{
    public Presence
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(show, "show");
        Objects.requireNonNull(status, "status");
    }

    public boolean isAvailable()
    {
        return type == PresenceType.AVAILABLE;
    }
}
