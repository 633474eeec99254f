package org.abstractica.xmpp.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Conversation thread a message belongs to.
 *
 * @param id     thread id
 * @param parent id of the parent thread, if this is a sub-thread
 */
public record ThreadInfo(
        String id,
        Optional<String> parent
)
{
    public ThreadInfo
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(parent, "parent");
    }

    public static ThreadInfo of(String id)
    {
        return new ThreadInfo(id, Optional.empty());
    }
}
