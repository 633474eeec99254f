package org.abstractica.xmpp.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Optional extensions of an outgoing message.
 *
 * @param id             message id; a random one is used when empty
 * @param thread         conversation thread
 * @param delay          original send time, for delayed delivery
 * @param replacesId     id of a previous message this one corrects
 * @param priority       delivery priority hint
 * @param requestReceipt whether to request a delivery receipt
 * @param markable       whether the message may be marked as displayed
 */
public record MessageOptions(
        Optional<String> id,
        Optional<ThreadInfo> thread,
        Optional<Instant> delay,
        Optional<String> replacesId,
        Optional<Priority> priority,
        boolean requestReceipt,
        boolean markable
)
{
    private static final MessageOptions NONE = builder().build();

    /**
     * Message priority hints, sent as a lower-case attribute.
     */
    public enum Priority
    {
        HIGH,
        MEDIUM,
        LOW
    }

    public static MessageOptions none()
    {
        return NONE;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Builder for {@link MessageOptions}.
     */
    public static final class Builder
    {
        private String id;
        private ThreadInfo thread;
        private Instant delay;
        private String replacesId;
        private Priority priority;
        private boolean requestReceipt;
        private boolean markable;

        private Builder()
        {
        }

        public Builder id(String id)
        {
            this.id = id;
            return this;
        }

        public Builder thread(ThreadInfo thread)
        {
            this.thread = thread;
            return this;
        }

        public Builder delay(Instant delay)
        {
            this.delay = delay;
            return this;
        }

        public Builder replacesId(String replacesId)
        {
            this.replacesId = replacesId;
            return this;
        }

        public Builder priority(Priority priority)
        {
            this.priority = priority;
            return this;
        }

        public Builder requestReceipt(boolean requestReceipt)
        {
            this.requestReceipt = requestReceipt;
            return this;
        }

        public Builder markable(boolean markable)
        {
            this.markable = markable;
            return this;
        }

        public MessageOptions build()
        {
            return new MessageOptions(
                    Optional.ofNullable(id),
                    Optional.ofNullable(thread),
                    Optional.ofNullable(delay),
                    Optional.ofNullable(replacesId),
                    Optional.ofNullable(priority),
                    requestReceipt,
                    markable
            );
        }
    }
}
