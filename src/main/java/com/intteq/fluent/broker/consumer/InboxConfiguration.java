package com.intteq.fluent.broker.consumer;

import com.intteq.fluent.broker.capability.Inbox;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * How inbound messages are de-duplicated. Without an {@link Inbox} no de-duplication happens.
 */
@Getter
@ToString
public final class InboxConfiguration {

    public static final InboxConfiguration NONE = builder().build();

    private final Inbox inbox;
    private final InboxScope scope;
    private final boolean onceOnly;
    private final OnceOnlyAction actionOnExists;
    private final String contextKey;

    private InboxConfiguration(Builder builder) {
        this.inbox = builder.inbox;
        this.scope = builder.scope;
        this.onceOnly = builder.onceOnly;
        this.actionOnExists = builder.actionOnExists;
        this.contextKey = builder.contextKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Inbox> inbox() {
        return Optional.ofNullable(inbox);
    }

    public boolean isEnabled() {
        return inbox != null;
    }

    public static final class Builder {

        private Inbox inbox;
        private InboxScope scope = InboxScope.ALL;
        private boolean onceOnly = true;
        private OnceOnlyAction actionOnExists = OnceOnlyAction.THROW;
        private String contextKey;

        private Builder() {
        }

        public Builder setInbox(Inbox inbox) {
            this.inbox = inbox;
            return this;
        }

        public Builder setScope(InboxScope scope) {
            this.scope = Objects.requireNonNull(scope, "scope must not be null");
            return this;
        }

        public Builder setOnceOnly(boolean onceOnly) {
            this.onceOnly = onceOnly;
            return this;
        }

        public Builder setActionOnExists(OnceOnlyAction actionOnExists) {
            this.actionOnExists = Objects.requireNonNull(actionOnExists, "actionOnExists must not be null");
            return this;
        }

        /** Key that partitions the inbox, e.g. per handler. Defaults to none. */
        public Builder setContextKey(String contextKey) {
            this.contextKey = contextKey;
            return this;
        }

        public InboxConfiguration build() {
            return new InboxConfiguration(this);
        }
    }
}
