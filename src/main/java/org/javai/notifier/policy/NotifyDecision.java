package org.javai.notifier.policy;

import java.util.Locale;
import java.util.Objects;

/**
 * The decision made by a {@link SuppressionPolicy} for one evaluation cycle.
 */
public sealed interface NotifyDecision permits NotifyDecision.Dispatch, NotifyDecision.Suppress {

    /**
     * Send the notification.
     */
    record Dispatch() implements NotifyDecision {

        private static final Dispatch INSTANCE = new Dispatch();

        @Override
        public boolean shouldNotify() {
            return true;
        }

        @Override
        public String describe() {
            return "dispatch";
        }
    }

    /**
     * Do not send; the given guard matched.
     */
    record Suppress(SuppressionReason reason) implements NotifyDecision {

        public Suppress {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static Suppress because(SuppressionReason reason) {
            return new Suppress(reason);
        }

        @Override
        public boolean shouldNotify() {
            return false;
        }

        @Override
        public String describe() {
            return "suppress:" + reason.name().toLowerCase(Locale.ROOT);
        }
    }

    boolean shouldNotify();

    /**
     * Short stable label, used as a log and metrics dimension.
     */
    String describe();

    static NotifyDecision dispatch() {
        return Dispatch.INSTANCE;
    }

    static NotifyDecision suppress(SuppressionReason reason) {
        return Suppress.because(reason);
    }
}
