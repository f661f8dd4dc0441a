package org.javai.notifier.alert;

import java.util.Locale;
import java.util.Objects;

/**
 * The state an alert rule is left in after an evaluation.
 */
public enum AlertState {
    /**
     * The query returned no data.
     */
    NO_DATA("no_data"),

    /**
     * Evaluation is paused for the rule.
     */
    PAUSED("paused"),

    /**
     * The rule's condition holds.
     */
    ALERTING("alerting"),

    /**
     * The rule's condition does not hold.
     */
    OK("ok"),

    /**
     * The condition holds but has not held for the rule's pending period yet.
     */
    PENDING("pending"),

    UNKNOWN("unknown");

    private final String wireName;

    AlertState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The lower-case name this state is stored and exchanged under.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a stored state name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no state
     */
    public static AlertState fromWireName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AlertState state : values()) {
            if (state.wireName.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown alert state: " + name);
    }
}
