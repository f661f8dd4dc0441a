package org.javai.notifier.alert;

import java.util.Locale;
import java.util.Objects;

/**
 * Lifecycle of the last dispatch attempt for a rule/channel pair.
 */
public enum NotificationState {
    /**
     * A dispatch was claimed and has not been confirmed yet.
     */
    PENDING("pending"),

    /**
     * The last dispatch finished.
     */
    COMPLETED("completed");

    private final String wireName;

    NotificationState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException if the name matches no state
     */
    public static NotificationState fromWireName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (NotificationState state : values()) {
            if (state.wireName.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown notification state: " + name);
    }
}
