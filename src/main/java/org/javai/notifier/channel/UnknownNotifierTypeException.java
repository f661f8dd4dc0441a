package org.javai.notifier.channel;

/**
 * No plugin is registered for a channel's type.
 */
public class UnknownNotifierTypeException extends RuntimeException {

    private final String type;

    public UnknownNotifierTypeException(String type) {
        super("Unsupported notification type: " + type);
        this.type = type;
    }

    public String type() {
        return type;
    }
}
