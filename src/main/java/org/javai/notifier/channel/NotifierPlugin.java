package org.javai.notifier.channel;

import java.util.Locale;
import java.util.Objects;

/**
 * A registered channel type.
 *
 * @param type the type tag, stored lower-case
 * @param name display name
 * @param description what the channel does
 * @param factory builds notifiers of this type
 */
public record NotifierPlugin(String type, String name, String description, NotifierFactory factory) {

    public NotifierPlugin {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        type = type.trim().toLowerCase(Locale.ROOT);
        description = description == null ? "" : description;
    }
}
