package org.javai.notifier.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of channel types.
 *
 * <ul>
 *   <li>built in: {@code log} ({@link LoggingNotifier})</li>
 *   <li>type tags are matched case-insensitively</li>
 *   <li>thread-safe; registering an existing type replaces it</li>
 * </ul>
 */
public class NotifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(NotifierRegistry.class);

    private final Map<String, NotifierPlugin> plugins = new ConcurrentHashMap<>(16);

    private final NotifierRuntime runtime;

    public NotifierRegistry(NotifierRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    /**
     * A registry with the built-in channel types.
     */
    public static NotifierRegistry withDefaults(NotifierRuntime runtime) {
        return new NotifierRegistry(runtime).register(LoggingNotifier.plugin());
    }

    /**
     * Registers or replaces a channel type.
     */
    public NotifierRegistry register(NotifierPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        NotifierPlugin previous = plugins.put(plugin.type(), plugin);
        if (previous != null) {
            log.info("Replaced notifier plugin [{}]: {} -> {}", plugin.type(), previous.name(), plugin.name());
        }
        return this;
    }

    public Optional<NotifierPlugin> find(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(plugins.get(normalize(type)));
    }

    /**
     * Builds the notifier for a stored channel.
     *
     * @throws UnknownNotifierTypeException if no plugin is registered for the channel's type
     * @throws org.javai.notifier.settings.SettingException if the channel's settings are missing or unreadable
     */
    public Notifier create(AlertNotification model) {
        Objects.requireNonNull(model, "model");
        NotifierPlugin plugin = find(model.type())
                .orElseThrow(() -> new UnknownNotifierTypeException(model.type()));
        Notifier notifier = plugin.factory().create(model, runtime);
        log.debug("Created {} notifier [{}] id={}", plugin.type(), model.name(), model.id());
        return notifier;
    }

    /** Lists registered plugins. */
    public Collection<NotifierPlugin> plugins() {
        return Collections.unmodifiableCollection(plugins.values());
    }

    public NotifierRuntime runtime() {
        return runtime;
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
