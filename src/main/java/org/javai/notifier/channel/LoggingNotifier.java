package org.javai.notifier.channel;

import org.javai.notifier.alert.AlertState;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.settings.SettingError;
import org.javai.notifier.settings.SettingsAccessor;
import org.slf4j.Logger;

import java.util.Locale;

/**
 * Writes notifications to the notifier's log. Useful for local setups and as a fallback channel.
 *
 * <p>Settings:
 * <ul>
 *   <li>{@code level} - {@code error}, {@code warn} or {@code info}; defaults to {@code warn}.
 *   Resolve notifications are always logged at INFO.</li>
 *   <li>{@code prefix} - text put in front of every line; defaults to {@code [Notify]}.</li>
 * </ul>
 */
public class LoggingNotifier extends NotifierBase {

    public static final String TYPE = "log";

    private final String level;
    private final String prefix;

    public LoggingNotifier(AlertNotification model, NotifierRuntime runtime) {
        this(model, runtime, defaultLogger(model.name()));
    }

    LoggingNotifier(AlertNotification model, NotifierRuntime runtime, Logger log) {
        super(model, runtime, log);
        this.level = readLevel(model);
        this.prefix = SettingsAccessor.getString(model.settings(), "prefix", "[Notify]").getOrThrow();
    }

    public static NotifierPlugin plugin() {
        return new NotifierPlugin(TYPE, "Log", "Writes notifications to the application log", LoggingNotifier::new);
    }

    @Override
    public void notify(EvaluationOutcome outcome) {
        if (outcome.currentState() == AlertState.OK) {
            log.info("{} rule={} resolved ({} -> {})", prefix, outcome.ruleName(),
                    outcome.previousState().wireName(), outcome.currentState().wireName());
            return;
        }
        switch (level) {
            case "error" -> log.error("{} rule={} id={} {} -> {}", prefix, outcome.ruleName(), outcome.ruleId(),
                    outcome.previousState().wireName(), outcome.currentState().wireName());
            case "info" -> log.info("{} rule={} id={} {} -> {}", prefix, outcome.ruleName(), outcome.ruleId(),
                    outcome.previousState().wireName(), outcome.currentState().wireName());
            default -> log.warn("{} rule={} id={} {} -> {}", prefix, outcome.ruleName(), outcome.ruleId(),
                    outcome.previousState().wireName(), outcome.currentState().wireName());
        }
    }

    String level() {
        return level;
    }

    String prefix() {
        return prefix;
    }

    private static String readLevel(AlertNotification model) {
        String value = SettingsAccessor.getString(model.settings(), "level", "warn").getOrThrow()
                .trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "error", "warn", "info" -> value;
            default -> throw SettingError.invalid("level").toException();
        };
    }
}
