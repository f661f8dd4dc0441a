package org.javai.notifier.channel;

import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.alert.NotificationRecord;
import org.javai.notifier.policy.NotifyDecision;
import org.javai.notifier.settings.SettingResult;
import org.javai.notifier.settings.SettingsAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Base class for notification channels.
 *
 * <p>Builds the channel's {@link NotifierConfig} once from its {@link AlertNotification} and answers
 * {@link #shouldNotify} through the injected {@link NotifierRuntime}. Subclasses read their own
 * options from {@link AlertNotification#settings()} with {@link SettingsAccessor} and implement
 * {@link #notify(EvaluationOutcome)}.
 *
 * <pre>{@code
 * class WebhookNotifier extends NotifierBase {
 *     private final String url;
 *
 *     WebhookNotifier(AlertNotification model, NotifierRuntime runtime) {
 *         super(model, runtime);
 *         this.url = SettingsAccessor.getString(model.settings(), "url").getOrThrow();
 *     }
 *     ...
 * }
 * }</pre>
 */
public abstract class NotifierBase implements Notifier {

    static final String UPLOAD_IMAGE_KEY = "uploadImage";

    private final NotifierConfig config;
    private final NotifierRuntime runtime;

    protected final Logger log;

    /**
     * Creates a notifier logging to {@code alerting.notifier.<name>}.
     */
    protected NotifierBase(AlertNotification model, NotifierRuntime runtime) {
        this(model, runtime, defaultLogger(model.name()));
    }

    protected NotifierBase(AlertNotification model, NotifierRuntime runtime, Logger log) {
        Objects.requireNonNull(model, "model must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
        this.config = configFrom(model, log);
    }

    /**
     * Builds the immutable configuration of a channel.
     * An unreadable {@code uploadImage} setting falls back to true.
     */
    public static NotifierConfig configFrom(AlertNotification model) {
        return configFrom(model, defaultLogger(model.name()));
    }

    protected static Logger defaultLogger(String notifierName) {
        return LoggerFactory.getLogger("alerting.notifier." + notifierName);
    }

    private static NotifierConfig configFrom(AlertNotification model, Logger log) {
        SettingResult<Boolean> uploadImage = SettingsAccessor.getBool(model.settings(), UPLOAD_IMAGE_KEY, true);
        uploadImage.error().ifPresent(error -> log.warn("{}, using {}", error.message(), uploadImage.value()));

        return new NotifierConfig(
                model.id(),
                model.name(),
                model.type(),
                model.isDefault(),
                uploadImage.value(),
                model.sendReminder(),
                model.disableResolveMessage(),
                model.frequency()
        );
    }

    @Override
    public boolean shouldNotify(EvaluationOutcome outcome, NotificationRecord record) {
        return decide(outcome, record).shouldNotify();
    }

    /**
     * Runs the suppression policy and reports the decision.
     */
    public NotifyDecision decide(EvaluationOutcome outcome, NotificationRecord record) {
        NotifyDecision decision = runtime.policy().decide(config, outcome, record, runtime.clock().instant());
        try {
            runtime.reporter().report(config, outcome, decision);
        } catch (RuntimeException e) {
            log.warn("Decision reporting failed for rule [{}]", outcome.ruleName(), e);
        }
        return decision;
    }

    public NotifierConfig config() {
        return config;
    }

    @Override
    public String getType() {
        return config.type();
    }

    @Override
    public long getNotifierId() {
        return config.id();
    }

    @Override
    public String getName() {
        return config.name();
    }

    @Override
    public boolean isDefault() {
        return config.isDefault();
    }

    @Override
    public boolean needsImage() {
        return config.uploadImage();
    }

    @Override
    public boolean getSendReminder() {
        return config.sendReminder();
    }

    @Override
    public boolean getDisableResolveMessage() {
        return config.disableResolveMessage();
    }

    @Override
    public Duration getFrequency() {
        return config.frequency();
    }
}
