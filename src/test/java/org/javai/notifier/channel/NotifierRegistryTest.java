package org.javai.notifier.channel;

import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.settings.MissingSettingException;
import org.javai.notifier.settings.SettingsAccessor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NotifierRegistryTest {

    private final NotifierRuntime runtime = NotifierRuntime.defaults();

    @Test
    void withDefaults_registersLogChannel() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);

        assertThat(registry.find("log")).isPresent();
        assertThat(registry.plugins()).extracting(NotifierPlugin::type).containsExactly("log");
        assertThat(registry.runtime()).isSameAs(runtime);
    }

    @Test
    void find_isCaseInsensitive() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);

        assertThat(registry.find(" LOG ")).isPresent();
    }

    @Test
    void find_blankOrNull_isEmpty() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);

        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.find("  ")).isEmpty();
    }

    @Test
    void create_buildsNotifierForType() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);

        Notifier notifier = registry.create(AlertNotification.builder("local", "Log").id(3).build());

        assertThat(notifier).isInstanceOf(LoggingNotifier.class);
        assertThat(notifier.getNotifierId()).isEqualTo(3);
        assertThat(notifier.getType()).isEqualTo("Log");
    }

    @Test
    void create_unknownType_throws() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);

        assertThatThrownBy(() -> registry.create(AlertNotification.builder("pager", "pagerduty").build()))
                .isInstanceOf(UnknownNotifierTypeException.class)
                .hasMessage("Unsupported notification type: pagerduty")
                .extracting(e -> ((UnknownNotifierTypeException) e).type())
                .isEqualTo("pagerduty");
    }

    @Test
    void register_sameType_replacesPlugin() {
        NotifierRegistry registry = NotifierRegistry.withDefaults(runtime);
        NotifierPlugin replacement = new NotifierPlugin("LOG", "Quiet log", null, QuietNotifier::new);

        registry.register(replacement);

        assertThat(registry.plugins()).hasSize(1);
        assertThat(registry.find("log")).contains(replacement);
        assertThat(registry.create(AlertNotification.builder("q", "log").build())).isInstanceOf(QuietNotifier.class);
    }

    @Test
    void create_factoryRejectsSettings_propagates() {
        NotifierRegistry registry = new NotifierRegistry(runtime)
                .register(new NotifierPlugin("webhook", "Webhook", "Posts to a URL", WebhookNotifier::new));

        assertThatThrownBy(() -> registry.create(AlertNotification.builder("hook", "webhook").build()))
                .isInstanceOf(MissingSettingException.class)
                .hasMessage("Could not find url property in settings");
    }

    @Test
    void plugin_blankType_isRejected() {
        assertThatThrownBy(() -> new NotifierPlugin(" ", "x", "", QuietNotifier::new))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void plugin_normalizesTypeAndDescription() {
        NotifierPlugin plugin = new NotifierPlugin(" Email ", "Email", null, QuietNotifier::new);

        assertThat(plugin.type()).isEqualTo("email");
        assertThat(plugin.description()).isEmpty();
    }

    private static final class QuietNotifier extends NotifierBase {

        QuietNotifier(AlertNotification model, NotifierRuntime runtime) {
            super(model, runtime);
        }

        @Override
        public void notify(EvaluationOutcome outcome) {
        }
    }

    private static final class WebhookNotifier extends NotifierBase {

        private final String url;

        WebhookNotifier(AlertNotification model, NotifierRuntime runtime) {
            super(model, runtime);
            this.url = SettingsAccessor.getString(model.settings(), "url").getOrThrow();
        }

        @Override
        public void notify(EvaluationOutcome outcome) {
            log.info("POST {}", url);
        }
    }
}
