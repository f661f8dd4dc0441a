package org.javai.notifier.alert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

class AlertStateTest {

    @ParameterizedTest
    @EnumSource(AlertState.class)
    void fromWireName_roundTripsEveryState(AlertState state) {
        assertThat(AlertState.fromWireName(state.wireName())).isEqualTo(state);
    }

    @Test
    void wireName_isLowerCase() {
        assertThat(AlertState.NO_DATA.wireName()).isEqualTo("no_data");
        assertThat(AlertState.ALERTING.wireName()).isEqualTo("alerting");
    }

    @Test
    void fromWireName_ignoresCaseAndWhitespace() {
        assertThat(AlertState.fromWireName(" Pending ")).isEqualTo(AlertState.PENDING);
    }

    @Test
    void fromWireName_unknown_throws() {
        assertThatThrownBy(() -> AlertState.fromWireName("firing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("firing");
    }

    @Test
    void notificationState_fromWireName() {
        assertThat(NotificationState.fromWireName("COMPLETED")).isEqualTo(NotificationState.COMPLETED);
        assertThatThrownBy(() -> NotificationState.fromWireName("sent"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluationOutcome_stateChanged() {
        assertThat(EvaluationOutcome.transition(AlertState.OK, AlertState.ALERTING).stateChanged()).isTrue();
        assertThat(EvaluationOutcome.transition(AlertState.OK, AlertState.OK).stateChanged()).isFalse();
    }

    @Test
    void evaluationOutcome_requiresStates() {
        assertThatThrownBy(() -> new EvaluationOutcome(1, "r", null, AlertState.OK))
                .isInstanceOf(NullPointerException.class);
    }
}
