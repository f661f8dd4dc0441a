package org.javai.notifier.report;

import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.AlertState;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.policy.NotifyDecision;
import org.javai.notifier.policy.SuppressionReason;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeDecisionReporterTest {

	private final NotifierConfig config = NotifierConfig.builder(1, "team-mail", "email").build();
	private final EvaluationOutcome outcome = EvaluationOutcome.transition(AlertState.OK, AlertState.ALERTING);

	@Test
	void report_fansOutToAllReporters() {
		List<NotifyDecision> first = new ArrayList<>();
		List<NotifyDecision> second = new ArrayList<>();
		DecisionReporter composite = DecisionReporter.composite(
				(c, o, d) -> first.add(d),
				(c, o, d) -> second.add(d));

		composite.report(config, outcome, NotifyDecision.dispatch());

		assertThat(first).containsExactly(NotifyDecision.dispatch());
		assertThat(second).containsExactly(NotifyDecision.dispatch());
	}

	@Test
	void report_failingReporter_doesNotStopOthers() {
		List<NotifyDecision> received = new ArrayList<>();
		CompositeDecisionReporter composite = CompositeDecisionReporter.of(
				(c, o, d) -> { throw new IllegalStateException("boom"); },
				(c, o, d) -> received.add(d));

		NotifyDecision decision = NotifyDecision.suppress(SuppressionReason.STATE_UNCHANGED);

		assertThatCode(() -> composite.report(config, outcome, decision)).doesNotThrowAnyException();
		assertThat(received).containsExactly(decision);
	}

	@Test
	void builder_skipsNullsAndFalseConditions() {
		CompositeDecisionReporter composite = CompositeDecisionReporter.builder()
				.add(DecisionReporter.noOp())
				.add(null)
				.addIf(false, DecisionReporter.noOp())
				.addIf(true, DecisionReporter.noOp())
				.addAll(List.of(DecisionReporter.noOp()))
				.build();

		assertThat(composite.size()).isEqualTo(3);
	}

	@Test
	void of_collection_copiesReporters() {
		List<DecisionReporter> reporters = new ArrayList<>(List.of(DecisionReporter.noOp()));
		CompositeDecisionReporter composite = CompositeDecisionReporter.of(reporters);
		reporters.add(DecisionReporter.noOp());

		assertThat(composite.size()).isEqualTo(1);
	}
}
