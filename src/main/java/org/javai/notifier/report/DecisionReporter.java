package org.javai.notifier.report;

import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.policy.NotifyDecision;

/**
 * Receives every notification decision for observability.
 * Implementations might emit metrics or structured logs. Reporting never alters a decision.
 */
@FunctionalInterface
public interface DecisionReporter {

	/**
	 * Reports one decision.
	 *
	 * @param config the channel the decision was made for
	 * @param outcome the evaluation that was decided on
	 * @param decision the decision
	 */
	void report(NotifierConfig config, EvaluationOutcome outcome, NotifyDecision decision);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static DecisionReporter noOp() {
		return (config, outcome, decision) -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static DecisionReporter composite(DecisionReporter... reporters) {
		return CompositeDecisionReporter.of(reporters);
	}
}
