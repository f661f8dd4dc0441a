package org.javai.notifier.report;

import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.policy.NotifyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link DecisionReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <pre>{@code
 * DecisionReporter reporter = CompositeDecisionReporter.builder()
 *     .add(new Log4jDecisionReporter())
 *     .addIf(metricsEnabled, new MetricsDecisionReporter("alerting"))
 *     .build();
 * }</pre>
 */
public final class CompositeDecisionReporter implements DecisionReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeDecisionReporter.class);

	private final List<DecisionReporter> reporters;

	private CompositeDecisionReporter(List<DecisionReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeDecisionReporter of(DecisionReporter... reporters) {
		return new CompositeDecisionReporter(Arrays.asList(reporters));
	}

	public static CompositeDecisionReporter of(Collection<? extends DecisionReporter> reporters) {
		return new CompositeDecisionReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(NotifierConfig config, EvaluationOutcome outcome, NotifyDecision decision) {
		for (DecisionReporter reporter : reporters) {
			try {
				reporter.report(config, outcome, decision);
			} catch (RuntimeException e) {
				log.warn("DecisionReporter {} failed for notifier [{}]", reporter.getClass().getName(), config.name(), e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	public static final class Builder {
		private final List<DecisionReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; null is ignored.
		 */
		public Builder add(DecisionReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends DecisionReporter> reporters) {
			for (DecisionReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		public Builder addIf(boolean condition, DecisionReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeDecisionReporter build() {
			return new CompositeDecisionReporter(reporters);
		}
	}
}
