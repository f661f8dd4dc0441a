package org.javai.notifier.report;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.policy.NotifyDecision;

/**
 * Reports decisions using Log4j2.
 *
 * <p>Dispatches are logged at INFO with the {@code DISPATCH} marker; suppressions at DEBUG with
 * the {@code SUPPRESS} marker, since most evaluation cycles end in one.
 */
public class Log4jDecisionReporter implements DecisionReporter {

	static final Marker DISPATCH_MARKER = MarkerManager.getMarker("DISPATCH");
	static final Marker SUPPRESS_MARKER = MarkerManager.getMarker("SUPPRESS");

	private final Logger logger;

	public Log4jDecisionReporter() {
		this(LogManager.getLogger("org.javai.notifier.Decisions"));
	}

	public Log4jDecisionReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jDecisionReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(NotifierConfig config, EvaluationOutcome outcome, NotifyDecision decision) {
		if (decision instanceof NotifyDecision.Suppress suppress) {
			logger.atDebug()
				.withMarker(SUPPRESS_MARKER)
				.log("Suppressed notification on [{}] ({}) for rule [{}] {} -> {}: {}",
					config.name(),
					config.type(),
					outcome.ruleName(),
					outcome.previousState().wireName(),
					outcome.currentState().wireName(),
					suppress.reason());
			return;
		}
		logger.atInfo()
			.withMarker(DISPATCH_MARKER)
			.log("Dispatching notification on [{}] ({}) for rule [{}] {} -> {}",
				config.name(),
				config.type(),
				outcome.ruleName(),
				outcome.previousState().wireName(),
				outcome.currentState().wireName());
	}
}
