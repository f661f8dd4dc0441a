package org.javai.notifier.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.policy.NotifyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Reports decisions as JSON-lines metrics via SLF4J.
 *
 * <p>Each decision becomes one JSON object, suitable for metrics aggregation. The tracking key
 * is the channel type, prefixed by a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"notify_decision","timestamp":"2024-01-20T10:30:00Z","trackingKey":"alerting.webhook",
 *  "notifierId":4,"notifier":"ops-hook","ruleId":12,"rule":"cpu high","previousState":"alerting",
 *  "currentState":"alerting","decision":"suppress","reason":"REMINDER_INTERVAL_NOT_ELAPSED"}
 * }</pre>
 */
public class MetricsDecisionReporter implements DecisionReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.notifier.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsDecisionReporter with no namespace and the default logger.
	 */
	public MetricsDecisionReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsDecisionReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsDecisionReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsDecisionReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(NotifierConfig config, EvaluationOutcome outcome, NotifyDecision decision) {
		try {
			logger.info(buildDecisionJson(config, outcome, decision));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize decision for notifier [{}]", config.name(), e);
		}
	}

	String buildDecisionJson(NotifierConfig config, EvaluationOutcome outcome, NotifyDecision decision)
			throws JsonProcessingException {
		ObjectNode node = MAPPER.createObjectNode();
		node.put("eventType", "notify_decision");
		node.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		node.put("trackingKey", buildTrackingKey(config));
		node.put("notifierId", config.id());
		node.put("notifier", config.name());
		node.put("ruleId", outcome.ruleId());
		node.put("rule", outcome.ruleName());
		node.put("previousState", outcome.previousState().wireName());
		node.put("currentState", outcome.currentState().wireName());
		node.put("decision", decision.shouldNotify() ? "dispatch" : "suppress");
		if (decision instanceof NotifyDecision.Suppress suppress) {
			node.put("reason", suppress.reason().name());
		}
		return MAPPER.writeValueAsString(node);
	}

	String buildTrackingKey(NotifierConfig config) {
		if (namespace == null) {
			return config.type();
		}
		return namespace + "." + config.type();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
