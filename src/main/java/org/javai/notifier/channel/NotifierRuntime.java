package org.javai.notifier.channel;

import org.javai.notifier.policy.SuppressionPolicy;
import org.javai.notifier.report.DecisionReporter;

import java.time.Clock;
import java.util.Objects;

/**
 * Shared collaborators injected into every notifier.
 *
 * @param policy the suppression policy
 * @param reporter receives every decision
 * @param clock the time source decisions are made against
 */
public record NotifierRuntime(SuppressionPolicy policy, DecisionReporter reporter, Clock clock) {

    public NotifierRuntime {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(reporter, "reporter must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Default policy, no reporting, system UTC clock.
     */
    public static NotifierRuntime defaults() {
        return new NotifierRuntime(SuppressionPolicy.defaults(), DecisionReporter.noOp(), Clock.systemUTC());
    }

    public NotifierRuntime withClock(Clock clock) {
        return new NotifierRuntime(policy, reporter, clock);
    }

    public NotifierRuntime withReporter(DecisionReporter reporter) {
        return new NotifierRuntime(policy, reporter, clock);
    }

    public NotifierRuntime withPolicy(SuppressionPolicy policy) {
        return new NotifierRuntime(policy, reporter, clock);
    }
}
