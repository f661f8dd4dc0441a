package org.javai.notifier.alert;

import java.util.Objects;

/**
 * What one evaluation cycle of an alert rule produced, as seen by the notifiers.
 *
 * @param ruleId identifier of the evaluated rule
 * @param ruleName display name of the rule
 * @param previousState the rule's state before this evaluation
 * @param currentState the rule's state after this evaluation
 */
public record EvaluationOutcome(
        long ruleId,
        String ruleName,
        AlertState previousState,
        AlertState currentState
) {

    public EvaluationOutcome {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(previousState, "previousState must not be null");
        Objects.requireNonNull(currentState, "currentState must not be null");
    }

    /**
     * Creates an outcome for an anonymous rule. Convenient where only the transition matters.
     */
    public static EvaluationOutcome transition(AlertState previousState, AlertState currentState) {
        return new EvaluationOutcome(0L, "", previousState, currentState);
    }

    public boolean stateChanged() {
        return previousState != currentState;
    }
}
