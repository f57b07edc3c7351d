package com.agentrelay.core.errors;

import com.agentrelay.core.process.ExecutionResult;

import java.util.Optional;

/**
 * One step of the failure classification chain.
 */
@FunctionalInterface
public interface ClassificationRule {

    /**
     * @return the classification if this rule applies, empty to fall through to the next rule
     */
    Optional<ClassifiedError> apply(ExecutionResult result);
}
