package com.agentrelay.core.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A classified execution failure.
 *
 * @param code      stable error code
 * @param message   human-readable message, never blank
 * @param details   structured context (suggestion, partial results, exit code, ...)
 * @param retryable whether retrying the same request unchanged may succeed
 */
public record ClassifiedError(
        ErrorCode code,
        String message,
        Map<String, Object> details,
        boolean retryable
) {

    public ClassifiedError {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ClassifiedError of(ErrorCode code, String message, Map<String, Object> details) {
        return new ClassifiedError(code, message, details, code.retryable());
    }

    public String suggestion() {
        Object suggestion = details.get("suggestion");
        return suggestion != null ? suggestion.toString() : null;
    }
}
