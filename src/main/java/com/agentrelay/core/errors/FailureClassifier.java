package com.agentrelay.core.errors;

import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.process.ExecutionResult;
import com.agentrelay.core.watchdog.PartialResults;
import com.agentrelay.core.watchdog.TimeoutEnvelope;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps an execution result onto exactly one {@link ClassifiedError}, or none for a genuine success.
 * <p>
 * Rules are evaluated in order and the first match wins. The silent-failure rule is a heuristic:
 * it flags the absence of evidence of work, not proof that nothing happened.
 * <p>
 * This is the only place that turns raw worker diagnostics into user-facing messages.
 */
@Component
public class FailureClassifier {

    static final int MAX_DETAIL_EVENTS = 50;
    static final int MAX_DETAIL_CHARS = 2_000;

    private final List<ClassificationRule> rules = List.of(
            FailureClassifier::timeout,
            FailureClassifier::spawnError,
            FailureClassifier::signal,
            FailureClassifier::silentFailure,
            FailureClassifier::turnFailed,
            FailureClassifier::diagnosticPattern,
            FailureClassifier::exitError,
            FailureClassifier::unknown
    );

    public Optional<ClassifiedError> classify(ExecutionResult result) {
        for (ClassificationRule rule : rules) {
            Optional<ClassifiedError> error = rule.apply(result);
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }

    // ── Rules ────────────────────────────────────────────────────────────

    static Optional<ClassifiedError> timeout(ExecutionResult result) {
        TimeoutEnvelope timeout = result.timeout();
        if (timeout == null) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timeoutKind", timeout.kind().label());
        details.put("timeoutCode", timeout.code());
        details.put("elapsedSeconds", timeout.elapsedMs() / 1000);
        details.put("idleSeconds", timeout.idleMs() / 1000);
        details.put("partialResults", partialResults(timeout.partialResults()));
        details.put("suggestion", "Review the partial results; split the task or raise the timeout before retrying");
        return Optional.of(new ClassifiedError(ErrorCode.TIMEOUT, timeout.message(), details, false));
    }

    static Optional<ClassifiedError> spawnError(ExecutionResult result) {
        if (result.spawnError() == null) {
            return Optional.empty();
        }
        String raw = result.spawnError();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rawError", raw);

        Optional<DiagnosticPattern> pattern = DiagnosticPattern.match(result.stderr());
        String message;
        if (pattern.isPresent()) {
            message = "Failed to start worker: " + pattern.get().message();
            details.put("suggestion", pattern.get().suggestion());
        } else if (raw.contains("error=2") || raw.contains("No such file or directory")) {
            message = "Failed to start worker: executable not found";
            details.put("suggestion", "Install the worker CLI or set agentrelay.worker.binary to its full path");
        } else if (raw.contains("error=13")) {
            message = "Failed to start worker: executable is not runnable (permission denied)";
            details.put("suggestion", "Make the worker binary executable");
        } else {
            message = "Failed to start worker: " + raw;
        }
        return Optional.of(ClassifiedError.of(ErrorCode.SPAWN_ERROR, message, details));
    }

    static Optional<ClassifiedError> signal(ExecutionResult result) {
        if (result.signal() == null) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("signal", result.signal());
        details.put("eventsCount", result.events().size());
        details.put("stderrTail", tail(result.stderr()));

        String message;
        boolean retryable;
        if (result.canceled()) {
            message = "Worker was terminated by " + result.signal() + " after the task was canceled";
            details.put("hint", "Terminated on request");
            retryable = false;
        } else if ("SIGTERM".equals(result.signal())) {
            message = "Worker was terminated by SIGTERM";
            details.put("hint", "Likely a timeout-induced or orchestrator-initiated termination");
            retryable = false;
        } else {
            message = "Worker was killed by " + result.signal();
            details.put("hint", "Killed by something outside the orchestrator, possibly memory or resource pressure");
            retryable = true;
        }
        return Optional.of(new ClassifiedError(ErrorCode.PROCESS_KILLED, message, details, retryable));
    }

    static Optional<ClassifiedError> silentFailure(ExecutionResult result) {
        if (!isZeroExit(result)) {
            return Optional.empty();
        }
        List<WorkerEvent> events = result.events();
        boolean noEvents = events.isEmpty();
        boolean completedWithoutWork = events.stream().anyMatch(e -> e instanceof WorkerEvent.TurnCompleted)
                && events.stream().noneMatch(FailureClassifier::isObservableWork);
        if (!noEvents && !completedWithoutWork) {
            return Optional.empty();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventsCount", events.size());
        details.put("eventTypes", events.stream().map(WorkerEvent::type).distinct().toList());
        details.put("stdoutTail", tail(result.stdout()));
        details.put("stderrTail", tail(result.stderr()));
        details.put("explanation", noEvents
                ? "The worker exited with code 0 but emitted no events"
                : "The worker completed its turn without editing files, running commands or replying");
        details.put("suggestion", "The worker may have refused the task or hit a suppressed error; "
                + "check the output tails and rephrase or retry the task");
        return Optional.of(ClassifiedError.of(ErrorCode.SILENT_FAILURE,
                "Worker reported success but produced no observable work", details));
    }

    static Optional<ClassifiedError> turnFailed(ExecutionResult result) {
        if (!isNonZeroExit(result)) {
            return Optional.empty();
        }
        return result.events().stream()
                .filter(e -> e instanceof WorkerEvent.TurnFailed)
                .map(e -> (WorkerEvent.TurnFailed) e)
                .reduce((first, second) -> second)
                .map(failed -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("exitCode", result.exitCode());
                    details.put("turnId", failed.turnId());
                    if (failed.error() != null) {
                        details.put("error", failed.error());
                    }
                    String reason = failed.errorMessage() != null ? failed.errorMessage() : "no reason given";
                    DiagnosticPattern.match(reason).ifPresent(p -> details.put("suggestion", p.suggestion()));
                    return ClassifiedError.of(ErrorCode.TURN_FAILED, "Worker turn failed: " + reason, details);
                });
    }

    static Optional<ClassifiedError> diagnosticPattern(ExecutionResult result) {
        if (!isNonZeroExit(result)) {
            return Optional.empty();
        }
        String diagnostics = diagnosticText(result);
        return DiagnosticPattern.match(diagnostics).map(pattern -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exitCode", result.exitCode());
            details.put("suggestion", pattern.suggestion());
            details.put("stderrTail", tail(diagnostics));
            return ClassifiedError.of(pattern.code(), pattern.message(), details);
        });
    }

    static Optional<ClassifiedError> exitError(ExecutionResult result) {
        if (!isNonZeroExit(result)) {
            return Optional.empty();
        }
        String diagnostics = diagnosticText(result);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exitCode", result.exitCode());
        details.put("stderrTail", tail(diagnostics));
        String message = "Worker exited with code " + result.exitCode();
        if (!diagnostics.isBlank()) {
            message += ": " + tail(diagnostics.strip(), 300);
        }
        return Optional.of(ClassifiedError.of(ErrorCode.EXIT_ERROR, message, details));
    }

    static Optional<ClassifiedError> unknown(ExecutionResult result) {
        if (isZeroExit(result)) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("canceled", result.canceled());
        details.put("eventsCount", result.events().size());
        String message = result.canceled()
                ? "Worker run was canceled before it produced a result"
                : "Worker ended without an exit status";
        return Optional.of(ClassifiedError.of(ErrorCode.UNKNOWN_ERROR, message, details));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static boolean isZeroExit(ExecutionResult result) {
        return result.exitCode() != null && result.exitCode() == 0;
    }

    private static boolean isNonZeroExit(ExecutionResult result) {
        return result.exitCode() != null && result.exitCode() != 0;
    }

    private static boolean isObservableWork(WorkerEvent event) {
        return event instanceof WorkerEvent.ItemEvent item && item.item().kind().isObservableWork();
    }

    private static String diagnosticText(ExecutionResult result) {
        return !result.stderr().isBlank() ? result.stderr() : result.stdout();
    }

    private static Map<String, Object> partialResults(PartialResults partial) {
        Map<String, Object> map = new LinkedHashMap<>();
        List<WorkerEvent> events = partial.lastEvents();
        map.put("totalEvents", partial.totalEvents());
        map.put("lastEvents", events.subList(Math.max(0, events.size() - MAX_DETAIL_EVENTS), events.size())
                .stream().map(WorkerEvent::raw).toList());
        map.put("stdoutTail", tail(partial.stdoutTail()));
        map.put("stderrTail", tail(partial.stderrTail()));
        map.put("lastActivityAt", String.valueOf(partial.lastActivityAt()));
        return map;
    }

    static String tail(String text) {
        return tail(text, MAX_DETAIL_CHARS);
    }

    private static String tail(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(text.length() - max);
    }
}
