package com.agentrelay.core.errors;

import com.agentrelay.core.events.ItemPayload;
import com.agentrelay.core.events.WorkerEvent;
import com.agentrelay.core.process.ExecutionResult;
import com.agentrelay.core.watchdog.PartialResults;
import com.agentrelay.core.watchdog.TimeoutEnvelope;
import com.agentrelay.core.watchdog.TimeoutKind;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private static final Instant TS = Instant.parse("2025-01-01T00:00:00Z");

    private FailureClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new FailureClassifier();
    }

    private static WorkerEvent turnStarted() {
        return new WorkerEvent.TurnStarted("t1", TS, JsonNodeFactory.instance.objectNode());
    }

    private static WorkerEvent turnCompleted() {
        return new WorkerEvent.TurnCompleted("t1", null, null, TS, JsonNodeFactory.instance.objectNode());
    }

    private static WorkerEvent turnFailed(String message) {
        return new WorkerEvent.TurnFailed("t1", message, null, TS, JsonNodeFactory.instance.objectNode());
    }

    private static WorkerEvent fileChanged() {
        return new WorkerEvent.ItemCompleted("i1", ItemPayload.fileChange("a.txt", "add"), TS,
                JsonNodeFactory.instance.objectNode());
    }

    private static ExecutionResult exit(int code, List<WorkerEvent> events, String stderr) {
        return ExecutionResult.exited("worker-1", events, "", stderr, code, null, false, 1_000);
    }

    @Nested
    @DisplayName("success")
    class SuccessTests {

        @Test
        @DisplayName("a zero exit with observable work is not an error")
        void genuineSuccess() {
            var result = exit(0, List.of(turnStarted(), fileChanged(), turnCompleted()), "");

            assertTrue(classifier.classify(result).isEmpty());
        }

        @Test
        @DisplayName("a zero exit with an agent reply is not an error")
        void replyOnlySuccess() {
            var reply = new WorkerEvent.ItemCompleted("m1", ItemPayload.agentMessage("The answer is 42"), TS,
                    JsonNodeFactory.instance.objectNode());

            assertTrue(classifier.classify(exit(0, List.of(turnStarted(), reply, turnCompleted()), "")).isEmpty());
        }
    }

    @Nested
    @DisplayName("silent failure")
    class SilentFailureTests {

        @Test
        @DisplayName("a zero exit with no events is a silent failure")
        void noEvents() {
            ClassifiedError error = classifier.classify(exit(0, List.of(), "")).orElseThrow();

            assertEquals(ErrorCode.SILENT_FAILURE, error.code());
            assertEquals(0, error.details().get("eventsCount"));
            assertNotNull(error.suggestion());
            assertFalse(error.retryable());
        }

        @Test
        @DisplayName("a completed turn without any work is a silent failure")
        void turnWithoutWork() {
            ClassifiedError error = classifier.classify(exit(0, List.of(turnStarted(), turnCompleted()), ""))
                    .orElseThrow();

            assertEquals(ErrorCode.SILENT_FAILURE, error.code());
            assertEquals(List.of("turn.started", "turn.completed"), error.details().get("eventTypes"));
        }
    }

    @Nested
    @DisplayName("rule order")
    class OrderTests {

        @Test
        @DisplayName("timeout wins over everything else")
        void timeoutFirst() {
            var envelope = new TimeoutEnvelope(TimeoutKind.INACTIVITY, "no output for 300s [EIDLE]", 301_000, 300_000,
                    new PartialResults(List.of(turnStarted()), 1, "", "", TS));
            var result = ExecutionResult.timedOut("worker-1", List.of(turnStarted()), "", "401 Unauthorized",
                    envelope, 301_000);

            ClassifiedError error = classifier.classify(result).orElseThrow();

            assertEquals(ErrorCode.TIMEOUT, error.code());
            assertEquals("inactivity", error.details().get("timeoutKind"));
            assertEquals("EIDLE", error.details().get("timeoutCode"));
            @SuppressWarnings("unchecked")
            Map<String, Object> partial = (Map<String, Object>) error.details().get("partialResults");
            assertEquals(1, partial.get("totalEvents"));
        }

        @Test
        @DisplayName("spawn errors explain a missing executable")
        void spawnMissing() {
            var result = ExecutionResult.spawnFailed("worker-1",
                    "Cannot run program \"codex\": error=2, No such file or directory", "", 3);

            ClassifiedError error = classifier.classify(result).orElseThrow();

            assertEquals(ErrorCode.SPAWN_ERROR, error.code());
            assertTrue(error.message().contains("executable not found"));
            assertNotNull(error.suggestion());
        }

        @Test
        @DisplayName("SIGKILL is retryable, SIGTERM is not")
        void signals() {
            var killed = ExecutionResult.exited("w", List.of(), "", "", null, "SIGKILL", false, 10);
            var terminated = ExecutionResult.exited("w", List.of(), "", "", null, "SIGTERM", false, 10);

            ClassifiedError killedError = classifier.classify(killed).orElseThrow();
            ClassifiedError terminatedError = classifier.classify(terminated).orElseThrow();

            assertEquals(ErrorCode.PROCESS_KILLED, killedError.code());
            assertTrue(killedError.retryable());
            assertEquals(ErrorCode.PROCESS_KILLED, terminatedError.code());
            assertFalse(terminatedError.retryable());
        }

        @Test
        @DisplayName("a failed turn is reported with the worker's own reason")
        void turnFailedBeforePatterns() {
            var result = exit(1, List.of(turnStarted(), turnFailed("stream disconnected before completion")),
                    "Error: 401 Unauthorized");

            ClassifiedError error = classifier.classify(result).orElseThrow();

            assertEquals(ErrorCode.TURN_FAILED, error.code());
            assertTrue(error.message().contains("stream disconnected"));
        }

        @Test
        @DisplayName("non-zero exits fall back to a generic exit error")
        void exitError() {
            ClassifiedError error = classifier.classify(exit(2, List.of(), "segfault in module foo\n")).orElseThrow();

            assertEquals(ErrorCode.EXIT_ERROR, error.code());
            assertEquals("Worker exited with code 2: segfault in module foo", error.message());
            assertEquals(2, error.details().get("exitCode"));
        }

        @Test
        @DisplayName("a run canceled before spawn is unknown, not silent")
        void canceledBeforeStart() {
            ClassifiedError error = classifier.classify(ExecutionResult.canceledBeforeStart("w")).orElseThrow();

            assertEquals(ErrorCode.UNKNOWN_ERROR, error.code());
            assertEquals(true, error.details().get("canceled"));
        }
    }

    @Nested
    @DisplayName("diagnostic patterns")
    class PatternTests {

        @Test
        void authentication() {
            assertEquals(ErrorCode.AUTH_ERROR, codeFor("Error: 401 Unauthorized"));
            assertEquals(ErrorCode.AUTH_ERROR, codeFor("You are not logged in. Run `codex login`."));
        }

        @Test
        void untrustedDirectory() {
            assertEquals(ErrorCode.UNTRUSTED_DIRECTORY,
                    codeFor("Not inside a trusted directory and --skip-git-repo-check was not specified."));
        }

        @Test
        void network() {
            assertEquals(ErrorCode.NETWORK_ERROR, codeFor("getaddrinfo ENOTFOUND api.openai.com"));
        }

        @Test
        void rateLimit() {
            ClassifiedError error = classifier.classify(exit(1, List.of(), "HTTP 429 Too Many Requests")).orElseThrow();

            assertEquals(ErrorCode.RATE_LIMITED, error.code());
            assertTrue(error.retryable());
        }

        @Test
        void permission() {
            assertEquals(ErrorCode.PERMISSION_DENIED, codeFor("open /etc/shadow: permission denied"));
        }

        @Test
        void upstreamTimeout() {
            assertEquals(ErrorCode.UPSTREAM_TIMEOUT, codeFor("request timed out after 60s"));
        }

        @Test
        @DisplayName("falls back to stdout when stderr is empty")
        void stdoutFallback() {
            var result = ExecutionResult.exited("w", List.of(), "fatal: ECONNREFUSED 127.0.0.1:443", "", 1, null,
                    false, 10);

            assertEquals(ErrorCode.NETWORK_ERROR, classifier.classify(result).orElseThrow().code());
        }

        private ErrorCode codeFor(String stderr) {
            return classifier.classify(exit(1, List.of(), stderr)).orElseThrow().code();
        }
    }
}
