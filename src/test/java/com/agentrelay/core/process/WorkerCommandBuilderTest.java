package com.agentrelay.core.process;

import com.agentrelay.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerCommandBuilderTest {

    private RelayProperties.Worker settings;
    private WorkerCommandBuilder builder;

    @BeforeEach
    void setUp() {
        settings = new RelayProperties.Worker();
        settings.setPassthroughEnv(List.of("PATH", "HOME"));
        builder = new WorkerCommandBuilder(settings);
    }

    @Nested
    @DisplayName("command")
    class CommandTests {

        @Test
        @DisplayName("passes the instruction as a single argument after the separator")
        void instructionLast() {
            String instruction = "--help; rm -rf / && echo \"$(whoami)\"";
            List<String> args = builder.command(WorkerRequest.builder(instruction).build());

            assertEquals("codex", args.get(0));
            assertEquals(List.of("exec", "--json"), args.subList(1, 3));
            assertEquals("--", args.get(args.size() - 2));
            assertEquals(instruction, args.get(args.size() - 1));
        }

        @Test
        @DisplayName("defaults to read-only sandbox with no inherited environment")
        void defaults() {
            List<String> args = builder.command(WorkerRequest.builder("list files").build());

            assertTrue(args.contains("--sandbox=read-only"));
            assertTrue(args.contains("shell_environment_policy.inherit=none"));
            assertFalse(args.contains("--skip-git-repo-check"));
            assertTrue(args.stream().noneMatch(a -> a.startsWith("--model")));
        }

        @Test
        @DisplayName("adds model, schema, mode and git check options")
        void options() {
            List<String> args = builder.command(WorkerRequest.builder("fix it")
                    .mode(SandboxMode.WORKSPACE_WRITE)
                    .model("gpt-5-codex")
                    .outputSchema(Path.of("/tmp/schema.json"))
                    .skipGitRepoCheck(true)
                    .build());

            assertTrue(args.contains("--sandbox=workspace-write"));
            assertTrue(args.contains("--model=gpt-5-codex"));
            assertTrue(args.contains("--output-schema=/tmp/schema.json"));
            assertTrue(args.contains("--skip-git-repo-check"));
        }

        @Test
        @DisplayName("falls back to the configured default model")
        void defaultModel() {
            settings.setDefaultModel("o4-mini");

            assertTrue(builder.command(WorkerRequest.builder("x").build()).contains("--model=o4-mini"));
        }

        @Test
        @DisplayName("allow-list policy restricts the worker shell to the listed variables")
        void allowListFlags() {
            List<String> args = builder.command(WorkerRequest.builder("x")
                    .envPolicy(EnvPolicy.ALLOW_LIST)
                    .envAllowList(List.of("GITHUB_TOKEN", "NODE_ENV"))
                    .build());

            assertTrue(args.contains("shell_environment_policy.include_only=[\"GITHUB_TOKEN\",\"NODE_ENV\"]"));
        }

        @Test
        @DisplayName("inherit-all policy is passed to the worker shell")
        void inheritAllFlags() {
            List<String> args = builder.command(WorkerRequest.builder("x").envPolicy(EnvPolicy.INHERIT_ALL).build());

            assertTrue(args.contains("shell_environment_policy.inherit=all"));
        }

        @Test
        @DisplayName("resumes the given thread with the instruction still after the separator")
        void resumeThread() {
            List<String> args = builder.command(WorkerRequest.builder("-continue")
                    .resumeThreadId("0199a213-81c0")
                    .build());

            assertEquals(List.of("resume", "0199a213-81c0", "--", "-continue"), args.subList(args.size() - 4, args.size()));
            assertEquals("--json", args.get(2));
            assertFalse(builder.command(WorkerRequest.builder("x").build()).contains("resume"));
        }

        @Test
        @DisplayName("rejects a blank thread to resume")
        void rejectsBlankResumeThread() {
            assertThrows(IllegalArgumentException.class,
                    () -> WorkerRequest.builder("x").resumeThreadId(" ").build());
        }
    }

    @Nested
    @DisplayName("environment")
    class EnvironmentTests {

        private final Map<String, String> parent = Map.of(
                "PATH", "/usr/bin",
                "HOME", "/home/dev",
                "AWS_SECRET_ACCESS_KEY", "secret",
                "GITHUB_TOKEN", "ghp");

        @Test
        @DisplayName("inherit-none keeps only pass-through variables")
        void inheritNone() {
            Map<String, String> env = builder.environment(WorkerRequest.builder("x").build(), parent);

            assertEquals(Map.of("PATH", "/usr/bin", "HOME", "/home/dev"), env);
        }

        @Test
        @DisplayName("allow-list adds the named variables that exist")
        void allowList() {
            Map<String, String> env = builder.environment(WorkerRequest.builder("x")
                    .envPolicy(EnvPolicy.ALLOW_LIST)
                    .envAllowList(List.of("GITHUB_TOKEN", "MISSING"))
                    .build(), parent);

            assertEquals(Map.of("PATH", "/usr/bin", "HOME", "/home/dev", "GITHUB_TOKEN", "ghp"), env);
        }

        @Test
        @DisplayName("inherit-all copies everything")
        void inheritAll() {
            Map<String, String> env = builder.environment(
                    WorkerRequest.builder("x").envPolicy(EnvPolicy.INHERIT_ALL).build(), parent);

            assertEquals(parent, env);
        }
    }

    @Test
    void rejectsBlankInstruction() {
        assertThrows(IllegalArgumentException.class, () -> WorkerRequest.builder("  ").build());
    }

    @Test
    void signalsFromExitStatus() {
        assertEquals("SIGTERM", Signals.fromExitStatus(143).orElseThrow());
        assertEquals("SIGKILL", Signals.fromExitStatus(137).orElseThrow());
        assertTrue(Signals.fromExitStatus(1).isEmpty());
        assertTrue(Signals.fromExitStatus(128).isEmpty());
    }
}
