package com.agentrelay.core.process;

import com.agentrelay.config.RelayProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the worker's argument vector and environment.
 * <p>
 * The instruction is always a single argv element after {@code --}; nothing is ever passed
 * through a shell, so arbitrary instruction text cannot inject commands or flags.
 * A resumed run appends {@code resume <threadId>} after the flags to continue that conversation.
 */
public class WorkerCommandBuilder {

    private final RelayProperties.Worker settings;

    public WorkerCommandBuilder(RelayProperties.Worker settings) {
        this.settings = settings;
    }

    public List<String> command(WorkerRequest request) {
        List<String> args = new ArrayList<>();
        args.add(settings.getBinary());
        args.add("exec");
        args.add("--json");
        args.add("--sandbox=" + request.mode().value());

        String model = request.model() != null ? request.model() : settings.getDefaultModel();
        if (model != null && !model.isBlank()) {
            args.add("--model=" + model);
        }
        if (request.outputSchema() != null) {
            args.add("--output-schema=" + request.outputSchema());
        }

        switch (request.envPolicy()) {
            case INHERIT_ALL -> {
                args.add("-c");
                args.add("shell_environment_policy.inherit=all");
            }
            case ALLOW_LIST -> {
                args.add("-c");
                args.add("shell_environment_policy.inherit=none");
                if (!request.envAllowList().isEmpty()) {
                    args.add("-c");
                    args.add("shell_environment_policy.include_only=" + tomlArray(request.envAllowList()));
                }
            }
            case INHERIT_NONE -> {
                args.add("-c");
                args.add("shell_environment_policy.inherit=none");
            }
        }

        if (request.skipGitRepoCheck() || settings.isSkipGitRepoCheck()) {
            args.add("--skip-git-repo-check");
        }

        if (request.resumeThreadId() != null) {
            args.add("resume");
            args.add(request.resumeThreadId());
        }

        // the instruction may itself start with '-'
        args.add("--");
        args.add(request.instruction());
        return args;
    }

    /**
     * Computes the worker's environment from the orchestrator's environment according to the policy.
     */
    public Map<String, String> environment(WorkerRequest request, Map<String, String> parentEnv) {
        if (request.envPolicy() == EnvPolicy.INHERIT_ALL) {
            return new LinkedHashMap<>(parentEnv);
        }
        Set<String> allowed = new LinkedHashSet<>(settings.getPassthroughEnv());
        if (request.envPolicy() == EnvPolicy.ALLOW_LIST) {
            allowed.addAll(request.envAllowList());
        }
        Map<String, String> env = new LinkedHashMap<>();
        for (String name : allowed) {
            String value = parentEnv.get(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        return env;
    }

    private static String tomlArray(List<String> values) {
        return values.stream()
                .map(v -> "\"" + v.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(",", "[", "]"));
    }
}
