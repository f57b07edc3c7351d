package com.agentrelay.core.engine;

import com.agentrelay.core.model.Task;
import com.agentrelay.core.progress.ProgressSummary;

/**
 * @param task     the registry record
 * @param progress live progress when the task runs in this process, else the last persisted snapshot
 * @param live     whether {@code progress} comes from a run in this process
 */
public record TaskStatusView(Task task, ProgressSummary progress, boolean live) {}
