package com.agentrelay.core.engine;

public enum CancelOutcome {
    /** The task was pending or working and is now canceled. */
    CANCELED,
    /** The task had already finished; nothing was changed. */
    ALREADY_TERMINAL
}
