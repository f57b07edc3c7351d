package com.agentrelay.core.watchdog;

import java.util.concurrent.Future;

/**
 * Something a {@link TimeoutWatchdog} can observe and terminate: an OS process or an async operation.
 */
public interface MonitoredProcess {

    boolean isAlive();

    /** Graceful stop request (SIGTERM for OS processes). */
    void terminate();

    /** Forceful stop (SIGKILL for OS processes). */
    void forceKill();

    static MonitoredProcess of(Process process) {
        return new OsProcess(process);
    }

    static MonitoredProcess of(Future<?> operation) {
        return new AsyncOperation(operation);
    }

    /**
     * Wraps a {@link Process}. Signals are delivered to descendants first so that
     * shells and helpers spawned by the worker do not outlive it.
     */
    record OsProcess(Process process) implements MonitoredProcess {

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }

        @Override
        public void forceKill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    /**
     * Wraps an in-process async operation; both stop levels interrupt it.
     */
    record AsyncOperation(Future<?> operation) implements MonitoredProcess {

        @Override
        public boolean isAlive() {
            return !operation.isDone();
        }

        @Override
        public void terminate() {
            operation.cancel(true);
        }

        @Override
        public void forceKill() {
            operation.cancel(true);
        }
    }
}
