package com.agentrelay.core.watchdog;

/**
 * Keeps the last {@code capacity} characters appended to it.
 */
final class TailBuffer {

    private final int capacity;
    private final StringBuilder content = new StringBuilder();

    TailBuffer(int capacity) {
        this.capacity = capacity;
    }

    synchronized void append(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        if (chunk.length() >= capacity) {
            content.setLength(0);
            content.append(chunk, chunk.length() - capacity, chunk.length());
            return;
        }
        content.append(chunk);
        int overflow = content.length() - capacity;
        if (overflow > 0) {
            content.delete(0, overflow);
        }
    }

    @Override
    public synchronized String toString() {
        return content.toString();
    }
}
