package com.adpilot.queue;

/**
 * Dispatch priority. Higher values are claimed first; within one level dispatch is FIFO.
 */
public enum JobPriority {

    LOW(1),
    NORMAL(5),
    HIGH(10),
    CRITICAL(15);

    private final int value;

    JobPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static JobPriority fromValue(int value) {
        JobPriority resolved = LOW;
        for (JobPriority priority : values()) {
            if (value >= priority.value) {
                resolved = priority;
            }
        }
        return resolved;
    }
}
