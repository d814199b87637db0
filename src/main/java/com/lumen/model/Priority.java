package com.lumen.model;

/**
 * Batch scheduling priority. Lower rank drains first.
 */
public enum Priority {
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
