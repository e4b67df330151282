package com.manifold.core.model;

/**
 * Scope tier of a research query. Each tier owns a closed range of worker counts.
 */
public enum Complexity {
    SIMPLE(2, 3),
    MODERATE(3, 4),
    COMPLEX(5, 6);

    private final int minWorkers;
    private final int maxWorkers;

    Complexity(int minWorkers, int maxWorkers) {
        this.minWorkers = minWorkers;
        this.maxWorkers = maxWorkers;
    }

    public int minWorkers() {
        return minWorkers;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public boolean allows(int workerCount) {
        return workerCount >= minWorkers && workerCount <= maxWorkers;
    }
}
