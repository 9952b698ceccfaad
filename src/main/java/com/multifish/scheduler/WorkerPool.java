package com.multifish.scheduler;

/**
 * Fixed-capacity admission gate for job executions. Acquisition never blocks.
 * Resizing keeps as many of the currently held slots as fit in the new capacity;
 * releases beyond the held count are ignored, so a shrink can never drive the
 * count negative.
 */
public class WorkerPool {

    private int capacity;
    private int inUse;

    public WorkerPool(int capacity) {
        requirePositive(capacity);
        this.capacity = capacity;
    }

    public synchronized boolean tryAcquire() {
        if (inUse >= capacity) {
            return false;
        }
        inUse++;
        return true;
    }

    public synchronized void release() {
        if (inUse > 0) {
            inUse--;
        }
    }

    public synchronized void resize(int newCapacity) {
        requirePositive(newCapacity);
        capacity = newCapacity;
        inUse = Math.min(inUse, newCapacity);
    }

    public synchronized int capacity() { return capacity; }

    public synchronized int active() { return inUse; }

    public synchronized int available() { return capacity - inUse; }

    private static void requirePositive(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException(
                    "worker pool size must be greater than 0, got " + size);
        }
    }
}
