package com.myscrollr.delivery.lifecycle;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one lifecycle operation.
 *
 * @param applied    number of single-key mutations that reached the store
 * @param failedKeys routing keys whose mutation failed and was skipped
 */
public record LifecycleResult(int applied, List<String> failedKeys) {

    public static final LifecycleResult NOTHING = new LifecycleResult(0, List.of());

    public LifecycleResult {
        failedKeys = List.copyOf(failedKeys);
    }

    public boolean succeeded() {
        return failedKeys.isEmpty();
    }

    public LifecycleResult merge(LifecycleResult other) {
        List<String> failed = new ArrayList<>(failedKeys);
        failed.addAll(other.failedKeys);
        return new LifecycleResult(applied + other.applied, failed);
    }
}
