package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.FailureCause;
import dev.lukebemish.testbench.framework.model.UniqueId;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public final class ExecutionSummary {
    final AtomicLong containersFound = new AtomicLong();
    final AtomicLong containersStarted = new AtomicLong();
    final AtomicLong containersSkipped = new AtomicLong();
    final AtomicLong containersAborted = new AtomicLong();
    final AtomicLong containersSucceeded = new AtomicLong();
    final AtomicLong containersFailed = new AtomicLong();

    final AtomicLong testsFound = new AtomicLong();
    final AtomicLong testsStarted = new AtomicLong();
    final AtomicLong testsSkipped = new AtomicLong();
    final AtomicLong testsAborted = new AtomicLong();
    final AtomicLong testsSucceeded = new AtomicLong();
    final AtomicLong testsFailed = new AtomicLong();

    private final List<Failure> failures = new ArrayList<>();

    volatile long timeStarted;
    volatile long timeFinished;

    ExecutionSummary() {}

    synchronized void addFailure(Failure failure) {
        failures.add(failure);
    }

    public long getContainersFoundCount() {
        return containersFound.get();
    }

    public long getContainersStartedCount() {
        return containersStarted.get();
    }

    public long getContainersSkippedCount() {
        return containersSkipped.get();
    }

    public long getContainersAbortedCount() {
        return containersAborted.get();
    }

    public long getContainersSucceededCount() {
        return containersSucceeded.get();
    }

    public long getContainersFailedCount() {
        return containersFailed.get();
    }

    public long getTestsFoundCount() {
        return testsFound.get();
    }

    public long getTestsStartedCount() {
        return testsStarted.get();
    }

    public long getTestsSkippedCount() {
        return testsSkipped.get();
    }

    public long getTestsAbortedCount() {
        return testsAborted.get();
    }

    public long getTestsSucceededCount() {
        return testsSucceeded.get();
    }

    public long getTestsFailedCount() {
        return testsFailed.get();
    }

    public long getTotalFailureCount() {
        return getContainersFailedCount() + getTestsFailedCount();
    }

    public long getTimeStarted() {
        return timeStarted;
    }

    public long getTimeFinished() {
        return timeFinished;
    }

    public synchronized List<Failure> getFailures() {
        return List.copyOf(failures);
    }

    public record Failure(UniqueId nodeId, String displayName, FailureCause cause) {}
}
