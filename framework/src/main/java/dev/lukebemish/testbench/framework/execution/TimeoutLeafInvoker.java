package dev.lukebemish.testbench.framework.execution;

import dev.lukebemish.testbench.framework.model.TestNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each leaf on a worker thread and gives up waiting once the timeout expires. An expired leaf is interrupted
 * and reported as aborted; if it ignores the interrupt its worker thread is left to finish on its own.
 */
public final class TimeoutLeafInvoker implements LeafInvoker, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutLeafInvoker.class);

    private final LeafInvoker delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeoutLeafInvoker(LeafInvoker delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, was " + timeout);
        }
        this.timeout = timeout;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            var thread = new Thread(runnable, "testbench-leaf-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ExecutionResult invoke(TestNode leaf) {
        Future<ExecutionResult> future = executor.submit(() -> delegate.invoke(leaf));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("Leaf {} did not finish within {}", leaf.id(), timeout);
            return ExecutionResult.aborted(new FailureCause(FailureKind.TIMEOUT, new LeafTimeoutException(leaf.displayName(), timeout)));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.aborted(new FailureCause(FailureKind.ABORTED, e));
        } catch (ExecutionException e) {
            return ExecutionResult.fromThrowable(e.getCause() == null ? e : e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
