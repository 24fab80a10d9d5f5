package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans events out to listeners in registration order, one event at a time. A listener that throws is logged and
 * receives no further events for the rest of the run.
 */
public final class CompositeExecutionListener implements ExecutionListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeExecutionListener.class);

    private final List<Entry> entries;

    public CompositeExecutionListener(List<? extends ExecutionListener> listeners) {
        this.entries = new ArrayList<>(listeners.size());
        for (ExecutionListener listener : listeners) {
            entries.add(new Entry(listener));
        }
    }

    @Override
    public synchronized void planExecutionStarted(TestPlan plan) {
        dispatch("planExecutionStarted", listener -> listener.planExecutionStarted(plan));
    }

    @Override
    public synchronized void executionStarted(TestNode node) {
        dispatch("executionStarted", listener -> listener.executionStarted(node));
    }

    @Override
    public synchronized void executionFinished(TestNode node, ExecutionResult result) {
        dispatch("executionFinished", listener -> listener.executionFinished(node, result));
    }

    @Override
    public synchronized void planExecutionFinished(TestPlan plan) {
        dispatch("planExecutionFinished", listener -> listener.planExecutionFinished(plan));
    }

    public synchronized List<ExecutionListener> getDisabledListeners() {
        return entries.stream().filter(entry -> entry.disabled).map(entry -> entry.listener).toList();
    }

    private void dispatch(String event, Consumer<ExecutionListener> call) {
        for (Entry entry : entries) {
            if (entry.disabled) {
                continue;
            }
            try {
                call.accept(entry.listener);
            } catch (Throwable t) {
                if (t instanceof OutOfMemoryError oom) {
                    throw oom;
                }
                entry.disabled = true;
                LOGGER.warn("Listener {} failed during {} and will not be notified again", entry.listener, event, t);
            }
        }
    }

    private static final class Entry {
        private final ExecutionListener listener;
        private boolean disabled;

        private Entry(ExecutionListener listener) {
            this.listener = listener;
        }
    }
}
