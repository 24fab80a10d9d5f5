package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeExecutionListenerTest {
    @Test
    void testListenersAreCalledInRegistrationOrder() {
        var calls = new ArrayList<String>();
        var composite = new CompositeExecutionListener(List.of(
            named("first", calls),
            named("second", calls)
        ));
        var plan = ListenerTestSupport.passAndFail();

        composite.planExecutionStarted(plan);
        composite.executionStarted(plan.getRoot());

        assertEquals(List.of("first plan", "second plan", "first start", "second start"), calls);
    }

    @Test
    void testFailingListenerIsDisabled() {
        var calls = new ArrayList<String>();
        var broken = new ExecutionListener() {
            @Override
            public void planExecutionStarted(TestPlan plan) {
                throw new IllegalStateException("closed stream");
            }
        };
        var healthy = named("healthy", calls);
        var composite = new CompositeExecutionListener(List.of(broken, healthy));
        var plan = ListenerTestSupport.passAndFail();

        composite.planExecutionStarted(plan);
        composite.executionStarted(plan.getRoot());
        composite.executionFinished(plan.getRoot(), ExecutionResult.successful());
        composite.planExecutionFinished(plan);

        assertEquals(List.of(broken), composite.getDisabledListeners());
        assertEquals(List.of("healthy plan", "healthy start", "healthy finish", "healthy done"), calls);
    }

    @Test
    void testOutOfMemoryIsNotSwallowed() {
        var composite = new CompositeExecutionListener(List.of(new ExecutionListener() {
            @Override
            public void executionStarted(TestNode node) {
                throw new OutOfMemoryError("simulated");
            }
        }));
        var plan = ListenerTestSupport.passAndFail();

        assertThrows(OutOfMemoryError.class, () -> composite.executionStarted(plan.getRoot()));
    }

    private static ExecutionListener named(String name, List<String> calls) {
        return new ExecutionListener() {
            @Override
            public void planExecutionStarted(TestPlan plan) {
                calls.add(name + " plan");
            }

            @Override
            public void executionStarted(TestNode node) {
                calls.add(name + " start");
            }

            @Override
            public void executionFinished(TestNode node, ExecutionResult result) {
                calls.add(name + " finish");
            }

            @Override
            public void planExecutionFinished(TestPlan plan) {
                calls.add(name + " done");
            }
        };
    }
}
