package dev.lukebemish.testbench.framework.execution;

import dev.lukebemish.testbench.framework.listener.ExecutionListener;
import dev.lukebemish.testbench.framework.model.ContainerLifecycle;
import dev.lukebemish.testbench.framework.model.TestNode;
import org.junit.jupiter.api.Test;
import org.opentest4j.TestAbortedException;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.lukebemish.testbench.framework.execution.ExecutionResult.Status.*;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineTest {
    private final RecordingListener recorder = new RecordingListener();
    private final ExecutionEngine engine = ExecutionEngine.builder().listeners(recorder).build();

    @Test
    void testPassAndFailScenario() {
        var root = Plans.root();
        var container = Plans.container(root, "Sample");
        Plans.leaf(container, "will_pass", () -> {});
        Plans.leaf(container, "will_fail", () -> assertEquals("a", "b"));

        var summary = engine.execute(Plans.plan(root));

        assertEquals(1, summary.getContainersFoundCount());
        assertEquals(1, summary.getContainersSucceededCount());
        assertEquals(0, summary.getContainersFailedCount());
        assertEquals(2, summary.getTestsFoundCount());
        assertEquals(1, summary.getTestsSucceededCount());
        assertEquals(1, summary.getTestsFailedCount());
        assertEquals(1, summary.getFailures().size());

        var failure = summary.getFailures().get(0);
        assertEquals("will_fail", failure.nodeId().getLastSegment().value());
        assertEquals(FailureKind.ASSERTION, failure.cause().kind());
        assertTrue(failure.cause().message().contains("expected: <a> but was: <b>"));

        assertEquals(FAILED, recorder.status("Sample"));
        assertEquals(FailureKind.DESCENDANT, recorder.results.get("Sample").getFailureCause().orElseThrow().kind());
        recorder.assertWellNested();
    }

    @Test
    void testEmptyContainerScenario() {
        var root = Plans.root();
        Plans.container(root, "Empty");

        var summary = engine.execute(Plans.plan(root));

        assertEquals(1, summary.getContainersFoundCount());
        assertEquals(1, summary.getContainersSucceededCount());
        assertEquals(0, summary.getTestsFoundCount());
        assertEquals(SUCCESSFUL, recorder.status("Empty"));
        assertEquals(SUCCESSFUL, recorder.status("root"));
    }

    @Test
    void testEventsAreBracketedInPlanOrder() {
        var root = Plans.root();
        var outer = Plans.container(root, "outer");
        var inner = Plans.container(outer, "inner");
        Plans.leaf(inner, "deep", () -> {});
        Plans.leaf(outer, "shallow", () -> { throw new IllegalStateException("boom"); });
        Plans.container(root, "second");

        engine.execute(Plans.plan(root));

        assertEquals(List.of(
            "start root",
            "start outer",
            "start inner",
            "start deep",
            "finish deep SUCCESSFUL",
            "finish inner SUCCESSFUL",
            "start shallow",
            "finish shallow FAILED",
            "finish outer FAILED",
            "start second",
            "finish second SUCCESSFUL",
            "finish root FAILED"
        ), recorder.events);
        recorder.assertWellNested();
    }

    @Test
    void testFailuresDoNotStopSiblings() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        var runs = new AtomicInteger();
        Plans.leaf(container, "a", () -> { runs.incrementAndGet(); throw new RuntimeException("first"); });
        Plans.leaf(container, "b", () -> { runs.incrementAndGet(); throw new NoClassDefFoundError("missing/Type"); });
        Plans.leaf(container, "c", runs::incrementAndGet);

        var summary = engine.execute(Plans.plan(root));

        assertEquals(3, runs.get());
        assertEquals(2, summary.getTestsFailedCount());
        assertEquals(FailureKind.EXCEPTION, summary.getFailures().get(0).cause().kind());
        assertEquals(FailureKind.ENVIRONMENT, summary.getFailures().get(1).cause().kind());
    }

    @Test
    void testInterruptedLeafDoesNotLeakIntoSiblings() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        Plans.leaf(container, "a_interrupted", () -> { throw new InterruptedException("stop"); });
        Plans.leaf(container, "b_sleeps", () -> Thread.sleep(1));

        var summary = engine.execute(Plans.plan(root));

        assertFalse(Thread.interrupted());
        assertEquals(FAILED, recorder.status("a_interrupted"));
        assertEquals(SUCCESSFUL, recorder.status("b_sleeps"));
        assertEquals(1, summary.getTestsSucceededCount());
    }

    @Test
    void testInterruptedHookDoesNotLeakIntoNextContainer() {
        var root = Plans.root();
        var first = Plans.container(root, "first", new ContainerLifecycle(null, () -> { throw new InterruptedException("teardown"); }));
        Plans.leaf(first, "a", () -> {});
        var second = Plans.container(root, "second");
        Plans.leaf(second, "b_sleeps", () -> Thread.sleep(1));

        engine.execute(Plans.plan(root));

        assertFalse(Thread.interrupted());
        assertEquals(FAILED, recorder.status("first"));
        assertEquals(SUCCESSFUL, recorder.status("b_sleeps"));
    }

    @Test
    void testAbortedLeafIsNotADefect() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        Plans.leaf(container, "aborts", () -> { throw new TestAbortedException("not here"); });
        Plans.leaf(container, "passes", () -> {});

        var summary = engine.execute(Plans.plan(root));

        assertEquals(ABORTED, recorder.status("aborts"));
        assertEquals(FailureKind.ABORTED, recorder.results.get("aborts").getFailureCause().orElseThrow().kind());
        assertEquals(1, summary.getTestsAbortedCount());
        assertEquals(0, summary.getTestsFailedCount());
        assertTrue(summary.getFailures().isEmpty());
        assertEquals(FAILED, recorder.status("c"));
    }

    @Test
    void testContainerAggregateFailsIffAnyLeafFails() {
        for (int failing = 0; failing <= 3; failing++) {
            var recording = new RecordingListener();
            var root = Plans.root();
            var container = Plans.container(root, "c");
            for (int i = 0; i < 3; i++) {
                boolean fails = i < failing;
                Plans.leaf(container, "leaf" + i, () -> {
                    if (fails) {
                        fail("leaf failed");
                    }
                });
            }
            ExecutionEngine.builder().listeners(recording).build().execute(Plans.plan(root));
            assertEquals(failing > 0 ? FAILED : SUCCESSFUL, recording.status("c"), "with " + failing + " failing leaves");
        }
    }

    @Test
    void testAggregation() {
        var skipped = ExecutionResult.skipped("nope");
        var failed = ExecutionResult.failed(FailureCause.of(new AssertionError()));
        var aborted = ExecutionResult.aborted(FailureCause.of(new TestAbortedException()));
        var ok = ExecutionResult.successful();

        assertEquals(SUCCESSFUL, ExecutionEngine.aggregate(List.of()).getStatus());
        assertEquals(SKIPPED, ExecutionEngine.aggregate(List.of(skipped, skipped)).getStatus());
        assertEquals(SUCCESSFUL, ExecutionEngine.aggregate(List.of(skipped, ok)).getStatus());
        assertEquals(FAILED, ExecutionEngine.aggregate(List.of(ok, aborted)).getStatus());
        assertEquals(FAILED, ExecutionEngine.aggregate(List.of(skipped, failed, ok)).getStatus());
    }

    @Test
    void testCancellationAfterFirstLeaf() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        var secondRan = new AtomicInteger();
        Plans.leaf(container, "first", () -> {});
        Plans.leaf(container, "second", secondRan::incrementAndGet);

        var token = new CancellationToken();
        var cancelAfterFirst = new ExecutionListener() {
            @Override
            public void executionFinished(TestNode node, ExecutionResult result) {
                if (node.displayName().equals("first")) {
                    token.cancel();
                }
            }
        };
        var summary = ExecutionEngine.builder().listeners(recorder, cancelAfterFirst).build().execute(Plans.plan(root), token);

        assertEquals(0, secondRan.get());
        assertEquals(SUCCESSFUL, recorder.status("first"));
        assertEquals(SKIPPED, recorder.status("second"));
        assertEquals(ExecutionEngine.CANCELLED, recorder.results.get("second").getSkipReason().orElseThrow());
        assertTrue(recorder.results.get("second").getFailureCause().isEmpty());
        assertEquals(SUCCESSFUL, recorder.status("c"));
        assertEquals(1, summary.getTestsSkippedCount());
        assertEquals(1, summary.getTestsSucceededCount());
        recorder.assertWellNested();
    }

    @Test
    void testCancellationBeforeStartSkipsEverything() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        Plans.leaf(container, "a", () -> fail("should not run"));

        var token = new CancellationToken();
        token.cancel();
        var summary = engine.execute(Plans.plan(root), token);

        assertEquals(SKIPPED, recorder.status("root"));
        assertEquals(SKIPPED, recorder.status("c"));
        assertEquals(SKIPPED, recorder.status("a"));
        assertEquals(1, summary.getContainersSkippedCount());
        assertEquals(1, summary.getTestsSkippedCount());
        recorder.assertWellNested();
    }

    @Test
    void testFailingSetupSkipsChildren() {
        var root = Plans.root();
        var teardowns = new AtomicInteger();
        var container = Plans.container(root, "c", new ContainerLifecycle(
            () -> { throw new IllegalStateException("no database"); },
            teardowns::incrementAndGet
        ));
        Plans.leaf(container, "a", () -> fail("should not run"));
        Plans.leaf(container, "b", () -> fail("should not run"));

        var summary = engine.execute(Plans.plan(root));

        assertEquals(FAILED, recorder.status("c"));
        assertEquals(FailureKind.EXCEPTION, recorder.results.get("c").getFailureCause().orElseThrow().kind());
        assertEquals(SKIPPED, recorder.status("a"));
        assertEquals(SKIPPED, recorder.status("b"));
        assertEquals(1, teardowns.get());
        assertEquals(1, summary.getContainersFailedCount());
        assertEquals("c", summary.getFailures().get(0).displayName());
        recorder.assertWellNested();
    }

    @Test
    void testFailingTeardownFailsContainer() {
        var root = Plans.root();
        var container = Plans.container(root, "c", new ContainerLifecycle(null, () -> { throw new IllegalStateException("leak"); }));
        Plans.leaf(container, "a", () -> {});

        var summary = engine.execute(Plans.plan(root));

        assertEquals(SUCCESSFUL, recorder.status("a"));
        assertEquals(FAILED, recorder.status("c"));
        assertEquals(1, summary.getContainersFailedCount());
        assertEquals(1, summary.getTestsSucceededCount());
    }

    @Test
    void testMisbehavingListenerIsIsolated() {
        var root = Plans.root();
        var container = Plans.container(root, "c");
        Plans.leaf(container, "a", () -> {});
        Plans.leaf(container, "b", () -> {});

        var calls = new AtomicInteger();
        var broken = new ExecutionListener() {
            @Override
            public void executionStarted(TestNode node) {
                calls.incrementAndGet();
                throw new IllegalStateException("printer broke");
            }
        };
        var summary = ExecutionEngine.builder().listeners(broken, recorder).build().execute(Plans.plan(root));

        assertEquals(1, calls.get());
        assertEquals(2, summary.getTestsSucceededCount());
        assertEquals(8, recorder.events.size());
        recorder.assertWellNested();
    }

    @Test
    void testParallelExecutionKeepsBracketsNested() {
        var root = Plans.root();
        var runs = new AtomicInteger();
        for (int c = 0; c < 4; c++) {
            var container = Plans.container(root, "c" + c);
            for (int l = 0; l < 5; l++) {
                var fails = l == 0;
                Plans.leaf(container, "c" + c + "-l" + l, () -> {
                    runs.incrementAndGet();
                    Thread.sleep(5);
                    if (fails) {
                        throw new AssertionError("first leaf fails");
                    }
                });
            }
        }

        var summary = ExecutionEngine.builder().listeners(recorder).parallelism(4).build().execute(Plans.plan(root));

        assertEquals(20, runs.get());
        assertEquals(20, summary.getTestsStartedCount());
        assertEquals(15, summary.getTestsSucceededCount());
        assertEquals(4, summary.getTestsFailedCount());
        assertEquals(4, summary.getFailures().size());
        assertEquals(50, recorder.events.size());
        assertEquals(FAILED, recorder.status("root"));
        assertEquals("start root", recorder.events.get(0));
        assertEquals("finish root FAILED", recorder.events.get(recorder.events.size() - 1));
        for (int c = 0; c < 4; c++) {
            var name = "c" + c;
            int start = recorder.events.indexOf("start " + name);
            int finish = recorder.events.indexOf("finish " + name + " FAILED");
            for (int l = 0; l < 5; l++) {
                var leafName = name + "-l" + l;
                int leafStart = recorder.events.indexOf("start " + leafName);
                assertTrue(start < leafStart && leafStart < finish, leafName + " ran outside of " + name);
            }
        }
    }

    @Test
    void testInvokerThatThrowsIsContained() {
        var root = Plans.root();
        Plans.leaf(Plans.container(root, "c"), "a", () -> {});

        var summary = ExecutionEngine.builder()
            .listeners(recorder)
            .invoker(leaf -> { throw new IllegalStateException("invoker broke"); })
            .build()
            .execute(Plans.plan(root));

        assertEquals(FAILED, recorder.status("a"));
        assertEquals(1, summary.getTestsFailedCount());
    }

    @Test
    void testParallelismMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionEngine.builder().parallelism(0));
    }
}
