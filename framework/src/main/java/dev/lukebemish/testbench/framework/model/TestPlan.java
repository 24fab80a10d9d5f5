package dev.lukebemish.testbench.framework.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

public final class TestPlan {
    private final String engineId;
    private final TestNode root;

    public TestPlan(String engineId, TestNode root) {
        this.engineId = Objects.requireNonNull(engineId, "engineId");
        this.root = Objects.requireNonNull(root, "root");
        if (root.parent().isPresent() || !root.id().isRoot()) {
            throw new StructureException("Plan root " + root.id() + " must be a parentless engine root");
        }
        if (!root.isContainer()) {
            throw new StructureException("Plan root " + root.id() + " must be a container");
        }
        if (!engineId.equals(root.id().getEngineId())) {
            throw new StructureException("Plan root " + root.id() + " does not belong to engine " + engineId);
        }
        root.seal();
    }

    public String getEngineId() {
        return engineId;
    }

    public TestNode getRoot() {
        return root;
    }

    public Stream<TestNode> stream() {
        return root.stream();
    }

    public long countContainers() {
        return stream().filter(node -> node != root && node.isContainer()).count();
    }

    public long countTests() {
        return stream().filter(TestNode::isLeaf).count();
    }

    public boolean containsTests() {
        return countTests() > 0;
    }

    public Optional<TestNode> findById(UniqueId id) {
        return stream().filter(node -> node.id().equals(id)).findFirst();
    }

    /**
     * Copies this plan keeping only the nodes whose id is retained. A container survives when it is retained itself
     * or when any of its descendants survives; the root always survives.
     */
    public TestPlan prune(Predicate<UniqueId> retain) {
        var copy = root.copyWithoutChildren();
        copyRetained(root, copy, retain);
        return new TestPlan(engineId, copy);
    }

    private static boolean copyRetained(TestNode original, TestNode copy, Predicate<UniqueId> retain) {
        boolean any = false;
        for (TestNode child : original.children()) {
            var childCopy = child.copyWithoutChildren();
            boolean keep = copyRetained(child, childCopy, retain) || retain.test(child.id());
            if (keep) {
                copy.addChild(childCopy);
                any = true;
            }
        }
        return any;
    }

    @Override
    public String toString() {
        return "TestPlan[" + engineId + ", " + countContainers() + " containers, " + countTests() + " tests]";
    }
}
