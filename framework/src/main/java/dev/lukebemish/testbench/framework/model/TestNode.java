package dev.lukebemish.testbench.framework.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A node of a test tree, either a container grouping other nodes or a leaf bound to a single {@link TestAction}.
 * <p>
 * A node is attached to at most one parent, once. After {@link #seal()} its children can no longer change; sealing
 * is recursive and is what {@link TestPlan} does when it is created.
 */
public final class TestNode {
    private final UniqueId id;
    private final NodeKind kind;
    private final String displayName;
    private final TestSource source;
    private final @Nullable TestAction action;
    private final ContainerLifecycle lifecycle;

    private @Nullable TestNode parent;
    private List<TestNode> children;
    private boolean sealed;

    private TestNode(UniqueId id, NodeKind kind, String displayName, TestSource source, @Nullable TestAction action, ContainerLifecycle lifecycle) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = kind;
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.source = Objects.requireNonNull(source, "source");
        this.action = action;
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.children = kind == NodeKind.CONTAINER ? new ArrayList<>() : List.of();
    }

    public static TestNode container(UniqueId id, String displayName, TestSource source) {
        return container(id, displayName, source, ContainerLifecycle.none());
    }

    public static TestNode container(UniqueId id, String displayName, TestSource source, ContainerLifecycle lifecycle) {
        return new TestNode(id, NodeKind.CONTAINER, displayName, source, null, lifecycle);
    }

    public static TestNode leaf(UniqueId id, String displayName, TestSource source, TestAction action) {
        Objects.requireNonNull(action, "action");
        return new TestNode(id, NodeKind.LEAF, displayName, source, action, ContainerLifecycle.none());
    }

    public UniqueId id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isContainer() {
        return kind == NodeKind.CONTAINER;
    }

    public boolean isLeaf() {
        return kind == NodeKind.LEAF;
    }

    public String displayName() {
        return displayName;
    }

    public TestSource source() {
        return source;
    }

    public Optional<TestNode> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null && id.isRoot();
    }

    public List<TestNode> children() {
        return sealed ? children : Collections.unmodifiableList(children);
    }

    public TestAction action() {
        if (action == null) {
            throw new IllegalStateException("Container " + id + " has no action");
        }
        return action;
    }

    public ContainerLifecycle lifecycle() {
        return lifecycle;
    }

    public boolean isSealed() {
        return sealed;
    }

    public void addChild(TestNode child) {
        if (kind != NodeKind.CONTAINER) {
            throw new StructureException("Cannot add " + child.id + " to leaf " + id);
        }
        if (sealed) {
            throw new StructureException("Cannot add " + child.id + " to sealed container " + id);
        }
        if (child.parent != null) {
            throw new StructureException("Node " + child.id + " is already attached to " + child.parent.id);
        }
        for (TestNode current = this; current != null; current = current.parent) {
            if (current == child) {
                throw new StructureException("Attaching " + child.id + " to " + id + " would create a cycle");
            }
        }
        if (!child.id.isDirectChildOf(id)) {
            throw new StructureException("Id " + child.id + " does not extend parent id " + id);
        }
        for (TestNode sibling : children) {
            if (sibling.id.equals(child.id)) {
                throw new StructureException("Duplicate sibling id " + child.id);
            }
        }
        child.parent = this;
        children.add(child);
    }

    public void seal() {
        if (sealed) {
            return;
        }
        for (TestNode child : children) {
            child.seal();
        }
        children = List.copyOf(children);
        sealed = true;
    }

    public int depth() {
        int depth = 0;
        for (TestNode current = parent; current != null; current = current.parent) {
            depth++;
        }
        return depth;
    }

    public Stream<TestNode> stream() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(TestNode::stream));
    }

    TestNode copyWithoutChildren() {
        return new TestNode(id, kind, displayName, source, action, lifecycle);
    }

    @Override
    public String toString() {
        return kind + " " + id;
    }
}
