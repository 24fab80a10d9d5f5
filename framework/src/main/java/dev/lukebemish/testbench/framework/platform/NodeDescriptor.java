package dev.lukebemish.testbench.framework.platform;

import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestSource;
import dev.lukebemish.testbench.framework.model.UniqueId;
import org.jspecify.annotations.Nullable;
import org.junit.platform.engine.support.descriptor.AbstractTestDescriptor;
import org.junit.platform.engine.support.descriptor.ClassSource;
import org.junit.platform.engine.support.descriptor.MethodSource;

class NodeDescriptor extends AbstractTestDescriptor {
    private final UniqueId nodeId;
    private final Type type;

    NodeDescriptor(org.junit.platform.engine.UniqueId uniqueId, TestNode node) {
        super(uniqueId, node.displayName(), toPlatformSource(node.source()));
        this.nodeId = node.id();
        this.type = node.isContainer() ? Type.CONTAINER : Type.TEST;
    }

    UniqueId getNodeId() {
        return nodeId;
    }

    @Override
    public Type getType() {
        return type;
    }

    private static org.junit.platform.engine.@Nullable TestSource toPlatformSource(TestSource source) {
        var container = source.containerName();
        if (container.isEmpty()) {
            return null;
        }
        return source.unitName()
            .<org.junit.platform.engine.TestSource>map(unit -> MethodSource.from(container.get(), unit))
            .orElseGet(() -> ClassSource.from(container.get()));
    }
}
