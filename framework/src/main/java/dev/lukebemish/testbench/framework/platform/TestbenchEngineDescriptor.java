package dev.lukebemish.testbench.framework.platform;

import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;
import org.junit.platform.engine.UniqueId;
import org.junit.platform.engine.support.descriptor.EngineDescriptor;

class TestbenchEngineDescriptor extends EngineDescriptor {
    private final TestPlan plan;

    TestbenchEngineDescriptor(UniqueId uniqueId, TestPlan plan) {
        super(uniqueId, plan.getRoot().displayName());
        this.plan = plan;
        for (TestNode child : plan.getRoot().children()) {
            addChild(describe(uniqueId, child));
        }
    }

    TestPlan getPlan() {
        return plan;
    }

    private static NodeDescriptor describe(UniqueId parentId, TestNode node) {
        var segment = node.id().getLastSegment();
        var uniqueId = parentId.append(segment.type(), segment.value());
        var descriptor = new NodeDescriptor(uniqueId, node);
        for (TestNode child : node.children()) {
            descriptor.addChild(describe(uniqueId, child));
        }
        return descriptor;
    }
}
