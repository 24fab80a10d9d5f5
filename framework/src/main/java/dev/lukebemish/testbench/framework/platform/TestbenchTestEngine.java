package dev.lukebemish.testbench.framework.platform;

import com.google.auto.service.AutoService;
import dev.lukebemish.testbench.framework.discovery.DiscoveryEngine;
import dev.lukebemish.testbench.framework.discovery.DiscoveryFilter;
import dev.lukebemish.testbench.framework.discovery.DiscoveryRequest;
import dev.lukebemish.testbench.framework.discovery.Selector;
import dev.lukebemish.testbench.framework.discovery.Selectors;
import dev.lukebemish.testbench.framework.execution.ExecutionEngine;
import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.execution.FailureKind;
import dev.lukebemish.testbench.framework.listener.ExecutionListener;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.reflect.ReflectiveDiscovery;
import org.junit.platform.engine.EngineDiscoveryRequest;
import org.junit.platform.engine.EngineExecutionListener;
import org.junit.platform.engine.ExecutionRequest;
import org.junit.platform.engine.TestDescriptor;
import org.junit.platform.engine.TestEngine;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.engine.UniqueId;
import org.junit.platform.engine.discovery.ClassNameFilter;
import org.junit.platform.engine.discovery.ClassSelector;
import org.junit.platform.engine.discovery.MethodSelector;
import org.junit.platform.engine.discovery.PackageSelector;
import org.junit.platform.engine.discovery.UniqueIdSelector;
import org.opentest4j.TestAbortedException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@AutoService(TestEngine.class)
public class TestbenchTestEngine implements TestEngine {
    @Override
    public String getId() {
        return ReflectiveDiscovery.ENGINE_ID;
    }

    @Override
    public Optional<String> getGroupId() {
        return Optional.of("dev.lukebemish.testbench");
    }

    @Override
    public Optional<String> getArtifactId() {
        return Optional.of("testbench-framework");
    }

    @Override
    public TestDescriptor discover(EngineDiscoveryRequest discoveryRequest, UniqueId uniqueId) {
        var selectors = new ArrayList<Selector>();
        var wholePackages = new ArrayList<String>();
        var wholeClasses = new HashSet<String>();
        var units = new HashSet<UnitReference>();
        for (PackageSelector selector : discoveryRequest.getSelectorsByType(PackageSelector.class)) {
            selectors.add(Selectors.selectPackage(selector.getPackageName()));
            wholePackages.add(selector.getPackageName());
        }
        for (ClassSelector selector : discoveryRequest.getSelectorsByType(ClassSelector.class)) {
            selectors.add(Selectors.selectClass(selector.getClassName()));
            wholeClasses.add(selector.getClassName());
        }
        for (MethodSelector selector : discoveryRequest.getSelectorsByType(MethodSelector.class)) {
            selectors.add(Selectors.selectClass(selector.getClassName()));
            units.add(new UnitReference(selector.getClassName(), selector.getMethodName()));
        }
        for (UniqueIdSelector selector : discoveryRequest.getSelectorsByType(UniqueIdSelector.class)) {
            var segments = selector.getUniqueId().getSegments();
            if (!selector.getUniqueId().getEngineId().map(getId()::equals).orElse(false) || segments.size() < 2) {
                continue;
            }
            var container = segments.get(1);
            if (!DiscoveryEngine.CONTAINER_SEGMENT_TYPE.equals(container.getType())) {
                continue;
            }
            selectors.add(Selectors.selectClass(container.getValue()));
            if (segments.size() > 2 && DiscoveryEngine.UNIT_SEGMENT_TYPE.equals(segments.get(2).getType())) {
                units.add(new UnitReference(container.getValue(), segments.get(2).getValue()));
            } else {
                wholeClasses.add(container.getValue());
            }
        }
        var filters = new ArrayList<DiscoveryFilter>();
        for (ClassNameFilter filter : discoveryRequest.getFiltersByType(ClassNameFilter.class)) {
            filters.add(DiscoveryFilter.containers(name -> filter.apply(name).included()));
        }
        var request = DiscoveryRequest.builder()
            .selectors(selectors)
            .filters(filters)
            .build();
        var plan = ReflectiveDiscovery.engine().discover(request);
        if (!units.isEmpty()) {
            // Containers reached only through single units keep just those units.
            var partial = new HashSet<String>();
            for (UnitReference unit : units) {
                if (!wholeClasses.contains(unit.container()) && !inPackages(unit.container(), wholePackages)) {
                    partial.add(unit.container());
                }
            }
            plan = plan.prune(id -> {
                var last = id.getLastSegment();
                if (DiscoveryEngine.UNIT_SEGMENT_TYPE.equals(last.type())) {
                    var container = id.getParent().orElseThrow().getLastSegment().value();
                    return !partial.contains(container) || units.contains(new UnitReference(container, last.value()));
                }
                return !partial.contains(last.value());
            });
        }
        return new TestbenchEngineDescriptor(uniqueId, plan);
    }

    private static boolean inPackages(String className, List<String> packages) {
        for (String packageName : packages) {
            if (packageName.isEmpty() || className.startsWith(packageName + ".")) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void execute(ExecutionRequest request) {
        var root = (TestbenchEngineDescriptor) request.getRootTestDescriptor();
        Map<dev.lukebemish.testbench.framework.model.UniqueId, TestDescriptor> descriptors = new HashMap<>();
        descriptors.put(root.getPlan().getRoot().id(), root);
        for (TestDescriptor descendant : root.getDescendants()) {
            if (descendant instanceof NodeDescriptor node) {
                descriptors.put(node.getNodeId(), node);
            }
        }
        var plan = root.getPlan().prune(descriptors::containsKey);
        ExecutionEngine.builder()
            .listeners(new ForwardingListener(descriptors, request.getEngineExecutionListener()))
            .build()
            .execute(plan);
    }

    private record UnitReference(String container, String unit) {}

    private record ForwardingListener(
        Map<dev.lukebemish.testbench.framework.model.UniqueId, TestDescriptor> descriptors,
        EngineExecutionListener listener
    ) implements ExecutionListener {
        @Override
        public void executionStarted(TestNode node) {
            listener.executionStarted(descriptors.get(node.id()));
        }

        @Override
        public void executionFinished(TestNode node, ExecutionResult result) {
            listener.executionFinished(descriptors.get(node.id()), toPlatformResult(result));
        }

        private static TestExecutionResult toPlatformResult(ExecutionResult result) {
            return switch (result.getStatus()) {
                case SUCCESSFUL -> TestExecutionResult.successful();
                case FAILED -> result.getFailureCause().orElseThrow().kind() == FailureKind.DESCENDANT
                    ? TestExecutionResult.successful()
                    : TestExecutionResult.failed(result.getThrowable().orElse(null));
                case ABORTED -> TestExecutionResult.aborted(result.getThrowable().orElse(null));
                // The platform has no "started then skipped"; a bracket we already opened closes as aborted.
                case SKIPPED -> TestExecutionResult.aborted(new TestAbortedException(result.getSkipReason().orElse("Skipped")));
            };
        }
    }
}
