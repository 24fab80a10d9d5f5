package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.NodeKind;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;
import dev.lukebemish.testbench.framework.model.TestSource;
import dev.lukebemish.testbench.framework.model.UniqueId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class DiscoveryEngine<C, L> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryEngine.class);

    public static final String CONTAINER_SEGMENT_TYPE = "container";
    public static final String UNIT_SEGMENT_TYPE = "unit";

    private final String engineId;
    private final String displayName;
    private final CandidateResolver<C, L> resolver;

    public DiscoveryEngine(String engineId, String displayName, CandidateResolver<C, L> resolver) {
        this.engineId = Objects.requireNonNull(engineId, "engineId");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public String getEngineId() {
        return engineId;
    }

    public TestPlan discover(DiscoveryRequest request) {
        return discover(request, UniqueId.root(engineId));
    }

    public TestPlan discover(DiscoveryRequest request, UniqueId rootId) {
        var root = TestNode.container(rootId, displayName, TestSource.none());
        Set<UniqueId> seen = new HashSet<>();
        for (Selector selector : request.getSelectors()) {
            List<Resolved<C>> containers = resolver.scan(selector).stream()
                .filter(resolver::isContainer)
                .map(unit -> new Resolved<>(unit, resolver.describeContainer(unit)))
                .sorted(Comparator.comparing(resolved -> resolved.candidate().name()))
                .toList();
            if (containers.isEmpty()) {
                LOGGER.debug("Selector {} resolved to no containers", selector.describe());
            }
            for (Resolved<C> container : containers) {
                if (!request.includes(NodeKind.CONTAINER, container.candidate())) {
                    continue;
                }
                var id = rootId.append(CONTAINER_SEGMENT_TYPE, container.candidate().name());
                if (!seen.add(id)) {
                    continue;
                }
                root.addChild(resolveContainer(request, id, container));
            }
        }
        var plan = new TestPlan(rootId.getEngineId(), root);
        LOGGER.debug("Discovered {} containers and {} tests for engine {}", plan.countContainers(), plan.countTests(), engineId);
        return plan;
    }

    private TestNode resolveContainer(DiscoveryRequest request, UniqueId id, Resolved<C> container) {
        var candidate = container.candidate();
        var node = TestNode.container(id, candidate.displayName(), candidate.source(), resolver.lifecycle(container.unit()));
        List<Resolved<L>> leaves = resolver.members(container.unit()).stream()
            .filter(resolver::isLeaf)
            .map(unit -> new Resolved<>(unit, resolver.describeLeaf(container.unit(), unit)))
            .sorted(Comparator.comparing(resolved -> resolved.candidate().name()))
            .toList();
        for (Resolved<L> leaf : leaves) {
            var leafCandidate = leaf.candidate();
            if (!request.includes(NodeKind.LEAF, leafCandidate)) {
                continue;
            }
            var leafId = id.append(UNIT_SEGMENT_TYPE, leafCandidate.name());
            node.addChild(TestNode.leaf(leafId, leafCandidate.displayName(), leafCandidate.source(), resolver.bind(container.unit(), leaf.unit())));
        }
        node.seal();
        return node;
    }

    private record Resolved<T>(T unit, Candidate candidate) {}
}
