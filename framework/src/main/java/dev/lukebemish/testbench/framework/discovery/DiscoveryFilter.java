package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.NodeKind;

import java.util.function.Predicate;

public interface DiscoveryFilter {
    NodeKind target();

    boolean includes(Candidate candidate);

    static DiscoveryFilter containers(Predicate<String> namePredicate) {
        return of(NodeKind.CONTAINER, namePredicate);
    }

    static DiscoveryFilter units(Predicate<String> namePredicate) {
        return of(NodeKind.LEAF, namePredicate);
    }

    private static DiscoveryFilter of(NodeKind target, Predicate<String> namePredicate) {
        return new DiscoveryFilter() {
            @Override
            public NodeKind target() {
                return target;
            }

            @Override
            public boolean includes(Candidate candidate) {
                return namePredicate.test(candidate.name());
            }
        };
    }
}
