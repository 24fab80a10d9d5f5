package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.ContainerLifecycle;
import dev.lukebemish.testbench.framework.model.TestAction;

import java.util.List;

/**
 * The engine-specific half of discovery: how selectors are scanned and which scanned units are containers and
 * leaves. {@link DiscoveryEngine} owns ordering, filtering, deduplication and tree building.
 *
 * @param <C> type of a candidate container unit
 * @param <L> type of a candidate leaf unit
 */
public interface CandidateResolver<C, L> {
    /**
     * Candidate units for a selector, in any order. Must not run test code.
     *
     * @throws DiscoveryException if the selector cannot be resolved
     */
    List<C> scan(Selector selector);

    boolean isContainer(C candidate);

    List<L> members(C container);

    boolean isLeaf(L candidate);

    Candidate describeContainer(C container);

    Candidate describeLeaf(C container, L leaf);

    TestAction bind(C container, L leaf);

    default ContainerLifecycle lifecycle(C container) {
        return ContainerLifecycle.none();
    }
}
