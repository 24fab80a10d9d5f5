package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.NodeKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

public final class DiscoveryRequest {
    private final List<Selector> selectors;
    private final List<DiscoveryFilter> filters;

    private DiscoveryRequest(List<Selector> selectors, List<DiscoveryFilter> filters) {
        this.selectors = List.copyOf(selectors);
        this.filters = List.copyOf(filters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Selector> getSelectors() {
        return selectors;
    }

    public List<DiscoveryFilter> getFilters() {
        return filters;
    }

    boolean includes(NodeKind kind, Candidate candidate) {
        for (DiscoveryFilter filter : filters) {
            if (filter.target() == kind && !filter.includes(candidate)) {
                return false;
            }
        }
        return true;
    }

    public static final class Builder {
        private final List<Selector> selectors = new ArrayList<>();
        private final List<DiscoveryFilter> filters = new ArrayList<>();

        private Builder() {}

        public Builder selectors(Selector... selectors) {
            return selectors(Arrays.asList(selectors));
        }

        public Builder selectors(Collection<? extends Selector> selectors) {
            this.selectors.addAll(selectors);
            return this;
        }

        public Builder filters(DiscoveryFilter... filters) {
            return filters(Arrays.asList(filters));
        }

        public Builder filters(Collection<? extends DiscoveryFilter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public DiscoveryRequest build() {
            return new DiscoveryRequest(selectors, filters);
        }
    }
}
