package com.salesadvisor.similarity;

import java.util.List;
import java.util.Objects;

public record CohortResult(List<CohortNeighbor> neighbors) {

    public CohortResult {
        neighbors = List.copyOf(neighbors);
    }

    public int size() {
        return neighbors.size();
    }

    public double[] targets() {
        return neighbors.stream().mapToDouble(CohortNeighbor::target).toArray();
    }

    public double[] distances() {
        return neighbors.stream().mapToDouble(CohortNeighbor::distance).toArray();
    }

    public boolean hasPromoFlags() {
        return !neighbors.isEmpty() && neighbors.stream().map(CohortNeighbor::promoActive).allMatch(Objects::nonNull);
    }

    public double meanTarget() {
        return neighbors.stream().mapToDouble(CohortNeighbor::target).average().orElse(Double.NaN);
    }
}
