package com.salesadvisor.similarity;

import com.salesadvisor.exception.NotFittedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact nearest-neighbour search under Euclidean distance over the fitted training matrix.
 * Equal distances are ordered by training row index, so a query is deterministic for a given fit.
 */
@Slf4j
public class CohortIndex {

    private static final Comparator<Candidate> NEAREST_FIRST =
        Comparator.comparingDouble(Candidate::squaredDistance).thenComparingInt(Candidate::row);

    private volatile Fitted fitted;

    public void fit(double[][] features, double[] targets) {
        fit(features, targets, null);
    }

    public synchronized void fit(double[][] features, double[] targets, boolean[] promoFlags) {
        if (fitted != null) {
            throw new IllegalStateException("CohortIndex is already fitted; create a new instance to refit");
        }
        if (features == null || targets == null || features.length == 0) {
            throw new IllegalArgumentException("CohortIndex needs at least one training row");
        }
        if (features.length != targets.length) {
            throw new IllegalArgumentException("Row count mismatch: " + features.length
                + " feature rows vs " + targets.length + " targets");
        }
        if (promoFlags != null && promoFlags.length != targets.length) {
            throw new IllegalArgumentException("Row count mismatch: " + promoFlags.length
                + " promo flags vs " + targets.length + " targets");
        }
        int width = features[0].length;
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            if (features[i].length != width) {
                throw new IllegalArgumentException("Row " + i + " has width " + features[i].length + ", expected " + width);
            }
            copy[i] = features[i].clone();
        }
        fitted = new Fitted(copy, targets.clone(), promoFlags != null ? promoFlags.clone() : null, width);
        log.info("CohortIndex fitted | rows={} | width={}", copy.length, width);
    }

    public CohortResult query(double[] x, int k) {
        Fitted index = requireFitted();
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, got " + k);
        }
        if (x.length != index.width()) {
            throw new IllegalArgumentException("Query width " + x.length + " does not match index width " + index.width());
        }

        int limit = Math.min(k, index.features().length);
        PriorityQueue<Candidate> worstOnTop = new PriorityQueue<>(limit + 1, NEAREST_FIRST.reversed());
        for (int row = 0; row < index.features().length; row++) {
            Candidate candidate = new Candidate(row, squaredDistance(x, index.features()[row]));
            if (worstOnTop.size() < limit) {
                worstOnTop.add(candidate);
            } else if (NEAREST_FIRST.compare(candidate, worstOnTop.peek()) < 0) {
                worstOnTop.poll();
                worstOnTop.add(candidate);
            }
        }

        List<Candidate> nearest = new ArrayList<>(worstOnTop);
        nearest.sort(NEAREST_FIRST);
        return new CohortResult(nearest.stream()
            .map(c -> new CohortNeighbor(
                c.row(),
                index.targets()[c.row()],
                Math.sqrt(c.squaredDistance()),
                index.promoFlags() != null ? index.promoFlags()[c.row()] : null))
            .toList());
    }

    public CohortSummary summarize(double[] x, int k) {
        return CohortSummary.of(query(x, k));
    }

    public boolean isFitted() {
        return fitted != null;
    }

    public int size() {
        return requireFitted().features().length;
    }

    private Fitted requireFitted() {
        Fitted index = fitted;
        if (index == null) {
            throw new NotFittedException("CohortIndex");
        }
        return index;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private record Candidate(int row, double squaredDistance) {}

    private record Fitted(double[][] features, double[] targets, boolean[] promoFlags, int width) {}
}
