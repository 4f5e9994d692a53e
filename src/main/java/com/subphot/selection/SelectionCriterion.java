package com.subphot.selection;

import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named ordering over one metric, or a hard gate, or both.
 */
public final class SelectionCriterion {
    public enum Direction {
        LARGER_IS_BETTER,
        SMALLER_IS_BETTER
    }

    public final String name;
    public final MetricName metric;
    public final Direction direction;
    public final boolean absolute;
    private final Predicate<FrameRecord> gate;

    private SelectionCriterion(
            String name,
            MetricName metric,
            Direction direction,
            boolean absolute,
            Predicate<FrameRecord> gate
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.metric = metric;
        this.direction = direction;
        this.absolute = absolute;
        this.gate = gate;
    }

    public static SelectionCriterion largerIsBetter(String name, MetricName metric) {
        return new SelectionCriterion(name, metric, Direction.LARGER_IS_BETTER, false, null);
    }

    public static SelectionCriterion smallerIsBetter(String name, MetricName metric) {
        return new SelectionCriterion(name, metric, Direction.SMALLER_IS_BETTER, false, null);
    }

    /**
     * Ranks on {@code |metric|}, smallest first.
     */
    public static SelectionCriterion smallestMagnitude(String name, MetricName metric) {
        return new SelectionCriterion(name, metric, Direction.SMALLER_IS_BETTER, true, null);
    }

    /**
     * A pure hard gate; it takes no part in ranking.
     */
    public static SelectionCriterion gate(String name, Predicate<FrameRecord> gate) {
        return new SelectionCriterion(name, null, null, false, Objects.requireNonNull(gate, "gate"));
    }

    public boolean ranks() {
        return metric != null;
    }

    public boolean gates() {
        return gate != null;
    }

    public boolean admits(FrameRecord record) {
        return gate == null || gate.test(record);
    }

    /**
     * Pool sorted best first and cut to {@code depth}. The sort is stable, so ties keep pool order.
     */
    public List<FrameRecord> rank(List<FrameRecord> pool, int depth) {
        if (!ranks()) {
            throw new IllegalStateException("criterion " + name + " is a gate and cannot rank");
        }
        Comparator<FrameRecord> order = Comparator.comparingDouble(this::key);
        if (direction == Direction.LARGER_IS_BETTER) {
            order = order.reversed();
        }
        List<FrameRecord> ranked = new ArrayList<>(pool);
        ranked.sort(order);
        int limit = Math.max(0, Math.min(depth, ranked.size()));
        return new ArrayList<>(ranked.subList(0, limit));
    }

    private double key(FrameRecord record) {
        double value = record.value(metric);
        return absolute ? Math.abs(value) : value;
    }

    @Override
    public String toString() {
        return name;
    }
}
