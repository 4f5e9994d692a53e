package com.subphot.selection;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One fallback level: the criteria whose truncated rankings are intersected, and how many frames must
 * survive the intersection for the level to be accepted. A level in pool order hands back its members in
 * the order the pool listed them instead of the first criterion's ranking order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CascadeLevel {
    public final String name;
    public final List<String> criteria;
    public final int quota;
    public final boolean degraded;
    public final boolean poolOrder;

    public static CascadeLevel of(String name, int quota, boolean degraded, String... criteria) {
        return new CascadeLevel(name, List.of(criteria), quota, degraded, false);
    }

    public static CascadeLevel inPoolOrder(String name, int quota, boolean degraded, String... criteria) {
        return new CascadeLevel(name, List.of(criteria), quota, degraded, true);
    }
}
