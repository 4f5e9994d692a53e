package com.subphot.selection;

import com.subphot.model.FrameRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：SelectionCascade（class）。
 * 主要职责：按固定顺序逐级尝试“截断排名求交”，首个满足配额的层级即为结果，后续层级不再计算。
 * 交集默认按首个准则的排名排序；标记为 poolOrder 的层级按候选池中的原始位置排序。两种顺序在相同输入下都确定。
 */
public final class SelectionCascade {
    private final Map<String, SelectionCriterion> criteria;
    private final List<CascadeLevel> levels;

    public SelectionCascade(List<SelectionCriterion> criteria, List<CascadeLevel> levels) {
        Map<String, SelectionCriterion> byName = new LinkedHashMap<>();
        for (SelectionCriterion criterion : criteria) {
            byName.put(criterion.name, criterion);
        }
        for (CascadeLevel level : levels) {
            if (level.criteria.isEmpty()) {
                throw new IllegalArgumentException("cascade level " + level.name + " names no criteria");
            }
            for (String name : level.criteria) {
                SelectionCriterion criterion = byName.get(name);
                if (criterion == null || !criterion.ranks()) {
                    throw new IllegalArgumentException("cascade level " + level.name + " uses unknown ranking " + name);
                }
            }
        }
        this.criteria = byName;
        this.levels = List.copyOf(levels);
    }

    public List<CascadeLevel> levels() {
        return levels;
    }

/**
 * 方法说明：select，逐级求交直至满足配额。
 * 处理流程：每个准则的排名只计算一次并截断到 depth；每一级把交集规模写入 trace；满足配额时返回前 take 个。
 * 维护提示：层级顺序即降级顺序，不可重排。
 */
    public SelectionResult select(List<FrameRecord> pool, int depth, int take) throws SelectionQuorumException {
        Map<String, List<FrameRecord>> rankings = new LinkedHashMap<>();
        List<String> trace = new ArrayList<>();
        Map<Path, Integer> poolPosition = new HashMap<>();
        for (int i = 0; i < pool.size(); i++) {
            poolPosition.putIfAbsent(pool.get(i).frame, i);
        }
        for (CascadeLevel level : levels) {
            List<List<FrameRecord>> operands = new ArrayList<>();
            for (String name : level.criteria) {
                operands.add(rankings.computeIfAbsent(name, key -> criteria.get(key).rank(pool, depth)));
            }
            List<FrameRecord> candidates = intersect(operands);
            if (level.poolOrder) {
                candidates.sort(Comparator.comparingInt(record -> poolPosition.get(record.frame)));
            }
            trace.add(String.format(Locale.ROOT, "%s=%d", level.name, candidates.size()));
            if (candidates.size() >= level.quota && !candidates.isEmpty()) {
                int count = Math.min(take, candidates.size());
                return new SelectionResult(candidates.subList(0, count), level.name, level.degraded, trace, 0, 0);
            }
        }
        throw new SelectionQuorumException(
                String.format(Locale.ROOT, "no cascade level reached its quota over a pool of %d frames", pool.size()),
                trace
        );
    }

    /**
     * Members of the first ranking that appear in every other ranking, in the first ranking's order.
     */
    static List<FrameRecord> intersect(List<List<FrameRecord>> rankings) {
        if (rankings.isEmpty()) {
            return List.of();
        }
        List<Set<Path>> others = new ArrayList<>();
        for (List<FrameRecord> ranking : rankings.subList(1, rankings.size())) {
            Set<Path> members = new HashSet<>();
            for (FrameRecord record : ranking) {
                members.add(record.frame);
            }
            others.add(members);
        }
        List<FrameRecord> out = new ArrayList<>();
        for (FrameRecord record : rankings.get(0)) {
            boolean inAll = true;
            for (Set<Path> members : others) {
                if (!members.contains(record.frame)) {
                    inAll = false;
                    break;
                }
            }
            if (inAll) {
                out.add(record);
            }
        }
        return out;
    }
}
