package com.subphot.selection;

import com.subphot.config.Config;
import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：MultiCriteriaSelector（class）。
 * 主要职责：在候选帧池上按多个质量指标排名、截断、求交，挑出天体测量参考帧（单帧）或测光参考帧组（定额）。
 * 使用建议：两种选择的降级顺序刻意不同，单帧先放弃背景再放弃检测数，定额按 (N,B) 与 (E,M) 成对放弃；不要合并。
 * 纯单线程计算，不读文件、不起子进程。
 */
public final class MultiCriteriaSelector {
    private static final Logger LOG = LogManager.getLogger(MultiCriteriaSelector.class);

    static final List<MetricName> ASTROMETRIC_METRICS = List.of(
            MetricName.SEEING, MetricName.ROUNDNESS, MetricName.BACKGROUND, MetricName.GOOD_DETECTIONS
    );
    static final List<MetricName> PHOTOMETRIC_METRICS = List.of(
            MetricName.GOOD_DETECTIONS, MetricName.MEDIAN_MAG_ERROR, MetricName.MAG_ERROR_MAD, MetricName.BACKGROUND
    );

    private final Config config;

/**
 * 方法说明：MultiCriteriaSelector，负责初始化对象并装配依赖参数。
 * 处理流程：排名深度、定额与门限在每次选择时从配置读取。
 */
    public MultiCriteriaSelector(Config config) {
        this.config = config;
    }

/**
 * 方法说明：selectAstrometricReference，挑选单个天体测量参考帧。
 * 处理流程：S 降序、|D| 升序、B 升序、N 降序四个排名各截断到 rank_depth；依次尝试 S∩D∩B∩N、S∩D∩N、S∩D、S，
 * 返回首个非空交集中 S 排名最靠前的帧。
 * 维护提示：池为空时抛出 SelectionQuorumException，不返回占位帧。
 */
    public SelectionResult selectAstrometricReference(List<FrameRecord> candidates) throws SelectionQuorumException {
        List<FrameRecord> pool = withMetrics(candidates, ASTROMETRIC_METRICS);
        int excluded = candidates.size() - pool.size();
        if (pool.isEmpty()) {
            throw new SelectionQuorumException(
                    "no astrometric reference candidate among " + candidates.size() + " frames", List.of());
        }
        int depth = Math.max(1, config.getInt("astromref.rank_depth", 200));
        SelectionCascade cascade = new SelectionCascade(
                List.of(
                        SelectionCriterion.largerIsBetter("S", MetricName.SEEING),
                        SelectionCriterion.smallestMagnitude("D", MetricName.ROUNDNESS),
                        SelectionCriterion.smallerIsBetter("B", MetricName.BACKGROUND),
                        SelectionCriterion.largerIsBetter("N", MetricName.GOOD_DETECTIONS)
                ),
                List.of(
                        CascadeLevel.of("S&D&B&N", 1, false, "S", "D", "B", "N"),
                        CascadeLevel.of("S&D&N", 1, true, "S", "D", "N"),
                        CascadeLevel.of("S&D", 1, true, "S", "D"),
                        CascadeLevel.of("S", 1, true, "S")
                )
        );
        SelectionResult result = cascade.select(pool, depth, 1).withPoolCounts(excluded, 0);
        report("astrometric reference", result, pool.size());
        return result;
    }

/**
 * 方法说明：selectPhotometricReferences，挑选恰好 minframes 个测光参考帧。
 * 处理流程：先按时角、天顶距、月相/月高做硬门限；门限后池不足 2×minframes 时直接按背景取前 minframes；
 * 否则依次尝试 N∩B∩E∩M、N∩B、E∩M、B；前三级交集按候选池原始顺序取前 minframes 个，B 级按背景排名取。
 * 维护提示：不返回部分数量，所有层级失败时抛出 SelectionQuorumException。
 */
    public SelectionResult selectPhotometricReferences(List<FrameRecord> candidates) throws SelectionQuorumException {
        List<FrameRecord> pool = withMetrics(candidates, PHOTOMETRIC_METRICS);
        int excluded = candidates.size() - pool.size();
        int minFrames = Math.max(1, config.getInt("photref.minframes", 80));

        List<SelectionCriterion> gates = observingGates();
        List<FrameRecord> gated = new ArrayList<>();
        for (FrameRecord record : pool) {
            if (passesAll(gates, record)) {
                gated.add(record);
            }
        }
        int rejected = pool.size() - gated.size();
        LOG.info("photometric reference pool: {} candidates, {} without metrics, {} rejected by observing conditions",
                candidates.size(), excluded, rejected);

        List<SelectionCriterion> rankings = List.of(
                SelectionCriterion.largerIsBetter("N", MetricName.GOOD_DETECTIONS),
                SelectionCriterion.smallerIsBetter("B", MetricName.BACKGROUND),
                SelectionCriterion.smallerIsBetter("E", MetricName.MEDIAN_MAG_ERROR),
                SelectionCriterion.smallerIsBetter("M", MetricName.MAG_ERROR_MAD)
        );

        SelectionResult result;
        if (gated.size() < 2 * minFrames) {
            LOG.warn("only {} frames pass the observing-condition gates (< 2 x {}), ranking on background alone",
                    gated.size(), minFrames);
            SelectionCascade backgroundOnly = new SelectionCascade(
                    rankings,
                    List.of(CascadeLevel.of("B", minFrames, true, "B"))
            );
            result = backgroundOnly.select(gated, gated.size(), minFrames);
        } else {
            SelectionCascade cascade = new SelectionCascade(
                    rankings,
                    List.of(
                            CascadeLevel.inPoolOrder("N&B&E&M", minFrames, false, "N", "B", "E", "M"),
                            CascadeLevel.inPoolOrder("N&B", minFrames, true, "N", "B"),
                            CascadeLevel.inPoolOrder("E&M", minFrames, true, "E", "M"),
                            CascadeLevel.of("B", minFrames, true, "B")
                    )
            );
            result = cascade.select(gated, 2 * minFrames, minFrames);
        }
        result = result.withPoolCounts(excluded, rejected);
        report("photometric references", result, gated.size());
        return result;
    }

    /**
     * Hard gates on observing conditions. A NaN metric fails every comparison and therefore the gate.
     */
    List<SelectionCriterion> observingGates() {
        double maxHourAngle = config.getDouble("photref.max_hour_angle", 3.0);
        double maxZenith = config.getDouble("photref.max_zenith_dist", 30.0);
        double maxMoonPhase = config.getDouble("photref.max_moon_phase", 25.0);
        double maxMoonElev = config.getDouble("photref.max_moon_elev", -10.0);
        return List.of(
                SelectionCriterion.gate("hour_angle",
                        r -> Math.abs(r.value(MetricName.HOUR_ANGLE)) < maxHourAngle),
                SelectionCriterion.gate("zenith_distance",
                        r -> r.value(MetricName.ZENITH_DISTANCE) < maxZenith),
                SelectionCriterion.gate("moon",
                        r -> Math.abs(r.value(MetricName.MOON_PHASE)) < maxMoonPhase
                                || r.value(MetricName.MOON_ELEVATION) < maxMoonElev)
        );
    }

    private static boolean passesAll(List<SelectionCriterion> gates, FrameRecord record) {
        for (SelectionCriterion gate : gates) {
            if (!gate.admits(record)) {
                return false;
            }
        }
        return true;
    }

    private static List<FrameRecord> withMetrics(List<FrameRecord> candidates, List<MetricName> required) {
        List<FrameRecord> pool = new ArrayList<>(candidates.size());
        for (FrameRecord record : candidates) {
            if (record.hasAll(required)) {
                pool.add(record);
            } else {
                LOG.debug("{} lacks one of {}, left out of the pool", record.frame, required);
            }
        }
        return pool;
    }

    private static void report(String what, SelectionResult result, int poolSize) {
        if (result.degraded) {
            LOG.warn("{}: degraded to level {} over {} frames, picked {} (levels tried: {})",
                    what, result.level, poolSize, result.frames.size(), result.trace);
        } else {
            LOG.info("{}: level {} over {} frames, picked {}", what, result.level, poolSize, result.frames.size());
        }
    }
}
