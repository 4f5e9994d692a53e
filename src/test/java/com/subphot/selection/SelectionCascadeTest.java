package com.subphot.selection;

import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SelectionCascadeTest {

    private static final List<SelectionCriterion> CRITERIA = List.of(
            SelectionCriterion.largerIsBetter("S", MetricName.SEEING),
            SelectionCriterion.smallestMagnitude("D", MetricName.ROUNDNESS),
            SelectionCriterion.smallerIsBetter("B", MetricName.BACKGROUND),
            SelectionCriterion.largerIsBetter("N", MetricName.GOOD_DETECTIONS)
    );

    @Test
    void rank_shouldOrderByAbsoluteValueAndKeepPoolOrderOnTies() {
        List<FrameRecord> pool = TestFrames.astrometric(
                new double[]{1, 1, 1, 1},
                new double[]{-0.3, 0.1, -0.1, 0.2},
                new double[]{0, 0, 0, 0},
                new double[]{0, 0, 0, 0}
        );

        List<FrameRecord> ranked = CRITERIA.get(1).rank(pool, 10);

        assertEquals(List.of(1, 2, 3, 0), TestFrames.indices(ranked));
    }

    @Test
    void rank_shouldTruncateToDepth() {
        List<FrameRecord> pool = TestFrames.astrometric(
                new double[]{1, 4, 3, 2},
                new double[]{0, 0, 0, 0},
                new double[]{0, 0, 0, 0},
                new double[]{0, 0, 0, 0}
        );

        assertEquals(List.of(1, 2), TestFrames.indices(CRITERIA.get(0).rank(pool, 2)));
    }

    @Test
    void select_shouldStopAtFirstLevelMeetingQuota() throws Exception {
        List<FrameRecord> pool = TestFrames.astrometric(
                new double[]{4, 3, 2, 1},
                new double[]{0, 0, 0, 0},
                new double[]{4, 3, 2, 1},
                new double[]{0, 0, 0, 0}
        );
        SelectionCascade cascade = new SelectionCascade(CRITERIA, List.of(
                CascadeLevel.of("S&B", 2, false, "S", "B"),
                CascadeLevel.of("S", 2, true, "S"),
                CascadeLevel.of("B", 2, true, "B")
        ));

        SelectionResult result = cascade.select(pool, 2, 2);

        assertEquals("S", result.level);
        assertEquals(List.of(0, 1), TestFrames.indices(result.frames));
        assertEquals(List.of("S&B=0", "S=2"), result.trace);
    }

    @Test
    void select_shouldOrderPoolOrderLevelsByPoolPosition() throws Exception {
        List<FrameRecord> pool = TestFrames.astrometric(
                new double[]{1, 2, 3, 4},
                new double[]{0, 0, 0, 0},
                new double[]{4, 3, 2, 1},
                new double[]{0, 0, 0, 0}
        );
        SelectionCascade ranked = new SelectionCascade(CRITERIA, List.of(CascadeLevel.of("S&B", 1, false, "S", "B")));
        SelectionCascade pooled = new SelectionCascade(CRITERIA, List.of(CascadeLevel.inPoolOrder("S&B", 1, false, "S", "B")));

        assertEquals(List.of(3, 2, 1), TestFrames.indices(ranked.select(pool, 3, 3).frames));
        assertEquals(List.of(1, 2, 3), TestFrames.indices(pooled.select(pool, 3, 3).frames));
    }

    @Test
    void constructor_shouldRejectLevelNamingUnknownCriterion() {
        assertThrows(IllegalArgumentException.class, () -> new SelectionCascade(CRITERIA, List.of(
                CascadeLevel.of("X", 1, false, "X")
        )));
    }
}
