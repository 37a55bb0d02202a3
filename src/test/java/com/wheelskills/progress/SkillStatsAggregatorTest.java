package com.wheelskills.progress;

import com.wheelskills.progress.analytics.SkillStatsAggregator;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.tracking.AttemptTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SkillStatsAggregatorTest {
    @Autowired
    private SkillStatsAggregator aggregator;
    @Autowired
    private AttemptTracker tracker;
    @Autowired
    private UserService userService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clear(jdbcTemplate);
        userService.createUser("u-1");
        userService.createUser("u-2");
    }

    @Test
    void failureRateIsFailedOverTotal() {
        for (int i = 0; i < 25; i++) {
            String id = tracker.startAttempt(i % 2 == 0 ? "u-1" : "u-2", "a02_2m_backward", null).attemptId();
            tracker.complete(id, i >= 15);
        }

        var stats = aggregator.compute("a02_2m_backward");
        assertEquals(25, stats.totalAttempts());
        assertEquals(15, stats.failedAttempts());
        assertEquals(0.6, stats.failureRate());
        assertTrue(stats.stepErrorRates().isEmpty());
        assertNull(stats.mostDifficultStep());
        assertNotNull(stats.generatedAt());
    }

    @Test
    void inProgressAttemptsCountButNeverFail() {
        tracker.startAttempt("u-1", "a01_10m_forward", null);
        tracker.complete(tracker.startAttempt("u-1", "a01_10m_forward", null).attemptId(), false);

        var stats = aggregator.compute("a01_10m_forward");
        assertEquals(2, stats.totalAttempts());
        assertEquals(1, stats.failedAttempts());
        assertEquals(0.5, stats.failureRate());
    }

    @Test
    void neverAttemptedSkillIsNotFound() {
        assertThrows(NotFoundException.class, () -> aggregator.compute("a28_wheelie_turn_180"));
        assertThrows(NotFoundException.class, () -> aggregator.computeStep("a28_wheelie_turn_180", 1));
    }

    @Test
    void ranksStepsAndCapsCommonEntries() {
        String a1 = tracker.startAttempt("u-1", "a04_turn_backward_90", null).attemptId();
        String a2 = tracker.startAttempt("u-2", "a04_turn_backward_90", null).attemptId();

        // step 2: four distinct types and actions, one repeated
        tracker.recordError(a1, 2, "wrong_turn_direction", "turn_left", "turn_right");
        tracker.recordError(a2, 2, "wrong_turn_direction", "turn_left", "turn_right");
        tracker.recordError(a1, 2, "timeout", "turn_left", "none");
        tracker.recordError(a2, 2, "collision", "turn_left", "move_forward");
        tracker.recordError(a1, 2, "balance_lost", "turn_left", "brake");
        // steps 1 and 4 tie on one error each
        tracker.recordError(a2, 4, "missing_input", "brake", "none");
        tracker.recordError(a1, 1, "wrong_direction", "move_backward", "move_forward");

        var stats = aggregator.compute("a04_turn_backward_90");
        assertEquals(3, stats.stepErrorRates().size());
        assertEquals(2, stats.stepErrorRates().get(0).stepNumber());
        assertEquals(1, stats.stepErrorRates().get(1).stepNumber());
        assertEquals(4, stats.stepErrorRates().get(2).stepNumber());

        var hardest = stats.mostDifficultStep();
        assertEquals(2, hardest.stepNumber());
        assertEquals(5, hardest.totalErrors());
        assertEquals(2.5, hardest.errorRate());

        assertEquals(3, hardest.commonErrorTypes().size());
        assertEquals("wrong_turn_direction", hardest.commonErrorTypes().get(0).type().code());
        assertEquals(2, hardest.commonErrorTypes().get(0).count());
        assertEquals("balance_lost", hardest.commonErrorTypes().get(1).type().code());
        assertEquals("collision", hardest.commonErrorTypes().get(2).type().code());

        assertEquals(3, hardest.commonWrongActions().size());
        assertEquals("turn_right", hardest.commonWrongActions().get(0).actual());
        assertEquals("brake", hardest.commonWrongActions().get(1).actual());
        assertEquals("move_forward", hardest.commonWrongActions().get(2).actual());

        var step4 = aggregator.computeStep("a04_turn_backward_90", 4);
        assertEquals(1, step4.totalErrors());
        assertEquals(0.5, step4.errorRate());
        assertEquals(0, aggregator.computeStep("a04_turn_backward_90", 3).totalErrors());
    }
}
