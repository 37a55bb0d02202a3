package com.wheelskills.progress;

import com.wheelskills.progress.analytics.AnalyticsModels.Comparison;
import com.wheelskills.progress.analytics.ComparisonEngine;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.tracking.AttemptTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ComparisonEngineTest {
    @Autowired
    private ComparisonEngine comparisonEngine;
    @Autowired
    private AttemptTracker tracker;
    @Autowired
    private UserService userService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clear(jdbcTemplate);
    }

    @Test
    void marginBoundaryResolvesToAverage() {
        assertEquals(Comparison.AVERAGE, ComparisonEngine.classify(0.55, 0.5));
        assertEquals(Comparison.AVERAGE, ComparisonEngine.classify(0.45, 0.5));
        assertEquals(Comparison.AVERAGE, ComparisonEngine.classify(0.5, 0.5));
        assertEquals(Comparison.ABOVE_AVERAGE, ComparisonEngine.classify(0.5500001, 0.5));
        assertEquals(Comparison.BELOW_AVERAGE, ComparisonEngine.classify(0.4499999, 0.5));
        assertEquals(Comparison.ABOVE_AVERAGE, ComparisonEngine.classify(1.0, 0.0));
    }

    @Test
    void comparesOnlySkillsWithCompletedAttempts() {
        userService.createUser("u-1");
        userService.createUser("u-2");
        // u-2 drags the global success rate of a01 down to 1/3
        tracker.complete(tracker.startAttempt("u-2", "a01_10m_forward", null).attemptId(), false);
        tracker.complete(tracker.startAttempt("u-2", "a01_10m_forward", null).attemptId(), false);
        tracker.complete(tracker.startAttempt("u-1", "a01_10m_forward", null).attemptId(), true);
        tracker.complete(tracker.startAttempt("u-1", "a02_2m_backward", null).attemptId(), false);
        tracker.startAttempt("u-1", "a03_5m_backward", null);

        var comparisons = comparisonEngine.compare("u-1");
        assertEquals(2, comparisons.size());

        var a01 = comparisons.get(0);
        assertEquals("a01_10m_forward", a01.skillId());
        assertEquals(1.0, a01.yourSuccessRate());
        assertEquals(1.0 / 3, a01.globalSuccessRate(), 1e-9);
        assertEquals(Comparison.ABOVE_AVERAGE, a01.comparison());

        var a02 = comparisons.get(1);
        assertEquals("a02_2m_backward", a02.skillId());
        assertEquals(0.0, a02.yourSuccessRate());
        assertEquals(0.0, a02.globalSuccessRate(), 1e-9);
        assertEquals(Comparison.AVERAGE, a02.comparison());

        assertTrue(comparisonEngine.compare("u-2").stream()
                .allMatch(c -> c.comparison() == Comparison.BELOW_AVERAGE));
    }
}
