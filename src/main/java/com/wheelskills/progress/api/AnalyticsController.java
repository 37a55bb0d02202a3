package com.wheelskills.progress.api;

import com.wheelskills.progress.analytics.AnalyticsModels.GlobalErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.StepErrorRate;
import com.wheelskills.progress.analytics.GlobalAnalyticsEngine;
import com.wheelskills.progress.analytics.SkillStatsAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final GlobalAnalyticsEngine globalEngine;
    private final SkillStatsAggregator aggregator;

    public AnalyticsController(GlobalAnalyticsEngine globalEngine, SkillStatsAggregator aggregator) {
        this.globalEngine = globalEngine;
        this.aggregator = aggregator;
    }

    @GetMapping("/global-errors")
    public ResponseEntity<GlobalErrorStats> globalErrors() {
        return ResponseEntity.ok(globalEngine.computeGlobal());
    }

    @GetMapping("/skills/{skillId}/errors")
    public ResponseEntity<SkillErrorStats> skillErrors(@PathVariable String skillId) {
        return ResponseEntity.ok(aggregator.compute(skillId));
    }

    @GetMapping("/skills/{skillId}/steps/{stepNumber}/errors")
    public ResponseEntity<StepErrorRate> stepErrors(@PathVariable String skillId, @PathVariable int stepNumber) {
        return ResponseEntity.ok(aggregator.computeStep(skillId, stepNumber));
    }
}
