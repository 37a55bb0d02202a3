package com.wheelskills.progress.api;

import com.wheelskills.progress.plan.PlanGenerator;
import com.wheelskills.progress.plan.PlanModels.TrainingPlan;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users/{userId}/plan")
public class TrainingPlanController {
    private final PlanGenerator planGenerator;

    public TrainingPlanController(PlanGenerator planGenerator) {
        this.planGenerator = planGenerator;
    }

    @PostMapping
    public ResponseEntity<TrainingPlan> generate(@PathVariable String userId) {
        return ResponseEntity.ok(planGenerator.generatePlan(userId));
    }
}
