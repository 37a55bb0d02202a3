package com.wheelskills.progress.api;

import com.wheelskills.progress.api.ApiModels.Ack;
import com.wheelskills.progress.domain.DomainModels.TrainingSession;
import com.wheelskills.progress.domain.DomainModels.User;
import com.wheelskills.progress.progress.ProgressModels.CommonError;
import com.wheelskills.progress.progress.ProgressModels.UserProgress;
import com.wheelskills.progress.progress.ProgressModels.UserSkillStats;
import com.wheelskills.progress.progress.ProgressModels.WeakStep;
import com.wheelskills.progress.progress.UserDataEraser;
import com.wheelskills.progress.progress.UserInsightsService;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.recommendation.RecommendationModels.RecommendedSkill;
import com.wheelskills.progress.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}")
public class UserController {
    private final UserService userService;
    private final UserInsightsService insights;
    private final RecommendationService recommender;
    private final UserDataEraser eraser;

    public UserController(UserService userService,
                          UserInsightsService insights,
                          RecommendationService recommender,
                          UserDataEraser eraser) {
        this.userService = userService;
        this.insights = insights;
        this.recommender = recommender;
        this.eraser = eraser;
    }

    @PostMapping
    public ResponseEntity<User> create(@PathVariable String userId) {
        return ResponseEntity.ok(userService.createUser(userId));
    }

    @GetMapping("/progress")
    public ResponseEntity<UserProgress> progress(@PathVariable String userId) {
        return ResponseEntity.ok(userService.progress(userId));
    }

    @DeleteMapping("/progress")
    public ResponseEntity<Ack> clearProgress(@PathVariable String userId) {
        eraser.clearProgress(userId);
        return ResponseEntity.ok(new Ack(true, "Progress cleared for user " + userId));
    }

    @PostMapping("/sessions")
    public ResponseEntity<TrainingSession> openSession(@PathVariable String userId) {
        return ResponseEntity.ok(userService.openSession(userId));
    }

    @GetMapping("/skills/{skillId}/stats")
    public ResponseEntity<UserSkillStats> skillStats(@PathVariable String userId, @PathVariable String skillId) {
        return ResponseEntity.ok(insights.skillStats(userId, skillId));
    }

    @GetMapping("/common-errors")
    public ResponseEntity<List<CommonError>> commonErrors(@PathVariable String userId,
                                                          @RequestParam(name = "skill_id", required = false) String skillId) {
        return ResponseEntity.ok(insights.commonErrors(userId, skillId));
    }

    @GetMapping("/weak-steps")
    public ResponseEntity<List<WeakStep>> weakSteps(@PathVariable String userId,
                                                    @RequestParam(name = "skill_id") String skillId) {
        return ResponseEntity.ok(insights.weakSteps(userId, skillId));
    }

    @GetMapping("/recommended-skills")
    public ResponseEntity<List<RecommendedSkill>> recommendedSkills(@PathVariable String userId) {
        return ResponseEntity.ok(recommender.recommendedSkills(userId));
    }
}
