package com.wheelskills.progress.api;

import com.wheelskills.progress.api.ApiModels.Ack;
import com.wheelskills.progress.tracking.AttemptTracker;
import com.wheelskills.progress.tracking.TrackingModels.AttemptView;
import com.wheelskills.progress.tracking.TrackingModels.StartedAttempt;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api")
public class AttemptController {
    private final AttemptTracker tracker;

    public AttemptController(AttemptTracker tracker) {
        this.tracker = tracker;
    }

    @PostMapping("/users/{userId}/skills/{skillId}/attempts")
    public ResponseEntity<StartedAttempt> start(@PathVariable String userId,
                                                @PathVariable String skillId,
                                                @RequestBody(required = false) StartRequest request) {
        return ResponseEntity.ok(tracker.startAttempt(userId, skillId, request == null ? null : request.sessionId()));
    }

    @GetMapping("/attempts/{attemptId}")
    public ResponseEntity<AttemptView> attempt(@PathVariable String attemptId) {
        return ResponseEntity.ok(tracker.attempt(attemptId));
    }

    @PostMapping("/attempts/{attemptId}/inputs")
    public ResponseEntity<Ack> recordInput(@PathVariable String attemptId, @RequestBody InputRequest request) {
        tracker.recordInput(attemptId, request.stepNumber(), request.expectedInput(), request.actualInput(), request.timestamp());
        return ResponseEntity.ok(new Ack(true, "Input recorded"));
    }

    @PostMapping("/attempts/{attemptId}/errors")
    public ResponseEntity<Ack> recordError(@PathVariable String attemptId, @RequestBody ErrorRequest request) {
        tracker.recordError(attemptId, request.stepNumber(), request.errorType(), request.expectedAction(), request.actualAction());
        return ResponseEntity.ok(new Ack(true, "Error recorded"));
    }

    @PostMapping("/attempts/{attemptId}/complete")
    public ResponseEntity<Ack> complete(@PathVariable String attemptId, @RequestBody CompleteRequest request) {
        tracker.complete(attemptId, request.success());
        return ResponseEntity.ok(new Ack(true, "Attempt completed"));
    }

    public record StartRequest(String sessionId) {}

    public record InputRequest(Integer stepNumber, String expectedInput, String actualInput, Instant timestamp) {}

    public record ErrorRequest(Integer stepNumber, String errorType, String expectedAction, String actualAction) {}

    public record CompleteRequest(Boolean success) {}
}
