package com.herzen.lms.api;

import com.herzen.lms.common.Ids;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.CourseTrack;
import com.herzen.lms.domain.DomainModels.LessonTrack;
import com.herzen.lms.tracking.TrackingModels.*;
import com.herzen.lms.tracking.TrackingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/tracking")
public class TrackingController {
    private final TrackingService trackingService;

    public TrackingController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @GetMapping("/course/{courseId}/{userId}")
    public ResponseEntity<CourseTrack> courseTracking(@PathVariable UUID courseId, @PathVariable UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.getCourseTracking(courseId.toString(), userId.toString(), tenant));
    }

    @PatchMapping("/course/{courseId}/{userId}")
    public ResponseEntity<CourseTrack> updateCourseTracking(@PathVariable UUID courseId,
                                                            @PathVariable UUID userId,
                                                            @Valid @RequestBody UpdateCourseTrackingRequest request,
                                                            TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.updateCourseTracking(courseId.toString(), userId.toString(), request, tenant));
    }

    @PostMapping("/lesson/attempt/{lessonId}")
    public ResponseEntity<LessonTrack> startAttempt(@PathVariable UUID lessonId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.startLessonAttempt(lessonId.toString(), userId.toString(), tenant));
    }

    @PatchMapping("/lesson/attempt/{lessonId}/{userId}")
    public ResponseEntity<LessonTrack> manageAttempt(@PathVariable UUID lessonId,
                                                     @PathVariable UUID userId,
                                                     @RequestParam AttemptAction action,
                                                     TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.manageLessonAttempt(lessonId.toString(), action, userId.toString(), tenant));
    }

    @GetMapping("/{lessonId}/users/{userId}/status")
    public ResponseEntity<LessonStatus> lessonStatus(@PathVariable UUID lessonId, @PathVariable UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.getLessonStatus(lessonId.toString(), userId.toString(), tenant));
    }

    @GetMapping("/attempts/{attemptId}/{userId}")
    public ResponseEntity<LessonTrack> attempt(@PathVariable UUID attemptId, @PathVariable UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.getAttempt(attemptId.toString(), userId.toString(), tenant));
    }

    @PatchMapping("/attempts/progress/{attemptId}")
    public ResponseEntity<LessonTrack> updateProgress(@PathVariable UUID attemptId,
                                                      @RequestParam UUID userId,
                                                      @Valid @RequestBody UpdateProgressRequest request,
                                                      TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.updateProgress(attemptId.toString(), request, userId.toString(), tenant));
    }

    @PatchMapping("/event/{eventId}")
    public ResponseEntity<LessonTrack> updateEventProgress(@PathVariable String eventId,
                                                           @Valid @RequestBody EventProgressRequest request,
                                                           TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.updateEventProgress(eventId, request, tenant));
    }

    @PostMapping("/recalculate-progress")
    public ResponseEntity<RecalculationResult> recalculate(@Valid @RequestBody RecalculateRequest request, TenantOrg tenant) {
        return ResponseEntity.ok(trackingService.recalculateProgress(request.courseId(), tenant));
    }

    public record RecalculateRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String courseId) {}
}
