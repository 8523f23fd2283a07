package com.herzen.lms.api;

import com.herzen.lms.common.OperationResult;
import com.herzen.lms.common.PageResult;
import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.Enrollment;
import com.herzen.lms.domain.DomainModels.EnrollmentStatus;
import com.herzen.lms.enrollment.EnrollmentModels.*;
import com.herzen.lms.enrollment.EnrollmentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/enrollments")
public class EnrollmentController {
    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PostMapping
    public ResponseEntity<Enrollment> enroll(@Valid @RequestBody CreateEnrollmentRequest request,
                                             @RequestParam UUID userId,
                                             TenantOrg tenant) {
        return ResponseEntity.status(HttpStatus.CREATED).body(enrollmentService.enroll(request, userId.toString(), tenant));
    }

    @GetMapping
    public ResponseEntity<PageResult<Enrollment>> findAll(@Valid Pagination pagination,
                                                          @RequestParam(required = false) UUID learnerId,
                                                          @RequestParam(required = false) UUID courseId,
                                                          @RequestParam(required = false) EnrollmentStatus status,
                                                          TenantOrg tenant) {
        EnrollmentFilter filter = new EnrollmentFilter(learnerId == null ? null : learnerId.toString(),
                courseId == null ? null : courseId.toString(), status);
        return ResponseEntity.ok(enrollmentService.findAll(filter, pagination, tenant));
    }

    @GetMapping("/courses")
    public ResponseEntity<PageResult<EnrolledCourse>> enrolledCourses(@RequestParam(required = false) UUID userId,
                                                                      @RequestParam(required = false) String cohortId,
                                                                      @RequestParam(required = false) Integer offset,
                                                                      @RequestParam(required = false) Integer limit,
                                                                      TenantOrg tenant) {
        return ResponseEntity.ok(enrollmentService.enrolledCourses(userId == null ? null : userId.toString(),
                cohortId, offset, limit, tenant));
    }

    @GetMapping("/{enrollmentId}")
    public ResponseEntity<Enrollment> findOne(@PathVariable UUID enrollmentId, TenantOrg tenant) {
        return ResponseEntity.ok(enrollmentService.findOne(enrollmentId.toString(), tenant));
    }

    @PutMapping("/{enrollmentId}")
    public ResponseEntity<Enrollment> update(@PathVariable UUID enrollmentId,
                                             @Valid @RequestBody UpdateEnrollmentRequest request,
                                             @RequestParam UUID userId,
                                             TenantOrg tenant) {
        return ResponseEntity.ok(enrollmentService.update(enrollmentId.toString(), request, userId.toString(), tenant));
    }

    @DeleteMapping("/{enrollmentId}")
    public ResponseEntity<OperationResult> cancel(@PathVariable UUID enrollmentId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(enrollmentService.cancel(enrollmentId.toString(), userId.toString(), tenant));
    }

    @DeleteMapping
    public ResponseEntity<OperationResult> hardDelete(@RequestParam UUID courseId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(enrollmentService.hardDelete(courseId.toString(), userId.toString(), tenant));
    }
}
