package com.herzen.lms.api;

import com.herzen.lms.common.OperationResult;
import com.herzen.lms.common.PageResult;
import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.*;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Course;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private final CourseService courseService;

    public CourseController(CourseService courseService) {
        this.courseService = courseService;
    }

    @PostMapping
    public ResponseEntity<Course> create(@Valid @RequestBody CreateCourseRequest request,
                                         @RequestParam UUID userId,
                                         TenantOrg tenant) {
        return ResponseEntity.status(HttpStatus.CREATED).body(courseService.create(request, userId.toString(), tenant));
    }

    @GetMapping("/search")
    public ResponseEntity<PageResult<Course>> search(@Valid Pagination pagination,
                                                     @RequestParam(required = false) String query,
                                                     @RequestParam(required = false) ContentStatus status,
                                                     @RequestParam(required = false) String cohortId,
                                                     @RequestParam(required = false) Boolean featured,
                                                     @RequestParam(required = false) Boolean free,
                                                     @RequestParam(required = false) String createdBy,
                                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDateFrom,
                                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDateTo,
                                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDateFrom,
                                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDateTo,
                                                     TenantOrg tenant) {
        CourseSearch search = new CourseSearch(query, status, cohortId, featured, free, createdBy,
                startDateFrom, startDateTo, endDateFrom, endDateTo);
        return ResponseEntity.ok(courseService.search(search, pagination, tenant));
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<Course> findOne(@PathVariable UUID courseId, TenantOrg tenant) {
        return ResponseEntity.ok(courseService.findOne(courseId.toString(), tenant));
    }

    @GetMapping("/{courseId}/hierarchy")
    public ResponseEntity<CourseHierarchy> hierarchy(@PathVariable UUID courseId, TenantOrg tenant) {
        return ResponseEntity.ok(courseService.hierarchy(courseId.toString(), tenant));
    }

    @GetMapping("/{courseId}/hierarchy/tracking/{userId}")
    public ResponseEntity<CourseHierarchyWithTracking> hierarchyWithTracking(@PathVariable UUID courseId,
                                                                             @PathVariable UUID userId,
                                                                             TenantOrg tenant) {
        return ResponseEntity.ok(courseService.hierarchyWithTracking(courseId.toString(), userId.toString(), tenant));
    }

    @PatchMapping("/{courseId}")
    public ResponseEntity<Course> update(@PathVariable UUID courseId,
                                         @Valid @RequestBody UpdateCourseRequest request,
                                         @RequestParam UUID userId,
                                         TenantOrg tenant) {
        return ResponseEntity.ok(courseService.update(courseId.toString(), request, userId.toString(), tenant));
    }

    @DeleteMapping("/{courseId}")
    public ResponseEntity<OperationResult> remove(@PathVariable UUID courseId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(courseService.remove(courseId.toString(), userId.toString(), tenant));
    }
}
