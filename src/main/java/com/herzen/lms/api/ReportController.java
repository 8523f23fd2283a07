package com.herzen.lms.api;

import com.herzen.lms.common.PageResult;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.report.ReportModels.*;
import com.herzen.lms.report.ReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/course")
public class ReportController {
    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/report")
    public ResponseEntity<PageResult<? extends ReportRow>> report(@Valid CourseReportRequest request,
                                                                  @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                                  TenantOrg tenant) {
        return ResponseEntity.ok(reportService.courseReport(request, tenant, authorization));
    }

    @PostMapping("/lesson-completion-status")
    public ResponseEntity<LessonCompletionResponse> lessonCompletionStatus(@Valid @RequestBody LessonCompletionRequest request,
                                                                           TenantOrg tenant) {
        return ResponseEntity.ok(reportService.lessonCompletionStatus(request, tenant));
    }

    @PatchMapping("/tracking/update_test_progress")
    public ResponseEntity<TestProgressResponse> updateTestProgress(@Valid @RequestBody TestProgressRequest request,
                                                                   TenantOrg tenant) {
        return ResponseEntity.ok(reportService.updateTestProgress(request, tenant));
    }
}
