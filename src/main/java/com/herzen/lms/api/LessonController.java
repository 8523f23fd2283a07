package com.herzen.lms.api;

import com.herzen.lms.common.OperationResult;
import com.herzen.lms.common.PageResult;
import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.CreateLessonRequest;
import com.herzen.lms.content.ContentModels.LessonDetails;
import com.herzen.lms.content.ContentModels.LessonSearch;
import com.herzen.lms.content.ContentModels.UpdateLessonRequest;
import com.herzen.lms.content.LessonService;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Lesson;
import com.herzen.lms.domain.DomainModels.LessonFormat;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/lessons")
public class LessonController {
    private final LessonService lessonService;

    public LessonController(LessonService lessonService) {
        this.lessonService = lessonService;
    }

    @PostMapping
    public ResponseEntity<LessonDetails> create(@Valid @RequestBody CreateLessonRequest request,
                                                @RequestParam UUID userId,
                                                TenantOrg tenant) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lessonService.create(request, userId.toString(), tenant));
    }

    @GetMapping("/search")
    public ResponseEntity<PageResult<Lesson>> search(@Valid Pagination pagination,
                                                     @RequestParam(required = false) String query,
                                                     @RequestParam(required = false) ContentStatus status,
                                                     @RequestParam(required = false) LessonFormat format,
                                                     @RequestParam(required = false) UUID courseId,
                                                     @RequestParam(required = false) UUID moduleId,
                                                     TenantOrg tenant) {
        LessonSearch search = new LessonSearch(query, status, format,
                courseId == null ? null : courseId.toString(), moduleId == null ? null : moduleId.toString());
        return ResponseEntity.ok(lessonService.search(search, pagination, tenant));
    }

    @GetMapping("/{lessonId}")
    public ResponseEntity<LessonDetails> findOne(@PathVariable UUID lessonId, TenantOrg tenant) {
        return ResponseEntity.ok(lessonService.findOne(lessonId.toString(), tenant));
    }

    @GetMapping("/module/{moduleId}")
    public ResponseEntity<List<Lesson>> findByModule(@PathVariable UUID moduleId, TenantOrg tenant) {
        return ResponseEntity.ok(lessonService.findByModule(moduleId.toString(), tenant));
    }

    @GetMapping("/test/{testId}")
    public ResponseEntity<LessonDetails> findByTestId(@PathVariable String testId, TenantOrg tenant) {
        return ResponseEntity.ok(lessonService.findByTestId(testId, tenant));
    }

    @PatchMapping("/{lessonId}")
    public ResponseEntity<LessonDetails> update(@PathVariable UUID lessonId,
                                                @Valid @RequestBody UpdateLessonRequest request,
                                                @RequestParam UUID userId,
                                                TenantOrg tenant) {
        return ResponseEntity.ok(lessonService.update(lessonId.toString(), request, userId.toString(), tenant));
    }

    @DeleteMapping("/{lessonId}")
    public ResponseEntity<OperationResult> remove(@PathVariable UUID lessonId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(lessonService.remove(lessonId.toString(), userId.toString(), tenant));
    }
}
