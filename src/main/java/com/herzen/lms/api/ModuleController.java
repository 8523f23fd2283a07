package com.herzen.lms.api;

import com.herzen.lms.common.OperationResult;
import com.herzen.lms.common.PageResult;
import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.CreateModuleRequest;
import com.herzen.lms.content.ContentModels.ModuleSearch;
import com.herzen.lms.content.ContentModels.ModuleWithLessonCount;
import com.herzen.lms.content.ContentModels.UpdateModuleRequest;
import com.herzen.lms.content.ModuleService;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Module;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/modules")
public class ModuleController {
    private final ModuleService moduleService;

    public ModuleController(ModuleService moduleService) {
        this.moduleService = moduleService;
    }

    @PostMapping
    public ResponseEntity<Module> create(@Valid @RequestBody CreateModuleRequest request,
                                         @RequestParam UUID userId,
                                         TenantOrg tenant) {
        return ResponseEntity.status(HttpStatus.CREATED).body(moduleService.create(request, userId.toString(), tenant));
    }

    @GetMapping("/search")
    public ResponseEntity<PageResult<ModuleWithLessonCount>> search(@Valid Pagination pagination,
                                                                    @RequestParam(required = false) String query,
                                                                    @RequestParam(required = false) UUID courseId,
                                                                    @RequestParam(required = false) UUID parentId,
                                                                    @RequestParam(required = false) ContentStatus status,
                                                                    @RequestParam(required = false) String sortBy,
                                                                    @RequestParam(required = false) String orderBy,
                                                                    TenantOrg tenant) {
        ModuleSearch search = new ModuleSearch(query, courseId == null ? null : courseId.toString(),
                parentId == null ? null : parentId.toString(), status, sortBy, orderBy);
        return ResponseEntity.ok(moduleService.search(search, pagination, tenant));
    }

    @GetMapping("/{moduleId}")
    public ResponseEntity<Module> findOne(@PathVariable UUID moduleId, TenantOrg tenant) {
        return ResponseEntity.ok(moduleService.findOne(moduleId.toString(), tenant));
    }

    @PatchMapping("/{moduleId}")
    public ResponseEntity<Module> update(@PathVariable UUID moduleId,
                                         @Valid @RequestBody UpdateModuleRequest request,
                                         @RequestParam UUID userId,
                                         TenantOrg tenant) {
        return ResponseEntity.ok(moduleService.update(moduleId.toString(), request, userId.toString(), tenant));
    }

    @DeleteMapping("/{moduleId}")
    public ResponseEntity<OperationResult> remove(@PathVariable UUID moduleId, @RequestParam UUID userId, TenantOrg tenant) {
        return ResponseEntity.ok(moduleService.remove(moduleId.toString(), userId.toString(), tenant));
    }
}
