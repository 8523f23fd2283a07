package com.herzen.lms.api;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import com.herzen.lms.upload.FileUploadService;
import com.herzen.lms.upload.UploadModels.DeleteResult;
import com.herzen.lms.upload.UploadModels.UploadResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/files")
public class FileUploadController {
    private final FileUploadService uploadService;

    public FileUploadController(FileUploadService uploadService) {
        this.uploadService = uploadService;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResult> upload(@RequestParam("file") MultipartFile file,
                                               @RequestParam UploadEntityType type,
                                               TenantOrg tenant) {
        return ResponseEntity.status(HttpStatus.CREATED).body(uploadService.uploadFile(file, type, tenant));
    }

    @DeleteMapping
    public ResponseEntity<DeleteResult> delete(@RequestParam String path,
                                               @RequestParam UploadEntityType type,
                                               TenantOrg tenant) {
        return ResponseEntity.ok(uploadService.deleteFile(path, type, tenant));
    }
}
