package com.herzen.lms.upload;

import com.herzen.lms.domain.DomainModels.UploadEntityType;

public class UploadModels {
    public record UploadResult(String path, UploadEntityType type, String originalName, long size, String mimeType) {}

    public record DeleteResult(boolean deleted, String path) {}
}
