package com.herzen.lms.upload;

import com.herzen.lms.common.BadRequestException;
import com.herzen.lms.common.ResponseMessages;
import com.herzen.lms.config.LmsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
@Component
public class LocalFileStorage implements FileStorage {
    private final Path root;

    @Autowired
    public LocalFileStorage(LmsProperties properties) {
        this(Path.of(properties.getUpload().getRootDir()));
    }

    LocalFileStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String store(MultipartFile file, String directory, String fileName) {
        String relative = StringUtils.cleanPath(directory + "/" + fileName);
        Path target = resolve(relative);
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("File store failed: {}", target, e);
            throw new UncheckedIOException(ResponseMessages.FILE_UPLOAD_FAILED, e);
        }
        log.info("File stored at {}", target);
        return relative;
    }

    @Override
    public boolean delete(String relativePath) {
        Path target = resolve(StringUtils.cleanPath(relativePath));
        try {
            boolean deleted = Files.deleteIfExists(target);
            log.info("File delete {} deleted={}", target, deleted);
            return deleted;
        } catch (IOException e) {
            log.error("File delete failed: {}", target, e);
            throw new UncheckedIOException(e);
        }
    }

    private Path resolve(String relative) {
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new BadRequestException(ResponseMessages.INVALID_FILE_PATH);
        }
        return target;
    }
}
