package com.herzen.lms.upload;

import org.springframework.web.multipart.MultipartFile;

public interface FileStorage {
    /**
     * Stores the file under the given relative directory with the given name and returns the relative path.
     */
    String store(MultipartFile file, String directory, String fileName);

    /**
     * Removes the file at the relative path; returns false when nothing was there.
     */
    boolean delete(String relativePath);
}
