package com.notice.evaluation.exception;

import java.nio.file.Path;

/**
 * The evaluation workbook exists but could not be read or written
 * (locked, corrupt, not an .xlsx, disk full).
 */
public class WorkbookAccessException extends RuntimeException {

    private final Path path;

    public WorkbookAccessException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
