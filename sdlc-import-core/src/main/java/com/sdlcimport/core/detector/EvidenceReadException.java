package com.sdlcimport.core.detector;

import java.io.IOException;

/**
 * Thrown when a single inventory file cannot be read for evidence.
 *
 * <p>Always recovered: the file is logged, counted and skipped.
 */
public class EvidenceReadException extends IOException {

    private final String filePath;

    public EvidenceReadException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    /**
     * Returns the relative path of the unreadable file.
     *
     * @return relative path
     */
    public String getFilePath() {
        return filePath;
    }
}
