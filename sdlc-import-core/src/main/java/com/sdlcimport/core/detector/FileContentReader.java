package com.sdlcimport.core.detector;

import com.sdlcimport.core.scanner.ScannedFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Bounded UTF-8 reader for inventory files.
 *
 * <p>Reads at most {@code maxBytes} bytes. Content containing a NUL byte in its first
 * kilobytes is treated as binary and returned as empty text.
 */
public class FileContentReader {

    private static final int BINARY_SNIFF_BYTES = 8192;

    private final int maxBytes;

    public FileContentReader(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0");
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Reads the (possibly truncated) text content of a file.
     *
     * @param file inventory file
     * @return text content, empty for binary content
     * @throws EvidenceReadException if the file cannot be read
     */
    public String read(ScannedFile file) throws EvidenceReadException {
        byte[] bytes;
        try (InputStream in = Files.newInputStream(file.absolutePath())) {
            bytes = in.readNBytes(maxBytes);
        } catch (IOException e) {
            throw new EvidenceReadException(file.relativePath(),
                "Cannot read " + file.relativePath() + ": " + e.getMessage(), e);
        }
        int sniff = Math.min(bytes.length, BINARY_SNIFF_BYTES);
        for (int i = 0; i < sniff; i++) {
            if (bytes[i] == 0) {
                return "";
            }
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Returns the 1-based line number of a character offset.
     *
     * @param content text
     * @param offset character offset
     * @return line number
     */
    public static int lineOf(String content, int offset) {
        int line = 1;
        int end = Math.min(offset, content.length());
        for (int i = 0; i < end; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Returns the per-file byte cap.
     *
     * @return maximum bytes read per file
     */
    public int getMaxBytes() {
        return maxBytes;
    }
}
