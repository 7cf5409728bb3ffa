package com.sdlcimport.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats and parses the sequential identifiers used in generated artifacts.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * IdFormatter.format(IdFormatter.DECISION_PREFIX, 7);      // "ADR-IMPORT-007"
 * IdFormatter.sequenceOf("ADR-IMPORT-042");                 // 42
 * }</pre>
 */
public final class IdFormatter {

    /** Prefix of decision record ids. */
    public static final String DECISION_PREFIX = "ADR-IMPORT-";

    /** Prefix of threat finding ids. */
    public static final String THREAT_PREFIX = "TM-";

    /** Prefix of debt item ids. */
    public static final String DEBT_PREFIX = "TD-";

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    private IdFormatter() {
        // Utility class
    }

    /**
     * Formats a prefixed id with a sequence padded to three digits.
     *
     * @param prefix id prefix
     * @param sequence sequence number, at least 1
     * @return formatted id
     */
    public static String format(String prefix, int sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1: " + sequence);
        }
        return prefix + String.format("%03d", sequence);
    }

    /**
     * Extracts the trailing sequence number of an id.
     *
     * @param id formatted id
     * @return sequence number, or 0 when the id carries none
     */
    public static int sequenceOf(String id) {
        if (id == null) {
            return 0;
        }
        Matcher matcher = TRAILING_NUMBER.matcher(id);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
