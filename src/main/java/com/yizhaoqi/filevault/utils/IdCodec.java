package com.yizhaoqi.filevault.utils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts numeric record ids to and from their 24-hex-character external form.
 */
public final class IdCodec {

    public static final int LENGTH = 24;

    private static final Pattern HEX_ID = Pattern.compile("[0-9a-fA-F]{24}");

    // A positive long needs at most 16 hex digits, so the first 8 must be zero.
    private static final String HIGH_ZEROS = "00000000";

    private IdCodec() {
    }

    public static String toHex(long id) {
        return String.format("%024x", id);
    }

    public static String toHex(Long id) {
        return id == null ? null : toHex(id.longValue());
    }

    /**
     * Returns the numeric id for a well-formed external id, or empty for
     * anything that cannot name an existing record.
     */
    public static Optional<Long> parse(String value) {
        if (value == null || !HEX_ID.matcher(value).matches()) {
            return Optional.empty();
        }
        if (!value.startsWith(HIGH_ZEROS)) {
            return Optional.empty();
        }
        long id;
        try {
            id = Long.parseLong(value.substring(HIGH_ZEROS.length()), 16);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return id > 0 ? Optional.of(id) : Optional.empty();
    }
}
