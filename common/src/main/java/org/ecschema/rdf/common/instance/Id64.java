package org.ecschema.rdf.common.instance;

import java.util.Locale;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

/**
 * Instance ids: 64 bit integers written as lowercase hexadecimal with a 0x
 * prefix and no leading zeros, e.g. 0x20000000001. Zero is reserved as the
 * invalid id.
 */
public final class Id64 {
    /**
     * The invalid id.
     */
    public static final String INVALID = "0";

    private static final Pattern IS_VALID = Pattern.compile("0x[1-9a-f][0-9a-f]{0,15}");

    /**
     * Is this a well formed, non zero id?
     */
    public static boolean isValid(@Nullable String maybeId) {
        return maybeId != null && IS_VALID.matcher(maybeId).matches();
    }

    /**
     * Format a numeric id, zero formats to {@link #INVALID}.
     */
    public static String fromLong(long id) {
        if (id == 0) {
            return INVALID;
        }
        return "0x" + Long.toHexString(id).toLowerCase(Locale.ROOT);
    }

    private Id64() {
        // Utility class.
    }
}
