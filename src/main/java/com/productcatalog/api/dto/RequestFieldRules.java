package com.productcatalog.api.dto;

import java.math.BigDecimal;

/**
 * Patterns and value normalization shared by the request DTOs.
 */
final class RequestFieldRules {

    static final String UUID = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    static final String IMAGE_URL = "^(?i)https?://.+\\.(jpg|jpeg|png|gif|webp)(\\?.*)?$";

    /** Either http(s) or no scheme at all; a missing scheme is reported by {@code @URL}. */
    static final String HTTP_SCHEME_OR_NONE = "^(?:(?i)https?://.*|(?![a-zA-Z][a-zA-Z0-9+.\\-]*://).*)$";

    /** Dotted host name or IPv4 address, port at most 65535. */
    static final String WEBSITE = "^[a-zA-Z][a-zA-Z0-9+.\\-]*://(?:[^\\s/?#@]+@)?"
        + "(?:(?:[a-zA-Z0-9](?:[a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,63}"
        + "|(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d))"
        + "(?::(?:6553[0-5]|655[0-2]\\d|65[0-4]\\d{2}|6[0-4]\\d{3}|[1-5]\\d{4}|[1-9]\\d{0,3}))?"
        + "(?:[/?#]\\S*)?$";

    private RequestFieldRules() {
    }

    /**
     * Website values are compared without surrounding whitespace; blank means "no website".
     */
    static String trimWebsite(String website) {
        return website == null ? null : website.trim();
    }

    /**
     * Drops trailing fractional zeros so that {@code 10.0} counts as a whole number.
     */
    static BigDecimal stripZeros(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
