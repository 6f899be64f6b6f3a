package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The single category every rejected file ends up in.
 * The wire name doubles as the trash sub-folder name.
 */
public enum Disposition {
    DUPLICATE("duplicate"),
    CORRUPTED("corrupted"),
    UNSUPPORTED_FORMAT("unsupported_format"),
    PERMISSION_DENIED("permission_denied"),
    TIMEOUT("timeout"),
    MISSING_TOOL("missing_tool"),
    RAW_SKIPPED("raw_skipped");

    private final String wireName;

    Disposition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Disposition fromWireName(String value) {
        for (Disposition disposition : values()) {
            if (disposition.wireName.equals(value)) {
                return disposition;
            }
        }
        throw new IllegalArgumentException("Unknown disposition: " + value);
    }
}
