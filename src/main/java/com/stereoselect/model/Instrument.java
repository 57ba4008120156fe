package com.stereoselect.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known sensor codes and their platform names
 */
public enum Instrument {
    DOVE("PS2", "Dove"),
    DOVE_R("PS2.SD", "Dove-R"),
    SUPER_DOVE("PSB.SD", "SuperDove");

    private final String code;
    private final String displayName;

    Instrument(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<Instrument> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(instrument -> instrument.code.equals(code))
                .findFirst();
    }

    /**
     * Platform name for a sensor code, empty for unknown codes
     */
    public static Optional<String> nameOf(String code) {
        return fromCode(code).map(Instrument::getDisplayName);
    }
}
