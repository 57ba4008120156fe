package com.stereoselect.exception;

/**
 * A footprint that cannot act as an anchor, typically because its geometry
 * is missing or empty. Fatal for that anchor only.
 */
public class InvalidFootprintException extends SelectionException {

    private final String footprintId;

    public InvalidFootprintException(String footprintId, String message) {
        super("Invalid footprint " + footprintId + ": " + message);
        this.footprintId = footprintId;
    }

    public String getFootprintId() {
        return footprintId;
    }
}
