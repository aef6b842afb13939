package com.stdatmosphere.util;

import java.util.List;

/**
 * Thrown when a unit token is not one of the tokens accepted for its dimension.
 * The library never recovers from it internally; it always reaches the caller.
 */
public class InvalidUnitException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String dimension;
    private final String unit;

    public InvalidUnitException(String dimension, String unit, List<String> accepted) {
        super(dimension + " units=" + (unit == null ? "null" : "'" + unit + "'")
                + " is not valid; use " + accepted);
        this.dimension = dimension;
        this.unit = unit;
    }

    /** Dimension the token was given for, e.g. {@code "pressure"}. */
    public String getDimension() { return dimension; }

    /** The rejected token (may be null). */
    public String getUnit() { return unit; }
}
