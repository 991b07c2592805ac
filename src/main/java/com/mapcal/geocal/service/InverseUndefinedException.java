package com.mapcal.geocal.service;

/**
 * Thrown when a geographic to render conversion is requested while a fitted scale factor
 * is exactly zero. No inverse exists in that state, so the conversion cannot return a
 * meaningful point.
 *
 * @since 0.1.0
 */
public class InverseUndefinedException extends IllegalStateException {

    private final String axis;

    /**
     * @param axis    the axis whose scale is zero ({@code "x"} or {@code "y"})
     * @param message the detail message
     */
    public InverseUndefinedException(String axis, String message) {
        super(message);
        this.axis = axis;
    }

    public String getAxis() {
        return axis;
    }
}
