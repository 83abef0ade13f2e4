package com.instruments.api.exceptions;

/**
 * Thrown when a {@link com.instruments.api.Work} reports against a label whose
 * registry entry has already been released.
 *
 * This is a programming error: the caller released the label while work for
 * it was still in flight.
 */
public class MetricReleasedException extends IllegalStateException {

    private final String label;

    public MetricReleasedException(String label) {
        super("Work metric '" + label + "' has been released");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
