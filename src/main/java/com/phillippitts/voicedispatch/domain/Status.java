package com.phillippitts.voicedispatch.domain;

/**
 * Lifecycle status of a pluggable component.
 *
 * <p>Transitions are driven by the component itself:
 * <pre>
 * INITIALIZING → IDLE ⇄ ACTIVE ⇄ WORKING
 * </pre>
 * Once a component has been stopped it reports no further transitions.
 */
public enum Status {
    INITIALIZING("<INITIALISING>"),
    IDLE("<IDLE>"),
    ACTIVE("<ACTIVE>"),
    WORKING("<WORKING>");

    private final String label;

    Status(String label) {
        this.label = label;
    }

    /** Display label used in logs. */
    public String label() {
        return label;
    }

    /** @return true for any status other than {@link #IDLE} */
    public boolean isBusy() {
        return this != IDLE;
    }
}
