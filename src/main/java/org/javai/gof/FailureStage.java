package org.javai.gof;

/**
 * Where in a demo's lifecycle a failure happened.
 */
public enum FailureStage {
    /**
     * The demo could not be instantiated during catalog discovery.
     * The variant is skipped and a warning is reported; discovery continues.
     */
    CONSTRUCTION,

    /**
     * The demo's action threw while running.
     * The error is shown to the user and the menu continues.
     */
    DEMONSTRATION
}
