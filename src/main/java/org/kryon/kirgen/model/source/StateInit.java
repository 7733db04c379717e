package org.kryon.kirgen.model.source;

/**
 * Preserved state initializer; KIR writers store it either as
 * {@code {"expression": "..."}} or as the bare expression string.
 */
public class StateInit {
    public String expression;

    public StateInit() {
    }

    public StateInit(String expression) {
        this.expression = expression;
    }
}
