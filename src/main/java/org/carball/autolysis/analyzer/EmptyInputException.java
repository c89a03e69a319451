package org.carball.autolysis.analyzer;

/**
 * A table with no columns or no rows was handed to a component that needs data.
 * Callers should treat it as "nothing to profile", not as a failure of the whole run.
 */
public class EmptyInputException extends RuntimeException {

    public EmptyInputException(String message) {
        super(message);
    }
}
