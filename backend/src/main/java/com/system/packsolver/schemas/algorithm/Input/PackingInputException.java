package com.system.packsolver.schemas.algorithm.Input;

/**
 * Base type for every problem found in a solve call's input before the search starts.
 */
public class PackingInputException extends IllegalArgumentException {

    public PackingInputException(String message) {
        super(message);
    }
}
