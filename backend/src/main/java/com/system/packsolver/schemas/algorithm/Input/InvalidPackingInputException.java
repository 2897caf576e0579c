package com.system.packsolver.schemas.algorithm.Input;

/**
 * An item, capacity or synergy rule violates the model constraints
 * (non-positive weight, value or capacity, duplicate id or name, malformed rule).
 */
public class InvalidPackingInputException extends PackingInputException {

    public InvalidPackingInputException(String message) {
        super(message);
    }
}
