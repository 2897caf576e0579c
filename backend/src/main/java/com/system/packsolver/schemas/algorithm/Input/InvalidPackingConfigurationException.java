package com.system.packsolver.schemas.algorithm.Input;

/**
 * The container set cannot be searched at all (no containers supplied).
 */
public class InvalidPackingConfigurationException extends PackingInputException {

    public InvalidPackingConfigurationException(String message) {
        super(message);
    }
}
