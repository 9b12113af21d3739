package com.tsa.exception;

/**
 * Exception thrown when a condition id is already taken within a collection.
 */
public class DuplicateConditionException extends TsaException {

    public DuplicateConditionException(String conditionId) {
        super(ErrorKind.DUPLICATE_CONDITION,
                "Condition identifier \"" + conditionId + "\" is already reserved");
    }
}
