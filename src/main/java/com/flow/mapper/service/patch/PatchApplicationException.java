package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.OperationType;

/**
 * Thrown when a single operation of a patch is structurally impossible.
 * The whole patch is discarded; nothing is half-applied.
 */
public class PatchApplicationException extends RuntimeException {

    private final int operationIndex;
    private final OperationType operationType;
    private final String errorCode;

    public PatchApplicationException(String message, int operationIndex, OperationType operationType) {
        super(String.format("Operation #%d (%s) failed: %s", operationIndex, operationType.wireName(), message));
        this.operationIndex = operationIndex;
        this.operationType = operationType;
        this.errorCode = "PATCH_REJECTED";
    }

    public int getOperationIndex() {
        return operationIndex;
    }

    public OperationType getOperationType() {
        return operationType;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
