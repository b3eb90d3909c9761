package com.flow.mapper.service.engine;

/**
 * Exception thrown when a flow operation cannot be served.
 */
public class FlowServiceException extends RuntimeException {

    private final String flowId;
    private final String errorCode;

    public FlowServiceException(String message, String flowId, String errorCode) {
        super(message);
        this.flowId = flowId;
        this.errorCode = errorCode;
    }

    public String getFlowId() {
        return flowId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
