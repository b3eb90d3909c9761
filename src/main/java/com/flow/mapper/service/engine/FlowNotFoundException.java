package com.flow.mapper.service.engine;

public class FlowNotFoundException extends FlowServiceException {

    public FlowNotFoundException(String flowId) {
        super("Flow not found: " + flowId, flowId, "FLOW_NOT_FOUND");
    }
}
