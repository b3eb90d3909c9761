package com.flow.mapper.service.engine;

import com.flow.mapper.service.model.ProcessFlow;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Interface for the in-memory flow store.
 *
 * Primary source of truth for the current snapshot of every flow. Snapshots
 * are immutable; an update replaces the stored snapshot as a whole.
 */
public interface FlowStore {

    /**
     * Stores a new flow.
     *
     * @param name optional display name
     * @param flow the initial snapshot
     * @return the stored entry with its generated id
     */
    FlowEntry create(String name, ProcessFlow flow);

    /**
     * Retrieves a flow by ID.
     *
     * @param flowId the flow identifier
     * @return the entry if found
     */
    Optional<FlowEntry> findById(String flowId);

    /**
     * Retrieves all flows.
     *
     * @return collection of all entries
     */
    Collection<FlowEntry> findAll();

    boolean exists(String flowId);

    /**
     * Deletes a flow by ID.
     *
     * @param flowId the flow identifier
     * @return true if deleted, false if not found
     */
    boolean delete(String flowId);

    int count();

    /**
     * Replaces the snapshot of an existing flow and bumps its revision.
     *
     * @param flowId the flow identifier
     * @param flow the new snapshot
     * @return the updated entry
     * @throws FlowNotFoundException when the flow does not exist
     */
    FlowEntry update(String flowId, ProcessFlow flow);

    /**
     * Stored state of one flow.
     */
    record FlowEntry(
            String flowId,
            String name,
            ProcessFlow flow,
            long revision,
            Instant createdAt,
            Instant updatedAt
    ) {}
}
