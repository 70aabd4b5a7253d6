package com.purchasingpower.issueflow.repository;

import com.purchasingpower.issueflow.workflow.state.WorkflowState;

import java.util.Optional;

/**
 * Durable record of workflow progress keyed by (repository, issue).
 */
public interface WorkflowStateStore {

    /**
     * @throws com.purchasingpower.issueflow.exception.StateStoreException when a record exists but cannot be read
     */
    Optional<WorkflowState> load(String repo, int issueNumber);

    /**
     * Replaces the whole record. Readers see either the previous record or the new one.
     */
    void save(String repo, int issueNumber, WorkflowState state);

    void clear(String repo, int issueNumber);
}
