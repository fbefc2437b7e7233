package com.distributedraft.node.statemachine;

import com.distributedraft.common.dto.RaftLogEntry;

/**
 * User-defined state that committed log entries are applied to.
 *
 * The consensus core calls {@link #apply} exactly once per committed index, in index order,
 * while holding the consensus lock. Implementations must not call back into the node.
 */
public interface AppliedStateMachine {

    void apply(RaftLogEntry entry);

    /**
     * Highest index applied so far, 0 before the first entry
     */
    long getLastAppliedIndex();
}
