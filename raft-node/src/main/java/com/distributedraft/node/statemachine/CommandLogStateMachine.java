package com.distributedraft.node.statemachine;

import com.distributedraft.common.dto.RaftLogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Default state machine: keeps every applied command in order, in memory.
 */
@Slf4j
public class CommandLogStateMachine implements AppliedStateMachine {

    private final List<RaftLogEntry> applied = new ArrayList<>();

    @Override
    public synchronized void apply(RaftLogEntry entry) {
        long expected = applied.size() + 1L;
        if (entry.getIndex() != expected) {
            throw new IllegalStateException("Entry " + entry.getIndex()
                    + " applied out of order, expected " + expected);
        }
        applied.add(entry);
        log.debug("Applied entry {} (term {}): {}", entry.getIndex(), entry.getTerm(), entry.commandAsText());
    }

    @Override
    public synchronized long getLastAppliedIndex() {
        return applied.size();
    }

    public synchronized List<RaftLogEntry> getAppliedEntries() {
        return new ArrayList<>(applied);
    }

    public synchronized List<String> getAppliedCommands() {
        List<String> commands = new ArrayList<>(applied.size());
        for (RaftLogEntry entry : applied) {
            commands.add(entry.commandAsText());
        }
        return commands;
    }
}
