package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.RaftLogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory Raft log, indexed from 1 (index 0 is the implicit empty entry with term 0).
 *
 * Not thread-safe on its own: it is only touched under the {@link ConsensusState} monitor.
 * Nothing survives a restart.
 */
@Slf4j
class RaftLog {

    private final List<RaftLogEntry> entries = new ArrayList<>();

    long getLastLogIndex() {
        return entries.size();
    }

    long getLastLogTerm() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).getTerm();
    }

    /**
     * Entry at {@code index}, or null when the log does not hold it
     */
    RaftLogEntry getEntry(long index) {
        if (index < 1 || index > entries.size()) {
            return null;
        }
        return entries.get((int) (index - 1));
    }

    long getTermForIndex(long index) {
        RaftLogEntry entry = getEntry(index);
        return entry == null ? 0 : entry.getTerm();
    }

    /**
     * Copy of the entries from {@code startIndex} (inclusive) to the end of the log
     */
    List<RaftLogEntry> getEntriesFrom(long startIndex) {
        long from = Math.max(1, startIndex);
        if (from > entries.size()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(entries.subList((int) (from - 1), entries.size()));
    }

    /**
     * Append a new entry at the end of the log. Its index must be the next one.
     */
    void append(RaftLogEntry entry) {
        if (entry.getIndex() != entries.size() + 1) {
            throw new IllegalArgumentException("Entry index " + entry.getIndex()
                    + " does not follow last index " + entries.size());
        }
        entries.add(entry);
    }

    /**
     * Merge entries sent by a leader into the log.
     *
     * Entries at or below {@code commitIndex} are never touched. An uncommitted entry whose
     * term differs from the incoming one is dropped together with everything after it.
     * Incoming entries not yet held are appended.
     *
     * @return number of entries appended
     */
    int merge(List<RaftLogEntry> incoming, long commitIndex) {
        int appended = 0;
        for (RaftLogEntry entry : incoming) {
            long index = entry.getIndex();
            if (index <= commitIndex) {
                continue;
            }
            RaftLogEntry existing = getEntry(index);
            if (existing != null) {
                if (existing.getTerm() == entry.getTerm()) {
                    continue;
                }
                truncateFrom(index);
            }
            if (index != entries.size() + 1) {
                // gap: the leader will resend from an earlier index
                log.debug("Ignoring entry {} beyond last index {}", index, entries.size());
                break;
            }
            entries.add(entry);
            appended++;
        }
        return appended;
    }

    /**
     * Drop the entry at {@code fromIndex} and everything after it
     */
    void truncateFrom(long fromIndex) {
        if (fromIndex < 1 || fromIndex > entries.size()) {
            return;
        }
        log.info("Truncating log from index {} (last index was {})", fromIndex, entries.size());
        entries.subList((int) (fromIndex - 1), entries.size()).clear();
    }
}
