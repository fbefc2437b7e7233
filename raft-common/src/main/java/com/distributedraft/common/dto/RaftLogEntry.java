package com.distributedraft.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * Raft log entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RaftLogEntry {

    /**
     * Index in the log, starting at 1
     */
    private long index;

    /**
     * Term when entry was received by leader
     */
    private long term;

    /**
     * Opaque command handed to the applied state machine once committed.
     * Serialized as base64 in JSON.
     */
    private byte[] command;

    @JsonIgnore
    public String commandAsText() {
        return command == null ? "" : new String(command, StandardCharsets.UTF_8);
    }
}
