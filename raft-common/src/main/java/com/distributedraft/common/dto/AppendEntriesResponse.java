package com.distributedraft.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to AppendEntries RPC
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendEntriesResponse {
    private long term;          // currentTerm, for leader to update itself
    private boolean success;    // false on a stale term or a failed consistency check
}
