package com.distributedraft.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply to a client command once the leader has committed and applied it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitCommandResponse {
    private long index;
    private long term;
}
