package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.AppendEntriesRequest;
import lombok.Value;

/**
 * AppendEntries the leader has prepared for one peer
 */
@Value
public class OutboundAppend {
    PeerAddress peer;
    AppendEntriesRequest request;
}
