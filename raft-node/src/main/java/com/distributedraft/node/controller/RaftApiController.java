package com.distributedraft.node.controller;

import com.distributedraft.common.constant.RaftConstants;
import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.AppendEntriesResponse;
import com.distributedraft.common.dto.RaftLogEntry;
import com.distributedraft.common.dto.RequestVoteRequest;
import com.distributedraft.common.dto.RequestVoteResponse;
import com.distributedraft.common.dto.SubmitCommandResponse;
import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.RaftException;
import com.distributedraft.node.config.RaftProperties;
import com.distributedraft.node.coordination.PeerAddress;
import com.distributedraft.node.coordination.RaftController;
import com.distributedraft.node.coordination.RaftStatus;
import com.distributedraft.node.statemachine.AppliedStateMachine;
import com.distributedraft.node.statemachine.CommandLogStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST API endpoints for the Raft protocol
 */
@Slf4j
@RestController
@RequestMapping(RaftConstants.API_BASE_PATH)
@RequiredArgsConstructor
public class RaftApiController {

    private final RaftController raftController;
    private final AppliedStateMachine stateMachine;
    private final RaftProperties properties;

    /**
     * Handle RequestVote RPC from a candidate
     */
    @PostMapping(RaftConstants.REQUEST_VOTE_PATH)
    public ResponseEntity<RequestVoteResponse> handleRequestVote(@RequestBody RequestVoteRequest request) {
        log.debug("Received RequestVote RPC: term={}, candidate={}", request.getTerm(), request.getCandidateId());
        return ResponseEntity.ok(raftController.handleRequestVote(request));
    }

    /**
     * Handle AppendEntries RPC from leader
     */
    @PostMapping(RaftConstants.APPEND_ENTRIES_PATH)
    public ResponseEntity<AppendEntriesResponse> handleAppendEntries(@RequestBody AppendEntriesRequest request) {
        try {
            log.debug("Received AppendEntries RPC: term={}, leader={}, prevIndex={}, entries={}, commitIndex={}",
                    request.getTerm(), request.getLeaderId(), request.getPrevIndex(),
                    request.isHeartbeat() ? 0 : request.getEntries().size(), request.getCommitIndex());

            return ResponseEntity.ok(raftController.handleAppendEntries(request));
        } catch (RuntimeException e) {
            log.error("Error processing AppendEntries RPC", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AppendEntriesResponse.builder()
                            .term(raftController.getState().getCurrentTerm())
                            .success(false)
                            .build());
        }
    }

    /**
     * Add a node to the cluster. The body is the raw UTF-8 text of its host:port address.
     */
    @PostMapping(RaftConstants.JOIN_PATH)
    public ResponseEntity<Void> join(@RequestBody(required = false) byte[] payload) {
        PeerAddress address = raftController.join(payload);
        log.info("Join accepted for {}", address);
        return ResponseEntity.ok().build();
    }

    /**
     * Submit a command to the leader and wait until it is committed and applied
     */
    @PostMapping(RaftConstants.COMMANDS_PATH)
    public ResponseEntity<SubmitCommandResponse> submitCommand(@RequestBody(required = false) byte[] command) {
        CompletableFuture<RaftLogEntry> committed = raftController.submitCommand(command == null ? new byte[0] : command);
        RaftLogEntry entry = awaitCommit(committed);
        return ResponseEntity.ok(SubmitCommandResponse.builder()
                .index(entry.getIndex())
                .term(entry.getTerm())
                .build());
    }

    /**
     * Get current Raft status (for debugging/monitoring)
     */
    @GetMapping(RaftConstants.STATUS_PATH)
    public ResponseEntity<RaftStatus> getStatus() {
        return ResponseEntity.ok(raftController.status());
    }

    /**
     * Get applied state machine contents (for debugging)
     */
    @GetMapping("/state-machine/stats")
    public ResponseEntity<Map<String, Object>> getStateMachineStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("nodeId", raftController.getState().getNodeId());
        stats.put("lastAppliedIndex", stateMachine.getLastAppliedIndex());
        if (stateMachine instanceof CommandLogStateMachine) {
            stats.put("commands", ((CommandLogStateMachine) stateMachine).getAppliedCommands());
        }
        return ResponseEntity.ok(stats);
    }

    private RaftLogEntry awaitCommit(CompletableFuture<RaftLogEntry> committed) {
        long timeoutMs = properties.getRpc().getCommitTimeoutMs();
        try {
            return committed.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RaftException(ErrorCode.COMMIT_TIMEOUT,
                    "Entry not committed within " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RaftException) {
                throw (RaftException) e.getCause();
            }
            throw new RaftException(ErrorCode.UNKNOWN_ERROR, "Failed to apply entry: " + e.getCause().getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RaftException(ErrorCode.COMMIT_TIMEOUT, "Interrupted while waiting for commit", e);
        }
    }
}
