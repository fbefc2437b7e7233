package com.distributedraft.cli.commands;

import com.distributedraft.cli.utils.ArgumentParser;
import com.distributedraft.cli.utils.NodeClient;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Command to show a node's Raft status
 * Usage: raftcli status [--node host:port]
 */
public class StatusCommand implements Command {

    @Override
    public void execute(String[] args) throws Exception {
        ArgumentParser parser = new ArgumentParser(args);

        if (parser.wantsHelp()) {
            printHelp();
            return;
        }

        NodeClient client = new NodeClient(parser.getOption("node", NodeClient.DEFAULT_NODE));
        System.out.println("Querying: " + client.getBaseUrl());
        System.out.println();

        JsonNode json = client.getStatus();

        System.out.println("========================================");
        System.out.println("RAFT NODE STATUS");
        System.out.println("========================================");
        System.out.println();

        int nodeId = json.has("nodeId") ? json.get("nodeId").asInt() : -1;
        System.out.println("Node:            Node " + nodeId);
        System.out.println("Current Term:    " + json.path("currentTerm").asLong());
        System.out.println("Role:            " + json.path("role").asText("UNKNOWN"));
        System.out.println("Voted For:       " + nodeOrNone(json.get("votedFor")));
        System.out.println();

        System.out.println("LEADER INFO:");
        JsonNode leaderId = json.get("leaderId");
        if (leaderId != null && !leaderId.isNull()) {
            System.out.println("  Leader Node:   Node " + leaderId.asInt());
            if (json.path("leader").asBoolean()) {
                System.out.println("  Status:        THIS NODE IS THE LEADER");
            } else {
                System.out.println("  Status:        This node is a FOLLOWER");
            }
        } else {
            System.out.println("  Status:        NO LEADER KNOWN");
            System.out.println("  Note:          Cluster may be starting up or in election");
        }
        System.out.println();

        System.out.println("Last Log Index:  " + json.path("lastLogIndex").asLong()
                + " (term " + json.path("lastLogTerm").asLong() + ")");
        System.out.println("Commit Index:    " + json.path("commitIndex").asLong());
        System.out.println("Last Applied:    " + json.path("lastApplied").asLong());
        System.out.println();

        JsonNode peers = json.path("peers");
        System.out.println("PEERS (" + peers.size() + "):");
        for (JsonNode peer : peers) {
            System.out.println("  " + peer.asText());
        }
        System.out.println("========================================");
    }

    private static String nodeOrNone(JsonNode value) {
        return value == null || value.isNull() ? "none" : "Node " + value.asInt();
    }

    @Override
    public void printHelp() {
        System.out.println("Show the Raft status of a node");
        System.out.println();
        System.out.println("Usage: raftcli status [options]");
        System.out.println();
        System.out.println("Optional Arguments:");
        System.out.println("  --node <host:port>      Node to query (default: " + NodeClient.DEFAULT_NODE + ")");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  raftcli status");
        System.out.println("  raftcli status --node localhost:8082");
    }
}
