package com.distributedraft.cli.commands;

import com.distributedraft.cli.utils.ArgumentParser;
import com.distributedraft.cli.utils.NodeClient;

/**
 * Command to add a node to a node's cluster membership
 * Usage: raftcli join --address ip:port [--node host:port]
 */
public class JoinCommand implements Command {

    @Override
    public void execute(String[] args) throws Exception {
        ArgumentParser parser = new ArgumentParser(args);

        if (parser.wantsHelp()) {
            printHelp();
            return;
        }

        String address = parser.getOption("address");
        if (address == null) {
            throw new IllegalArgumentException("Missing required argument: --address");
        }

        NodeClient client = new NodeClient(parser.getOption("node", NodeClient.DEFAULT_NODE));
        client.join(address);

        System.out.println("[OK] " + address + " joined the membership of " + client.getBaseUrl());
    }

    @Override
    public void printHelp() {
        System.out.println("Add a node to the cluster membership of a node");
        System.out.println();
        System.out.println("Usage: raftcli join --address <ip:port> [options]");
        System.out.println();
        System.out.println("Required Arguments:");
        System.out.println("  --address <ip:port>     Address of the joining node, as an IP literal");
        System.out.println();
        System.out.println("Optional Arguments:");
        System.out.println("  --node <host:port>      Node receiving the join (default: " + NodeClient.DEFAULT_NODE + ")");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  raftcli join --address 127.0.0.1:8084 --node localhost:8081");
    }
}
