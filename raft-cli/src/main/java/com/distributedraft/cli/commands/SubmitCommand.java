package com.distributedraft.cli.commands;

import com.distributedraft.cli.utils.ArgumentParser;
import com.distributedraft.cli.utils.NodeClient;
import com.distributedraft.common.dto.SubmitCommandResponse;

import java.nio.charset.StandardCharsets;

/**
 * Command to submit a command to the leader's log
 * Usage: raftcli submit --command "text" [--node host:port]
 */
public class SubmitCommand implements Command {

    @Override
    public void execute(String[] args) throws Exception {
        ArgumentParser parser = new ArgumentParser(args);

        if (parser.wantsHelp()) {
            printHelp();
            return;
        }

        String command = parser.getOption("command");
        if (command == null) {
            throw new IllegalArgumentException("Missing required argument: --command");
        }

        NodeClient client = new NodeClient(parser.getOption("node", NodeClient.DEFAULT_NODE));
        SubmitCommandResponse reply = client.submit(command.getBytes(StandardCharsets.UTF_8));

        System.out.println("[OK] Committed at index " + reply.getIndex() + " in term " + reply.getTerm());
    }

    @Override
    public void printHelp() {
        System.out.println("Append a command to the replicated log and wait for it to commit");
        System.out.println();
        System.out.println("Usage: raftcli submit --command <text> [options]");
        System.out.println();
        System.out.println("Required Arguments:");
        System.out.println("  --command <text>        Command text, sent as UTF-8 bytes");
        System.out.println();
        System.out.println("Optional Arguments:");
        System.out.println("  --node <host:port>      Leader node (default: " + NodeClient.DEFAULT_NODE + ")");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  raftcli submit --command \"set x=1\" --node localhost:8081");
    }
}
