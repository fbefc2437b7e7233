package com.distributedraft.cli;

import com.distributedraft.cli.commands.Command;
import com.distributedraft.cli.commands.JoinCommand;
import com.distributedraft.cli.commands.StatusCommand;
import com.distributedraft.cli.commands.SubmitCommand;

import java.util.Arrays;

/**
 * Main entry point for RaftCli - command line client for a Raft node
 * Usage: raftcli <command> [options]
 *
 * Available commands:
 *   status   - Show a node's Raft status
 *   join     - Add a node to the cluster membership
 *   submit   - Append a command to the replicated log
 *   help     - Show help information
 */
public class RaftCli {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run one command line
     * @return process exit code
     */
    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 1;
        }

        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        switch (command.toLowerCase()) {
            case "help":
            case "--help":
            case "-h":
                printUsage();
                return 0;
            case "version":
            case "--version":
            case "-v":
                System.out.println("RaftCli version " + VERSION);
                return 0;
            default:
                break;
        }

        Command cmd = getCommand(command);
        if (cmd == null) {
            System.err.println("[ERROR] Unknown command: " + command);
            System.err.println();
            printUsage();
            return 1;
        }

        try {
            cmd.execute(commandArgs);
            return 0;
        } catch (Exception e) {
            String errorMsg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("[ERROR] " + errorMsg);
            if (System.getProperty("raftcli.verbose") != null) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    static Command getCommand(String name) {
        switch (name.toLowerCase()) {
            case "status":
                return new StatusCommand();
            case "join":
                return new JoinCommand();
            case "submit":
                return new SubmitCommand();
            default:
                return null;
        }
    }

    private static void printUsage() {
        System.out.println("============================================================");
        System.out.println("  RaftCli - Raft Node Command Line Interface");
        System.out.println("============================================================");
        System.out.println();
        System.out.println("Usage: raftcli <command> [options]");
        System.out.println();
        System.out.println("Cluster:");
        System.out.println("  status             Show a node's term, role, leader and log positions");
        System.out.println("  join               Add a node to a node's cluster membership");
        System.out.println();
        System.out.println("Log:");
        System.out.println("  submit             Append a command and wait for it to commit");
        System.out.println();
        System.out.println("General:");
        System.out.println("  help               Show this help message");
        System.out.println("  version            Show version information");
        System.out.println();
        System.out.println("Run 'raftcli <command> --help' for more information on a command.");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  raftcli status --node localhost:8081");
        System.out.println("  raftcli join --address 127.0.0.1:8084 --node localhost:8081");
        System.out.println("  raftcli submit --command \"set x=1\" --node localhost:8081");
    }
}
