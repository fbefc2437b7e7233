package com.distributedraft.cli.utils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simple command-line argument parser
 * Supports:
 *   --option value (for options with values)
 *   --flag (for boolean flags)
 *   -f (single dash flags)
 *   bare words (positional arguments)
 */
public class ArgumentParser {

    private final Map<String, String> options = new HashMap<>();
    private final Set<String> flags = new HashSet<>();
    private final List<String> positional = new ArrayList<>();

    public ArgumentParser(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (arg.startsWith("--")) {
                String key = arg.substring(2);

                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    options.put(key, args[i + 1]);
                    i++;
                } else {
                    flags.add(key);
                }
            } else if (arg.startsWith("-") && arg.length() > 1) {
                flags.add(arg.substring(1));
            } else {
                positional.add(arg);
            }
        }
    }

    /**
     * Get option value
     * @param name Option name (without dashes)
     * @return Option value or null if not present
     */
    public String getOption(String name) {
        return options.get(name);
    }

    public String getOption(String name, String defaultValue) {
        return options.getOrDefault(name, defaultValue);
    }

    /**
     * Check if flag is present
     * @param name Flag name (without dashes)
     */
    public boolean hasFlag(String name) {
        return flags.contains(name);
    }

    public boolean wantsHelp() {
        return hasFlag("help") || hasFlag("h");
    }

    /**
     * Arguments that are neither options nor flags, in order
     */
    public List<String> getPositional() {
        return new ArrayList<>(positional);
    }
}
