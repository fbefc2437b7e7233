package com.distributedraft.cli.utils;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    void testOptionsFlagsAndPositional() {
        ArgumentParser parser = new ArgumentParser(new String[]{
                "extra", "--node", "localhost:8081", "--verbose", "-h", "--command", "set x=1"});

        assertEquals("localhost:8081", parser.getOption("node"));
        assertEquals("set x=1", parser.getOption("command"));
        assertTrue(parser.hasFlag("verbose"));
        assertTrue(parser.wantsHelp());
        assertEquals(List.of("extra"), parser.getPositional());
    }

    @Test
    void testOptionFollowedByOptionIsFlag() {
        ArgumentParser parser = new ArgumentParser(new String[]{"--address", "--node", "localhost:8081"});

        assertNull(parser.getOption("address"));
        assertTrue(parser.hasFlag("address"));
        assertEquals("localhost:8081", parser.getOption("node"));
    }

    @Test
    void testDefaultValue() {
        ArgumentParser parser = new ArgumentParser(new String[0]);

        assertEquals(NodeClient.DEFAULT_NODE, parser.getOption("node", NodeClient.DEFAULT_NODE));
        assertFalse(parser.wantsHelp());
    }
}
