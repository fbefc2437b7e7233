package com.distributedraft.node.statemachine;

import com.distributedraft.common.dto.RaftLogEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLogStateMachineTest {

    private static RaftLogEntry entry(long index, String command) {
        return RaftLogEntry.builder()
                .index(index)
                .term(1)
                .command(command.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void testAppliesInOrder() {
        CommandLogStateMachine stateMachine = new CommandLogStateMachine();
        assertEquals(0, stateMachine.getLastAppliedIndex());

        stateMachine.apply(entry(1, "set a=1"));
        stateMachine.apply(entry(2, "set b=2"));

        assertEquals(2, stateMachine.getLastAppliedIndex());
        assertEquals(List.of("set a=1", "set b=2"), stateMachine.getAppliedCommands());
        assertEquals(2, stateMachine.getAppliedEntries().size());
    }

    @Test
    void testRejectsOutOfOrderEntry() {
        CommandLogStateMachine stateMachine = new CommandLogStateMachine();
        stateMachine.apply(entry(1, "a"));

        assertThrows(IllegalStateException.class, () -> stateMachine.apply(entry(3, "c")));
        assertThrows(IllegalStateException.class, () -> stateMachine.apply(entry(1, "a")));
        assertEquals(1, stateMachine.getLastAppliedIndex());
    }
}
