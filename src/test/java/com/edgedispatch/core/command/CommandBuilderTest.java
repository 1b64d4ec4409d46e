package com.edgedispatch.core.command;

import com.edgedispatch.core.execution.ExecutionRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandBuilderTest {

    @Test
    void deploymentIntentPullsThenRunsNamedContainer() {
        String line = CommandBuilder.build(ExecutionRequest.deployment("jetson-01", "zed", "dummy-zed:latest"));

        assertEquals("docker pull dummy-zed:latest && docker run -d --name zed-instance "
                + "--restart=always dummy-zed:latest", line);
    }

    @Test
    void deploymentIntentIsDeterministic() {
        var request = ExecutionRequest.deployment("jetson-01", "zed", "dummy-zed:latest");

        assertEquals(CommandBuilder.build(request), CommandBuilder.build(request));
    }

    @Test
    void deploymentIntentWinsOverRawCommand() {
        var request = new ExecutionRequest("jetson-01", List.of("uptime"), "zed", "dummy-zed:latest");

        assertTrue(CommandBuilder.build(request).startsWith("docker pull dummy-zed:latest"));
    }

    @Test
    void rawCommandIsJoinedUnchanged() {
        var request = ExecutionRequest.command("jetson-01", List.of("docker", "ps", "-a"));

        assertEquals("docker ps -a", CommandBuilder.build(request));
    }

    @Test
    void singleElementCommandKeepsItsQuoting() {
        var request = ExecutionRequest.command("jetson-01", List.of("uname -a && df -h '/'"));

        assertEquals("uname -a && df -h '/'", CommandBuilder.build(request));
    }

    @Test
    void incompleteIntentWithoutCommandFallsBackToNoOp() {
        var request = new ExecutionRequest("jetson-01", List.of(), "zed", " ");

        assertEquals(CommandBuilder.UNRECOGNIZED_COMMAND, CommandBuilder.build(request));
    }

    @Test
    void incompleteIntentUsesRawCommandWhenPresent() {
        var request = new ExecutionRequest("jetson-01", List.of("uptime"), "zed", null);

        assertEquals("uptime", CommandBuilder.build(request));
    }

    @Test
    void nullRequestFallsBackToNoOp() {
        assertEquals(CommandBuilder.UNRECOGNIZED_COMMAND, CommandBuilder.build(null));
    }
}
