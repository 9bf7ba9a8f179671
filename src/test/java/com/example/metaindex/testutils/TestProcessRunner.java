package com.example.metaindex.testutils;

import com.example.metaindex.ProcessRunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands out the same canned process for every command and records the command lines.
 */
public class TestProcessRunner implements ProcessRunner {
    private final CapturingProcess process;
    private final List<List<String>> commands = new ArrayList<>();

    public TestProcessRunner(CapturingProcess process) {
        this.process = process;
    }

    @Override
    public synchronized Process start(List<String> command) throws IOException {
        commands.add(List.copyOf(command));
        return process;
    }

    public synchronized List<List<String>> getCommands() {
        return new ArrayList<>(commands);
    }
}
