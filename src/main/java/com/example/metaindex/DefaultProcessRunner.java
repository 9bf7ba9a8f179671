package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.List;

@Slf4j
@Component
public class DefaultProcessRunner implements ProcessRunner {

    private final File workDir;

    public DefaultProcessRunner(Environment env) {
        String dir = env.getProperty("indexer.process.work-dir", "");
        this.workDir = dir.isBlank() ? null : new File(dir);
    }

    @Override
    public Process start(List<String> command) throws IOException {
        log.debug("starting {} (cwd={})", command, workDir);
        ProcessBuilder pb = new ProcessBuilder(command).redirectInput(ProcessBuilder.Redirect.PIPE);
        if (workDir != null) pb.directory(workDir);
        return pb.start();
    }
}
