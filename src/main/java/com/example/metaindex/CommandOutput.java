package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Result of an external command run to completion, stdout and stderr fully drained.
 */
record CommandOutput(int exitCode, String stdout, String stderr) {

    private static final Logger log = LoggerFactory.getLogger(CommandOutput.class);

    static CommandOutput run(ProcessRunner runner, List<String> command, long timeoutSeconds) throws IOException {
        Process proc = runner.start(command);
        proc.getOutputStream().close();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        Thread outReader = drain(proc.getInputStream(), out, "command-stdout-reader");
        Thread errReader = drain(proc.getErrorStream(), err, "command-stderr-reader");
        try {
            boolean finished = proc.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                log.warn("{} did not finish within {}s, destroying", command.get(0), timeoutSeconds);
                proc.destroyForcibly();
                throw new IOException(command.get(0) + " timed out after " + timeoutSeconds + "s");
            }
            outReader.join(2000);
            errReader.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
            throw new IOException("interrupted while waiting for " + command.get(0), e);
        }
        return new CommandOutput(proc.exitValue(),
                out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private static Thread drain(InputStream in, ByteArrayOutputStream sink, String name) {
        Thread t = new Thread(() -> {
            try (InputStream is = in) {
                is.transferTo(sink);
            } catch (IOException io) {
                log.error("error reading process output", io);
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
