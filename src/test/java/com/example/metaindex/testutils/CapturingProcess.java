package com.example.metaindex.testutils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

/**
 * A finished process with canned output. Whatever the caller writes to its stdin is kept.
 */
public class CapturingProcess extends Process {
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final ByteArrayInputStream stdout;
    private final ByteArrayInputStream stderr;
    private final int exitCode;
    private volatile boolean destroyed = false;

    public CapturingProcess(String stdout, int exitCode) {
        this(stdout == null ? null : stdout.getBytes(java.nio.charset.StandardCharsets.UTF_8), null, exitCode);
    }

    public CapturingProcess(byte[] stdoutBytes, byte[] stderrBytes, int exitCode) {
        this.stdout = new ByteArrayInputStream(stdoutBytes == null ? new byte[0] : stdoutBytes);
        this.stderr = new ByteArrayInputStream(stderrBytes == null ? new byte[0] : stderrBytes);
        this.exitCode = exitCode;
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() {
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) {
        return true;
    }

    @Override
    public int exitValue() {
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyed = true;
    }

    @Override
    public Process destroyForcibly() {
        destroyed = true;
        return this;
    }

    @Override
    public boolean isAlive() {
        return false;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public byte[] getCapturedStdin() {
        return stdin.toByteArray();
    }
}
