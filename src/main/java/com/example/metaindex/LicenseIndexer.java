package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * License detection with FOSSology's {@code nomossa}, run on a temporary copy of each blob.
 * The scanner prints {@code File <path> contains license(s) A,B}, or {@code No_license_found}.
 */
@Service
public class LicenseIndexer extends ContentIndexer<List<String>> {

    static final String MARKER = " contains license(s) ";
    static final String NO_LICENSE = "No_license_found";

    private final ProcessRunner processRunner;
    private final String command;
    private final String version;
    private final long timeoutSeconds;
    private final Path workdir;

    public LicenseIndexer(LicenseFactStore store, ObjectStorage storage, ToolRegistry registry,
                          ProcessRunner processRunner, Environment env) {
        super(store, storage, registry);
        this.processRunner = processRunner;
        this.command = env.getProperty("indexer.license.command", "nomossa");
        this.version = env.getProperty("indexer.license.version", "3.1.0");
        this.timeoutSeconds = Long.parseLong(env.getProperty("indexer.license.timeout-seconds", "60"));
        String wd = env.getProperty("indexer.license.workdir", "");
        this.workdir = wd.isBlank() ? null : Path.of(wd);
    }

    @Override
    public String name() {
        return "license";
    }

    @Override
    public ToolSpec toolSpec() {
        return new ToolSpec("nomos", version, Map.of("command_line", command + " <filepath>"));
    }

    @Override
    protected Optional<List<String>> compute(String contentId, byte[] data) throws IOException {
        Path tmp = workdir == null ? Files.createTempFile("license-", ".blob") : Files.createTempFile(workdir, "license-", ".blob");
        try {
            Files.write(tmp, data);
            CommandOutput out = CommandOutput.run(processRunner, List.of(command, tmp.toString()), timeoutSeconds);
            if (out.exitCode() != 0) {
                throw new IOException(command + " exited with " + out.exitCode() + ": " + out.stderr().trim());
            }
            return Optional.of(parse(out.stdout()));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static List<String> parse(String output) {
        Set<String> licenses = new TreeSet<>();
        for (String line : output.split("\r?\n")) {
            int at = line.indexOf(MARKER);
            if (at < 0) continue;
            for (String l : line.substring(at + MARKER.length()).split(",")) {
                String name = l.trim();
                if (!name.isEmpty() && !NO_LICENSE.equals(name)) licenses.add(name);
            }
        }
        return new ArrayList<>(licenses);
    }
}
