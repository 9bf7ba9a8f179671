package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Symbol extraction with universal-ctags. Tag lines look like
 * {@code name<TAB>path<TAB>12;"<TAB>kind:function<TAB>line:12<TAB>language:Python}; lines that
 * do not have a name and a line number are skipped.
 */
@Service
public class CtagsIndexer extends ContentIndexer<List<CtagsSymbol>> {

    private final ProcessRunner processRunner;
    private final String command;
    private final String version;
    private final long timeoutSeconds;
    private final long maxContentSize;

    public CtagsIndexer(CtagsFactStore store, ObjectStorage storage, ToolRegistry registry,
                        ProcessRunner processRunner, Environment env) {
        super(store, storage, registry);
        this.processRunner = processRunner;
        this.command = env.getProperty("indexer.ctags.command", "ctags");
        this.version = env.getProperty("indexer.ctags.version", "5.9");
        this.timeoutSeconds = Long.parseLong(env.getProperty("indexer.ctags.timeout-seconds", "60"));
        this.maxContentSize = Long.parseLong(env.getProperty("indexer.ctags.max-content-size", "10485760"));
    }

    @Override
    public String name() {
        return "ctags";
    }

    @Override
    public ToolSpec toolSpec() {
        return new ToolSpec("universal-ctags", version,
                Map.of("command_line", String.join(" ", arguments("<filepath>")), "max_content_size", maxContentSize));
    }

    @Override
    protected Optional<List<CtagsSymbol>> compute(String contentId, byte[] data) throws IOException {
        if (data.length > maxContentSize) {
            log.info("ctags: skipping {} ({} bytes over the {} limit)", contentId, data.length, maxContentSize);
            return Optional.empty();
        }
        Path tmp = Files.createTempFile("ctags-", ".src");
        try {
            Files.write(tmp, data);
            CommandOutput out = CommandOutput.run(processRunner, arguments(tmp.toString()), timeoutSeconds);
            if (out.exitCode() != 0) {
                throw new IOException(command + " exited with " + out.exitCode() + ": " + out.stderr().trim());
            }
            return Optional.of(parse(out.stdout()));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private List<String> arguments(String path) {
        return List.of(command, "--fields=+lnKz", "--sort=no", "--guess-language-eager", "-f", "-", path);
    }

    static List<CtagsSymbol> parse(String output) {
        List<CtagsSymbol> out = new ArrayList<>();
        for (String line : output.split("\r?\n")) {
            if (line.isEmpty() || line.startsWith("!_TAG_")) continue;
            String[] parts = line.split("\t");
            if (parts.length < 3 || parts[0].isEmpty()) continue;
            String kind = null;
            String lang = null;
            Integer lineNo = null;
            for (int i = 3; i < parts.length; i++) {
                String f = parts[i];
                int colon = f.indexOf(':');
                if (colon < 0) {
                    if (kind == null) kind = f;
                    continue;
                }
                String key = f.substring(0, colon);
                String value = f.substring(colon + 1);
                switch (key) {
                    case "kind" -> kind = value;
                    case "language" -> lang = value;
                    case "line" -> lineNo = parseLine(value);
                    default -> { }
                }
            }
            if (lineNo == null) {
                // the address field is "12;\"" when ctags emits line numbers as addresses
                String address = parts[2];
                int semi = address.indexOf(';');
                lineNo = parseLine(semi < 0 ? address : address.substring(0, semi));
            }
            if (lineNo == null) continue;
            out.add(new CtagsSymbol(parts[0], kind, lineNo, lang));
        }
        return out;
    }

    private static Integer parseLine(String s) {
        try {
            return Integer.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
