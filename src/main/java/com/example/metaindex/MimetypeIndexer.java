package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Mimetype and encoding by byte sniffing: well-known magic numbers first, then NUL bytes
 * (binary), then UTF-8 validity to tell text encodings apart.
 */
@Service
public class MimetypeIndexer extends ContentIndexer<Mimetype> {

    private static final int SNIFF_LENGTH = 8192;

    private final String version;

    public MimetypeIndexer(MimetypeFactStore store, ObjectStorage storage, ToolRegistry registry, Environment env) {
        super(store, storage, registry);
        this.version = env.getProperty("indexer.mimetype.version", "1.0.0");
    }

    @Override
    public String name() {
        return "mimetype";
    }

    @Override
    public ToolSpec toolSpec() {
        return new ToolSpec("mimetype-sniffer", version, Map.of("type", "library", "sniff_length", SNIFF_LENGTH));
    }

    @Override
    protected Optional<Mimetype> compute(String contentId, byte[] data) {
        return Optional.of(detect(data));
    }

    public static Mimetype detect(byte[] data) {
        if (data.length == 0) return new Mimetype("application/x-empty", "binary");
        String magic = magic(data);
        if (magic != null) return new Mimetype(magic, "binary");

        int n = Math.min(data.length, SNIFF_LENGTH);
        boolean ascii = true;
        for (int i = 0; i < n; i++) {
            if (data[i] == 0) return new Mimetype("application/octet-stream", "binary");
            if ((data[i] & 0x80) != 0) ascii = false;
        }
        String encoding = ascii ? "us-ascii" : validUtf8(data, n) ? "utf-8" : "unknown-8bit";
        return new Mimetype(textType(new String(data, 0, n, StandardCharsets.ISO_8859_1)), encoding);
    }

    private static String magic(byte[] d) {
        if (startsWith(d, 0x89, 'P', 'N', 'G')) return "image/png";
        if (startsWith(d, 0xFF, 0xD8, 0xFF)) return "image/jpeg";
        if (startsWith(d, 'G', 'I', 'F', '8')) return "image/gif";
        if (startsWith(d, '%', 'P', 'D', 'F')) return "application/pdf";
        if (startsWith(d, 'P', 'K', 3, 4)) return "application/zip";
        if (startsWith(d, 0x1F, 0x8B)) return "application/gzip";
        if (startsWith(d, 'B', 'Z', 'h')) return "application/x-bzip2";
        if (startsWith(d, 0xFD, '7', 'z', 'X', 'Z', 0)) return "application/x-xz";
        if (startsWith(d, 0x7F, 'E', 'L', 'F')) return "application/x-executable";
        if (startsWith(d, 0xCA, 0xFE, 0xBA, 0xBE)) return "application/x-java-applet";
        return null;
    }

    private static boolean startsWith(byte[] d, int... prefix) {
        if (d.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) if ((d[i] & 0xFF) != prefix[i]) return false;
        return true;
    }

    // a sniffed prefix may cut a multi-byte sequence at its end
    private static boolean validUtf8(byte[] data, int n) {
        int end = n;
        if (n < data.length) {
            int back = 0;
            while (back < 3 && end > 0 && (data[end - 1] & 0xC0) == 0x80) { end--; back++; }
            if (end > 0 && (data[end - 1] & 0xC0) == 0xC0) end--;
        }
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, 0, end));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    private static String textType(String head) {
        String t = head.stripLeading();
        if (t.startsWith("#!")) return "text/x-shellscript";
        if (t.startsWith("<?xml")) return "text/xml";
        if (t.regionMatches(true, 0, "<!doctype html", 0, 14) || t.regionMatches(true, 0, "<html", 0, 5)) return "text/html";
        String s = t.stripTrailing();
        if ((s.startsWith("{") && s.endsWith("}")) || (s.startsWith("[") && s.endsWith("]"))) return "application/json";
        return "text/plain";
    }
}
