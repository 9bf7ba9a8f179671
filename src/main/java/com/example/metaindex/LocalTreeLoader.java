package com.example.metaindex;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a local directory into the {@link InMemoryArchive}, hashing blobs and trees the way
 * git does, and publishes a snapshot whose {@code HEAD} points at the root tree. The origin
 * of such a tree is {@code file://<absolute path>}.
 */
@Slf4j
@Service
public class LocalTreeLoader {

    private final InMemoryArchive archive;
    private final String rootPath;
    private final Set<String> ignored;

    public LocalTreeLoader(Environment env, InMemoryArchive archive) {
        this.archive = archive;
        String rp = env.getProperty("scanner.root.path");
        this.rootPath = rp == null ? "" : rp;
        String ign = env.getProperty("scanner.ignored-dirs", ".git,.hg,.svn,node_modules,target");
        this.ignored = Arrays.stream(ign.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    public record LoadedTree(String originUrl, String snapshotId, String rootDirectory, int blobs, int directories) {}

    @PostConstruct
    public void loadConfiguredRoot() throws IOException {
        if (rootPath.isBlank()) {
            log.info("scanner.root.path not set; no local tree loaded");
            return;
        }
        LoadedTree t = load(Paths.get(rootPath));
        log.info("Loaded local tree {} as {} (blobs={}, directories={})", rootPath, t.originUrl(), t.blobs(), t.directories());
    }

    public LoadedTree load(Path root) throws IOException {
        Path abs = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(abs)) throw new NoSuchFileException(abs.toString(), null, "not a directory");
        int[] counts = new int[2];
        String rootId = hashTree(abs, counts);
        String originUrl = originUrl(abs);
        String snapshotId = sha1Hex(("snapshot " + originUrl + " " + rootId).getBytes(StandardCharsets.UTF_8));
        Map<String, ArchiveModels.SnapshotBranch> branches = new LinkedHashMap<>();
        branches.put("HEAD", new ArchiveModels.SnapshotBranch(rootId, ArchiveModels.TargetType.DIRECTORY));
        archive.putSnapshot(originUrl, new ArchiveModels.Snapshot(snapshotId, branches));
        return new LoadedTree(originUrl, snapshotId, rootId, counts[0], counts[1]);
    }

    public static String originUrl(Path root) {
        return "file://" + root.toAbsolutePath().normalize();
    }

    private String hashTree(Path dir, int[] counts) throws IOException {
        List<Path> children;
        try (Stream<Path> s = Files.list(dir)) {
            children = s.filter(p -> !Files.isSymbolicLink(p))
                    .filter(p -> !(Files.isDirectory(p) && ignored.contains(p.getFileName().toString())))
                    .collect(Collectors.toList());
        }
        // git orders tree entries by name, directories compared as if suffixed with '/'
        children.sort(Comparator.comparing(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : "")));

        ByteArrayOutputStream body = new ByteArrayOutputStream();
        List<ArchiveModels.DirectoryEntry> entries = new ArrayList<>();
        for (Path child : children) {
            String name = child.getFileName().toString();
            String id;
            String mode;
            ArchiveModels.EntryType type;
            if (Files.isDirectory(child)) {
                id = hashTree(child, counts);
                mode = "40000";
                type = ArchiveModels.EntryType.DIR;
            } else if (Files.isRegularFile(child)) {
                byte[] data = Files.readAllBytes(child);
                id = blobId(data);
                archive.putBlob(id, data);
                counts[0]++;
                mode = Files.isExecutable(child) ? "100755" : "100644";
                type = ArchiveModels.EntryType.FILE;
            } else {
                continue;
            }
            body.writeBytes((mode + " " + name).getBytes(StandardCharsets.UTF_8));
            body.write(0);
            body.writeBytes(hexToBytes(id));
            entries.add(new ArchiveModels.DirectoryEntry(name, type, id));
        }
        String treeId = objectId("tree", body.toByteArray());
        archive.putDirectory(treeId, entries);
        counts[1]++;
        return treeId;
    }

    public static String blobId(byte[] data) {
        return objectId("blob", data);
    }

    private static String objectId(String kind, byte[] data) {
        byte[] header = (kind + " " + data.length + "\0").getBytes(StandardCharsets.UTF_8);
        byte[] all = new byte[header.length + data.length];
        System.arraycopy(header, 0, all, 0, header.length);
        System.arraycopy(data, 0, all, header.length, data.length);
        return sha1Hex(all);
    }

    private static String sha1Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static byte[] hexToBytes(String hex) {
        return HexFormat.of().parseHex(hex);
    }
}
