package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the canonical branch of an origin's latest snapshot and resolves it to a directory.
 * <p>
 * Precedence: {@code HEAD} (aliases followed), then the configured default branch names in
 * order, then, when every branch is a release archive such as {@code gnu-hello-0.0.1.tar.gz},
 * the archives from the highest version down. A candidate whose alias dangles or which targets
 * something other than a revision or directory is skipped in favour of the next one.
 */
@Slf4j
@Service
public class HeadResolver {

    static final String HEAD = "HEAD";

    private static final Pattern ARCHIVE = Pattern.compile(
            "^(?<pkg>.*)[-_](?<version>[0-9]+(\\.[0-9]+)*)(?<pre>[-+][a-zA-Z0-9.~]+?)?(?<ext>(\\.[a-zA-Z0-9]+)+)$");

    private final ArchiveGraph graph;
    private final List<String> defaultBranches;

    public HeadResolver(ArchiveGraph graph, Environment env) {
        this.graph = graph;
        String names = env.getProperty("indexer.head.default-branches", "refs/heads/master,refs/heads/main,master,main");
        List<String> list = new ArrayList<>();
        for (String n : names.split(",")) if (!n.isBlank()) list.add(n.trim());
        this.defaultBranches = List.copyOf(list);
    }

    public ResolvedHead resolve(String originUrl) {
        ArchiveModels.Snapshot snapshot = graph.getLatestSnapshot(originUrl)
                .orElseThrow(() -> new NoCanonicalBranchException(originUrl, "no snapshot"));
        Map<String, ArchiveModels.SnapshotBranch> branches = snapshot.branches() == null ? Map.of() : snapshot.branches();
        List<String> candidates = candidates(branches);
        if (candidates.isEmpty()) throw new NoCanonicalBranchException(originUrl, "no branch matches the head precedence");

        NoCanonicalBranchException last = null;
        for (String name : candidates) {
            try {
                ResolvedHead head = resolveBranch(originUrl, snapshot.id(), branches, name);
                log.debug("head of {} is {} -> directory {}", originUrl, name, head.directoryId());
                return head;
            } catch (NoCanonicalBranchException e) {
                log.debug("skipping branch {} of {}: {}", name, originUrl, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private ResolvedHead resolveBranch(String originUrl, String snapshotId,
                                       Map<String, ArchiveModels.SnapshotBranch> branches, String name) {
        ArchiveModels.SnapshotBranch target = followAliases(originUrl, branches, name);
        return switch (target.targetType()) {
            case REVISION -> {
                ArchiveModels.Revision rev = graph.getRevision(target.target())
                        .orElseThrow(() -> new NoCanonicalBranchException(originUrl, "revision " + target.target() + " not found"));
                yield new ResolvedHead(originUrl, snapshotId, name, rev.id(), rev.directory());
            }
            case DIRECTORY -> new ResolvedHead(originUrl, snapshotId, name, null, target.target());
            default -> throw new NoCanonicalBranchException(originUrl,
                    "branch " + name + " targets a " + target.targetType().name().toLowerCase());
        };
    }

    /**
     * Branch names to try, best first: HEAD, the default branches that exist, then the release
     * archives from the highest version down when every branch is one.
     */
    List<String> candidates(Map<String, ArchiveModels.SnapshotBranch> branches) {
        List<String> out = new ArrayList<>();
        if (branches.get(HEAD) != null) out.add(HEAD);
        for (String name : defaultBranches) {
            if (branches.get(name) != null && !out.contains(name)) out.add(name);
        }
        List<ArchiveVersion> versions = new ArrayList<>();
        for (Map.Entry<String, ArchiveModels.SnapshotBranch> e : branches.entrySet()) {
            if (e.getValue() == null) continue;
            Optional<ArchiveVersion> v = ArchiveVersion.parse(e.getKey());
            if (v.isEmpty()) return out;
            versions.add(v.get());
        }
        versions.sort(Comparator.reverseOrder());
        for (ArchiveVersion v : versions) out.add(v.filename());
        return out;
    }

    private static ArchiveModels.SnapshotBranch followAliases(String originUrl, Map<String, ArchiveModels.SnapshotBranch> branches,
                                                             String name) {
        Set<String> seen = new HashSet<>();
        String current = name;
        ArchiveModels.SnapshotBranch b = branches.get(current);
        while (b != null && b.targetType() == ArchiveModels.TargetType.ALIAS) {
            if (!seen.add(current)) throw new NoCanonicalBranchException(originUrl, "alias cycle at " + current);
            current = b.target();
            b = branches.get(current);
        }
        if (b == null) throw new NoCanonicalBranchException(originUrl, "dangling alias " + name + " -> " + current);
        return b;
    }

    /**
     * Release version parsed from an archive file name. Ordered by the numeric components,
     * then pre-releases ({@code -beta2}) before the release before post-releases
     * ({@code +foo}), then by the suffix.
     */
    record ArchiveVersion(String filename, List<Integer> numbers, int stage, String suffix) implements Comparable<ArchiveVersion> {

        static Optional<ArchiveVersion> parse(String filename) {
            Matcher m = ARCHIVE.matcher(filename);
            if (!m.matches()) return Optional.empty();
            List<Integer> numbers = new ArrayList<>();
            for (String n : m.group("version").split("\\.")) {
                try {
                    numbers.add(Integer.parseInt(n));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            String pre = m.group("pre");
            if (pre == null) return Optional.of(new ArchiveVersion(filename, numbers, 0, ""));
            return Optional.of(new ArchiveVersion(filename, numbers, pre.startsWith("-") ? -1 : 1, pre.substring(1)));
        }

        @Override
        public int compareTo(ArchiveVersion o) {
            int len = Math.max(numbers.size(), o.numbers.size());
            for (int i = 0; i < len; i++) {
                int a = i < numbers.size() ? numbers.get(i) : 0;
                int b = i < o.numbers.size() ? o.numbers.get(i) : 0;
                if (a != b) return Integer.compare(a, b);
            }
            if (stage != o.stage) return Integer.compare(stage, o.stage);
            int c = suffix.compareTo(o.suffix);
            return c != 0 ? c : filename.compareTo(o.filename);
        }
    }
}
