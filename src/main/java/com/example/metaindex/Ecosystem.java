package com.example.metaindex;

import java.util.*;

/**
 * Source formats the translator understands. Intrinsic variants are recognized by file name
 * in a directory; extrinsic ones by the format a remote metadata record declares.
 * <p>
 * Each variant carries its crosswalk: the source keys it reads and the normalized term each
 * one maps to. Keys absent from the crosswalk are ignored.
 */
public enum Ecosystem {

    NPM("npm", "package.json", List.of(), Format.JSON, crosswalk(
            "name", "name",
            "version", "version",
            "description", "description",
            "author", "author",
            "contributors", "author",
            "keywords", "keywords",
            "license", "license",
            "homepage", "url",
            "repository", "codeRepository",
            "bugs", "issueTracker",
            "dependencies", "softwareRequirements")),

    MAVEN("maven", "pom.xml", List.of(), Format.XML, crosswalk(
            "name", "name",
            "version", "version",
            "description", "description",
            "url", "url",
            "groupId", "identifier",
            "licenses", "license",
            "developers", "author",
            "issueManagement", "issueTracker",
            "dependencies", "softwareRequirements")),

    PKG_INFO("pkg-info", "PKG-INFO", List.of(), Format.PKG_INFO, crosswalk(
            "name", "name",
            "version", "version",
            "summary", "description",
            "description", "description",
            "author", "author",
            "author-email", "email",
            "home-page", "url",
            "keywords", "keywords",
            "license", "license",
            "requires-dist", "softwareRequirements")),

    CODEMETA("codemeta", "codemeta.json", List.of(), Format.JSON, identity("", "schema:")),

    COMPOSER("composer", "composer.json", List.of(), Format.JSON, crosswalk(
            "name", "name",
            "version", "version",
            "description", "description",
            "keywords", "keywords",
            "homepage", "url",
            "license", "license",
            "authors", "author",
            "support", "issueTracker",
            "require", "softwareRequirements")),

    PUBSPEC("pubspec", "pubspec.yaml", List.of(), Format.YAML, crosswalk(
            "name", "name",
            "version", "version",
            "description", "description",
            "homepage", "url",
            "repository", "codeRepository",
            "issue_tracker", "issueTracker",
            "author", "author",
            "authors", "author",
            "license", "license",
            "topics", "keywords",
            "dependencies", "softwareRequirements")),

    CFF("cff", "CITATION.cff", List.of(), Format.YAML, crosswalk(
            "title", "name",
            "version", "version",
            "abstract", "description",
            "authors", "author",
            "keywords", "keywords",
            "license", "license",
            "url", "url",
            "repository-code", "codeRepository",
            "doi", "identifier",
            "date-released", "datePublished")),

    NUGET("nuget", "*.nuspec", List.of(), Format.XML, crosswalk(
            "title", "name",
            "id", "identifier",
            "version", "version",
            "description", "description",
            "summary", "description",
            "authors", "author",
            "projectUrl", "url",
            "repository", "codeRepository",
            "license", "license",
            "licenseUrl", "license",
            "tags", "keywords",
            "dependencies", "softwareRequirements")),

    GEMSPEC("gemspec", "*.gemspec", List.of(), Format.GEMSPEC, crosswalk(
            "name", "name",
            "version", "version",
            "summary", "description",
            "description", "description",
            "author", "author",
            "authors", "author",
            "email", "email",
            "homepage", "codeRepository",
            "license", "license",
            "licenses", "license")),

    GITHUB("github", null, List.of("application/vnd.github.v3+json"), Format.JSON, crosswalk(
            "full_name", "name",
            "description", "description",
            "homepage", "url",
            "html_url", "identifier",
            "clone_url", "codeRepository",
            "license", "license",
            "topics", "keywords",
            "language", "programmingLanguage",
            "created_at", "dateCreated",
            "updated_at", "dateModified")),

    GITEA("gitea", null, List.of("gitea-project-json", "gogs-project-json"), Format.JSON, crosswalk(
            "full_name", "name",
            "description", "description",
            "website", "url",
            "html_url", "identifier",
            "clone_url", "codeRepository",
            "created_at", "dateCreated",
            "updated_at", "dateModified")),

    JSON_SWORD_CODEMETA("json-sword-codemeta", null, List.of("sword-v2-atom-codemeta-v2-in-json"), Format.JSON,
            identity("codemeta:", "schema:")),

    SWORD_CODEMETA("sword-codemeta", null, List.of("sword-v2-atom-codemeta", "sword-v2-atom-codemeta-v2"), Format.XML,
            identity(""));

    public enum Format { JSON, XML, YAML, PKG_INFO, GEMSPEC }

    private final String tag;
    private final String filename;
    private final List<String> formats;
    private final Format format;
    private final Map<String, String> crosswalk;

    Ecosystem(String tag, String filename, List<String> formats, Format format, Map<String, String> crosswalk) {
        this.tag = tag;
        this.filename = filename;
        this.formats = formats;
        this.format = format;
        this.crosswalk = crosswalk;
    }

    public String tag() {
        return tag;
    }

    /**
     * File name this variant is detected by, null for extrinsic variants. A leading
     * {@code *} makes it a suffix pattern ({@code *.nuspec}).
     */
    public String filename() {
        return filename;
    }

    public boolean isPattern() {
        return filename != null && filename.startsWith("*");
    }

    public boolean matches(String name) {
        if (filename == null || name == null) return false;
        return isPattern() ? name.length() > filename.length() - 1 && name.endsWith(filename.substring(1)) : filename.equals(name);
    }

    /** root element an XML source must have */
    public String xmlRoot() {
        return switch (this) {
            case NUGET -> "package";
            case SWORD_CODEMETA -> "entry";
            default -> "project";
        };
    }

    public List<String> declaredFormats() {
        return formats;
    }

    public Format format() {
        return format;
    }

    public boolean isIntrinsic() {
        return filename != null;
    }

    /** normalized term for a source key, or null when the key is not part of the crosswalk */
    public String termFor(String sourceKey) {
        return crosswalk.get(sourceKey);
    }

    public Map<String, String> crosswalk() {
        return crosswalk;
    }

    public static Ecosystem byTag(String tag) {
        for (Ecosystem e : values()) if (e.tag.equals(tag)) return e;
        throw new UnsupportedFormatException("unknown metadata mapping: " + tag);
    }

    public static Ecosystem byDeclaredFormat(String format) {
        for (Ecosystem e : values()) if (e.formats.contains(format)) return e;
        throw new UnsupportedFormatException("unsupported extrinsic metadata format: " + format);
    }

    public static List<Ecosystem> intrinsic() {
        List<Ecosystem> out = new ArrayList<>();
        for (Ecosystem e : values()) if (e.isIntrinsic()) out.add(e);
        return out;
    }

    public static List<Ecosystem> extrinsic() {
        List<Ecosystem> out = new ArrayList<>();
        for (Ecosystem e : values()) if (!e.isIntrinsic()) out.add(e);
        return out;
    }

    private static Map<String, String> crosswalk(String... pairs) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) m.put(pairs[i], pairs[i + 1]);
        return Collections.unmodifiableMap(m);
    }

    // every term under each of the given key prefixes
    private static Map<String, String> identity(String... prefixes) {
        Map<String, String> m = new LinkedHashMap<>();
        for (String p : prefixes) for (String t : TermNormalizers.TERMS) m.put(p + t, t);
        return Collections.unmodifiableMap(m);
    }
}
