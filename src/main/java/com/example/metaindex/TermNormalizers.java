package com.example.metaindex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Value normalization for translated metadata. Every value that reaches a translated
 * document goes through {@link #apply}; values a normalizer cannot make sense of are dropped
 * rather than failing the whole file.
 * <p>
 * Multi-valued terms accumulate duplicate-free values: a single value is kept as a string,
 * several as an array. Every other term keeps the first value seen.
 */
final class TermNormalizers {

    static final List<String> TERMS = List.of(
            "name", "version", "description", "author", "email", "license", "keywords", "url",
            "codeRepository", "issueTracker", "identifier", "softwareRequirements",
            "programmingLanguage", "dateCreated", "dateModified", "datePublished");

    static final Set<String> MULTI_VALUED = Set.of("author", "email", "license", "keywords", "softwareRequirements");

    static final String SPDX = "https://spdx.org/licenses/";
    static final String MAVEN_CENTRAL = "https://repo.maven.apache.org/maven2/";
    static final String DOI = "https://doi.org/";

    private static final Pattern PERSON = Pattern.compile(
            "^\\s*(?<name>.*?)(\\s*<(?<email>[^>]*)>)?(\\s*\\((?<url>[^)]*)\\))?\\s*$");
    private static final Pattern SPDX_ID = Pattern.compile("[A-Za-z0-9.+-]+");
    private static final Pattern COMPOUND_EXPRESSION = Pattern.compile(" with |\\(|\\)| and ", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR = Pattern.compile(" or ", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> REPOSITORY_SHORTCUTS = Map.of(
            "github", "git+https://github.com/%s.git",
            "gist", "git+https://gist.github.com/%s.git",
            "gitlab", "git+https://gitlab.com/%s.git");

    private TermNormalizers() {}

    static void apply(Ecosystem eco, String term, JsonNode value, ObjectNode out) {
        if (value == null || value.isNull() || value.isMissingNode()) return;
        switch (term) {
            case "author" -> people(eco, value, out);
            case "license" -> license(eco, value, out);
            case "codeRepository" -> codeRepository(eco, value, out);
            case "issueTracker" -> issueTracker(value, out);
            case "softwareRequirements" -> requirements(eco, value, out);
            case "keywords" -> keywords(eco, value, out);
            case "identifier" -> identifier(eco, value, out);
            default -> scalars(value, term, out);
        }
    }

    /** terms derived from the whole source document rather than from one key */
    static void finish(Ecosystem eco, JsonNode source, ObjectNode out) {
        if (eco == Ecosystem.MAVEN) {
            mavenRepositories(source, out);
        } else if (eco == Ecosystem.GITHUB) {
            if (source.path("has_issues").asBoolean(false) && source.path("html_url").isTextual()) {
                put(out, "issueTracker", source.get("html_url").asText() + "/issues");
            }
        }
    }

    static void put(ObjectNode out, String term, String value) {
        if (value == null) return;
        String v = value.trim();
        if (v.isEmpty()) return;
        JsonNode existing = out.get(term);
        if (existing == null) {
            out.put(term, v);
            return;
        }
        if (!MULTI_VALUED.contains(term)) return;
        if (existing.isArray()) {
            for (JsonNode n : existing) if (n.asText().equals(v)) return;
            ((ArrayNode) existing).add(v);
        } else if (!existing.asText().equals(v)) {
            ArrayNode arr = out.arrayNode();
            arr.add(existing);
            arr.add(v);
            out.set(term, arr);
        }
    }

    private static void scalars(JsonNode value, String term, ObjectNode out) {
        if (value.isValueNode()) {
            put(out, term, value.asText());
        } else if (value.isArray()) {
            for (JsonNode n : value) if (n.isValueNode()) put(out, term, n.asText());
        }
    }

    // npm "Name <email> (url)", {name, email, url}, codemeta persons, maven developers
    private static void people(Ecosystem eco, JsonNode value, ObjectNode out) {
        JsonNode v = eco == Ecosystem.MAVEN ? xmlList(value, "developer") : value;
        if (eco == Ecosystem.NUGET && v.isTextual()) {
            // <authors>Kim Abercrombie, Franck Halmaert</authors>
            for (String name : v.asText().split(",")) put(out, "author", name);
            return;
        }
        if (v.isArray()) {
            for (JsonNode n : v) person(n, out);
        } else {
            person(v, out);
        }
    }

    private static void person(JsonNode p, ObjectNode out) {
        if (p.isTextual()) {
            Matcher m = PERSON.matcher(p.asText());
            if (!m.matches()) return;
            put(out, "author", m.group("name"));
            put(out, "email", m.group("email"));
        } else if (p.isObject()) {
            String name = text(p, "name");
            if (name == null) {
                String given = firstText(p, "givenName", "given-names");
                String family = firstText(p, "familyName", "family-names");
                if (given != null || family != null) {
                    name = ((given == null ? "" : given) + " " + (family == null ? "" : family)).trim();
                }
            }
            put(out, "author", name);
            put(out, "email", text(p, "email"));
        }
    }

    private static void license(Ecosystem eco, JsonNode value, ObjectNode out) {
        switch (eco) {
            case MAVEN -> {
                JsonNode list = xmlList(value, "license");
                for (JsonNode l : each(list)) {
                    String url = text(l, "url");
                    put(out, "license", url != null ? url : text(l, "name"));
                }
            }
            case GITHUB -> {
                String id = text(value, "spdx_id");
                if (id != null && !"NOASSERTION".equals(id)) put(out, "license", SPDX + id);
            }
            case NUGET -> {
                for (JsonNode l : each(value)) {
                    if (l.isTextual()) put(out, "license", l.asText());
                    else if (l.isObject() && "expression".equals(text(l, "@type"))) nugetExpression(text(l, "#text"), out);
                }
            }
            case NPM, COMPOSER, PUBSPEC, CFF, GEMSPEC -> {
                for (JsonNode l : each(value)) {
                    if (l.isTextual()) put(out, "license", spdx(l.asText()));
                    else if (l.isObject()) put(out, "license", spdx(text(l, "type")));
                }
            }
            default -> scalars(value, "license", out);
        }
    }

    /**
     * {@code MIT or Apache-2.0} yields one SPDX url per alternative. Expressions with
     * {@code and}, {@code with} or parentheses are not split and are dropped.
     */
    private static void nugetExpression(String expression, ObjectNode out) {
        if (expression == null || COMPOUND_EXPRESSION.matcher(expression).find()) return;
        for (String l : OR.split(expression)) put(out, "license", spdx(l));
    }

    static String spdx(String license) {
        if (license == null) return null;
        String l = license.trim();
        return SPDX_ID.matcher(l).matches() ? SPDX + l : l;
    }

    private static void codeRepository(Ecosystem eco, JsonNode value, ObjectNode out) {
        if (eco == Ecosystem.NPM) {
            put(out, "codeRepository", npmRepository(value));
        } else if (value.isObject()) {
            // nuspec <repository type="git" url="..."/> carries the url as an attribute
            put(out, "codeRepository", firstText(value, "url", "@url"));
        } else {
            scalars(value, "codeRepository", out);
        }
    }

    /**
     * Expands the package.json repository field: {@code {type, url}} objects, full urls and
     * the {@code github:}, {@code gist:}, {@code gitlab:} and bare {@code user/repo} shortcuts.
     */
    static String npmRepository(JsonNode d) {
        if (d.isObject()) {
            String type = text(d, "type");
            String url = text(d, "url");
            return type != null && url != null ? type + "+" + url : null;
        }
        if (!d.isTextual()) return null;
        String s = d.asText().trim();
        if (s.contains("://")) return s;
        int colon = s.indexOf(':');
        if (colon >= 0) {
            String pattern = REPOSITORY_SHORTCUTS.get(s.substring(0, colon));
            return pattern == null ? null : String.format(pattern, s.substring(colon + 1));
        }
        return String.format(REPOSITORY_SHORTCUTS.get("github"), s);
    }

    private static void issueTracker(JsonNode value, ObjectNode out) {
        if (value.isTextual()) {
            put(out, "issueTracker", value.asText());
        } else if (value.isObject()) {
            // npm bugs {url}, maven issueManagement {url}, composer support {issues}
            String url = text(value, "url");
            put(out, "issueTracker", url != null ? url : text(value, "issues"));
        }
    }

    private static void identifier(Ecosystem eco, JsonNode value, ObjectNode out) {
        if (eco == Ecosystem.CFF && value.isValueNode()) {
            String doi = value.asText().trim();
            put(out, "identifier", doi.isEmpty() || doi.startsWith(DOI) ? doi : DOI + doi);
        } else {
            scalars(value, "identifier", out);
        }
    }

    private static void requirements(Ecosystem eco, JsonNode value, ObjectNode out) {
        if (eco == Ecosystem.NUGET) {
            nugetDependencies(value, out);
        } else if (eco == Ecosystem.MAVEN) {
            JsonNode list = xmlList(value, "dependency");
            for (JsonNode d : each(list)) {
                String g = text(d, "groupId");
                String a = text(d, "artifactId");
                if (g == null || a == null) continue;
                String v = text(d, "version");
                put(out, "softwareRequirements", g + ":" + a + (v == null ? "" : ":" + v));
            }
        } else if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String version = e.getValue().isValueNode() ? e.getValue().asText().trim() : "";
                put(out, "softwareRequirements", version.isEmpty() ? e.getKey() : e.getKey() + " " + version);
            }
        } else {
            scalars(value, "softwareRequirements", out);
        }
    }

    // <dependencies> holds <dependency id version/> directly or inside per-framework <group>s
    private static void nugetDependencies(JsonNode node, ObjectNode out) {
        if (node.isArray()) {
            for (JsonNode n : node) nugetDependencies(n, out);
        } else if (node.isObject()) {
            String id = text(node, "@id");
            if (id != null) {
                String version = text(node, "@version");
                put(out, "softwareRequirements", version == null ? id : id + " " + version);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) nugetDependencies(it.next().getValue(), out);
        }
    }

    private static void keywords(Ecosystem eco, JsonNode value, ObjectNode out) {
        // PKG-INFO separates keywords with spaces or commas, nuspec tags with spaces, other formats with commas
        String separators = switch (eco) {
            case PKG_INFO -> "[,\\s]+";
            case NUGET -> "\\s+";
            default -> ",";
        };
        for (JsonNode k : each(value)) {
            if (!k.isValueNode()) continue;
            for (String s : k.asText().split(separators)) put(out, "keywords", s);
        }
    }

    // https://maven.apache.org/pom.html#Repositories
    private static void mavenRepositories(JsonNode project, ObjectNode out) {
        String groupId = text(project, "groupId");
        String artifactId = text(project, "artifactId");
        if (groupId == null || artifactId == null) return;
        JsonNode repositories = project.get("repositories");
        List<String> urls = new ArrayList<>();
        if (repositories == null) {
            urls.add(MAVEN_CENTRAL);
        } else {
            JsonNode list = xmlList(repositories, "repository");
            for (JsonNode r : each(list)) {
                String layout = text(r, "layout");
                if (layout != null && !"default".equals(layout)) continue;
                String url = text(r, "url");
                if (url != null) urls.add(url);
            }
        }
        for (String url : urls) {
            String base = url.endsWith("/") ? url : url + "/";
            put(out, "codeRepository", base + groupId.replace('.', '/') + "/" + artifactId);
        }
    }

    // <licenses><license>..</license></licenses> reads as {"license": {..}} or {"license": [..]}
    private static JsonNode xmlList(JsonNode container, String child) {
        if (container.isObject() && container.has(child)) return container.get(child);
        return container;
    }

    private static Iterable<JsonNode> each(JsonNode v) {
        return v.isArray() ? v : List.of(v);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            String v = text(node, f);
            if (v != null) return v;
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isValueNode() || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
