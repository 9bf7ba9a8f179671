package com.example.metaindex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates the raw bytes of one metadata file into a normalized document.
 * <p>
 * The source is parsed according to the variant's format into a tree, then every top-level
 * key found in the variant's crosswalk is normalized into its term. The result only carries
 * terms the source provided; an empty document means the file held nothing usable.
 */
@Component
public class ContentMetadataTranslator {

    static final String CODEMETA_NS = "https://doi.org/10.5063/schema/codemeta-2.0";
    static final String SCHEMA_NS = "http://schema.org/";
    static final String ATOM_NS = "http://www.w3.org/2005/Atom";

    private static final Pattern GEM_SPEC_NEW = Pattern.compile(".*Gem::Specification\\.new +(do|\\{) +\\|.*\\|.*");
    private static final Pattern GEM_SPEC_ENTRY = Pattern.compile("\\s*\\w+\\.(?<key>\\w+)\\s*=\\s*(?<expr>.*)");
    private static final Pattern RUBY_STRING = Pattern.compile("^(?:'([^']*)'|\"([^\"]*)\")$");

    private final ObjectMapper json = CanonicalJson.mapper();
    private final ObjectMapper yaml = new YAMLMapper();

    public ObjectNode translate(byte[] raw, Ecosystem ecosystem) {
        if (raw == null || raw.length == 0) {
            throw new MetadataParseException(ecosystem.tag() + ": empty file");
        }
        JsonNode source = unwrap(parse(raw, ecosystem), ecosystem);
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String term = ecosystem.termFor(field.getKey());
            if (term != null) TermNormalizers.apply(ecosystem, term, field.getValue(), out);
        }
        TermNormalizers.finish(ecosystem, source, out);
        return out;
    }

    private JsonNode parse(byte[] raw, Ecosystem ecosystem) {
        JsonNode root = switch (ecosystem.format()) {
            case JSON -> readTree(json, raw, ecosystem);
            case YAML -> readTree(yaml, raw, ecosystem);
            case XML -> parseXml(raw, ecosystem);
            case PKG_INFO -> parsePkgInfo(decodeUtf8(raw, ecosystem));
            case GEMSPEC -> parseGemspec(decodeUtf8(raw, ecosystem), ecosystem);
        };
        if (root == null || !root.isObject()) {
            throw new MetadataParseException(ecosystem.tag() + ": top-level value is not a mapping");
        }
        return root;
    }

    // the part of the parsed document that holds the metadata
    private static JsonNode unwrap(JsonNode root, Ecosystem ecosystem) {
        switch (ecosystem) {
            case NUGET: {
                JsonNode metadata = root.get("metadata");
                return metadata != null && metadata.isObject() ? metadata : JsonNodeFactory.instance.objectNode();
            }
            case CFF: {
                // https://github.com/citation-file-format/citation-file-format/blob/main/schema-guide.md#credit-redirection
                JsonNode preferred = root.get("preferred-citation");
                return preferred != null && preferred.isObject() ? preferred : root;
            }
            default:
                return root;
        }
    }

    private static JsonNode readTree(ObjectMapper mapper, byte[] raw, Ecosystem ecosystem) {
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            throw new MetadataParseException(ecosystem.tag() + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode parseXml(byte[] raw, Ecosystem ecosystem) {
        Document doc;
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setExpandEntityReferences(false);
            DocumentBuilder b = f.newDocumentBuilder();
            b.setErrorHandler(new DefaultHandler());
            doc = b.parse(new ByteArrayInputStream(raw));
        } catch (SAXException | IOException e) {
            throw new MetadataParseException(ecosystem.tag() + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
        Element root = doc.getDocumentElement();
        String expected = ecosystem.xmlRoot();
        if (!expected.equals(localName(root))) {
            throw new MetadataParseException(ecosystem.tag() + ": root element is <" + localName(root) + ">, expected <" + expected + ">");
        }
        return ecosystem == Ecosystem.SWORD_CODEMETA ? swordEntry(root) : xmlToTree(root);
    }

    /**
     * Child elements become fields and repeated names become arrays. Attributes become
     * {@code @name} fields, in which case the element's own text is kept under {@code #text};
     * a leaf element without attributes becomes its text.
     */
    private static JsonNode xmlToTree(Element element) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node a = attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(a.getNamespaceURI())) continue;
            obj.put("@" + localName(a), a.getNodeValue().trim());
        }
        boolean hasAttributes = obj.size() > 0;
        NodeList children = element.getChildNodes();
        boolean hasElements = false;
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            hasElements = true;
            addField(obj, localName(n), xmlToTree((Element) n));
        }
        if (hasElements) return obj;
        String text = element.getTextContent().trim();
        if (!hasAttributes) return JsonNodeFactory.instance.textNode(text);
        if (!text.isEmpty()) obj.put("#text", text);
        return obj;
    }

    // SWORD deposits: CodeMeta or schema.org elements in an Atom entry, plus Atom authors
    private static JsonNode swordEntry(Element entry) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        NodeList children = entry.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            String ns = n.getNamespaceURI();
            String name = localName(n);
            if (CODEMETA_NS.equals(ns) || SCHEMA_NS.equals(ns) || (ATOM_NS.equals(ns) && "author".equals(name))) {
                addField(obj, name, xmlToTree((Element) n));
            }
        }
        return obj;
    }

    private static void addField(ObjectNode obj, String name, JsonNode value) {
        JsonNode existing = obj.get(name);
        if (existing == null) {
            obj.set(name, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            ArrayNode arr = obj.arrayNode();
            arr.add(existing);
            arr.add(value);
            obj.set(name, arr);
        }
    }

    /**
     * Reads the {@code spec.key = value} assignments following {@code Gem::Specification.new}.
     * Only string literals and lists of string literals are understood, any other value is
     * skipped; the gemspec is never evaluated.
     */
    static ObjectNode parseGemspec(String text, Ecosystem ecosystem) {
        String[] lines = text.split("\r?\n");
        int start = 0;
        while (start < lines.length && !GEM_SPEC_NEW.matcher(lines[start]).matches()) start++;
        if (start == lines.length) {
            throw new MetadataParseException(ecosystem.tag() + ": no Gem::Specification found");
        }
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (int i = start + 1; i < lines.length; i++) {
            Matcher m = GEM_SPEC_ENTRY.matcher(lines[i]);
            if (!m.matches()) continue;
            JsonNode value = rubyLiteral(m.group("expr"));
            if (value != null) out.set(m.group("key"), value);
        }
        return out;
    }

    static JsonNode rubyLiteral(String expr) {
        String e = expr.replace(".freeze", "").trim();
        String s = rubyString(e);
        if (s != null) return s.isEmpty() ? null : JsonNodeFactory.instance.textNode(s);
        if (e.length() < 2 || e.charAt(0) != '[' || e.charAt(e.length() - 1) != ']') return null;
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        String body = e.substring(1, e.length() - 1).trim();
        if (body.isEmpty()) return null;
        for (String element : body.split(",")) {
            String v = rubyString(element.trim());
            if (v == null || v.isEmpty()) return null;
            arr.add(v);
        }
        return arr;
    }

    private static String rubyString(String e) {
        Matcher m = RUBY_STRING.matcher(e);
        if (!m.matches()) return null;
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    private static String localName(Node n) {
        return n.getLocalName() != null ? n.getLocalName() : n.getNodeName();
    }

    /**
     * PKG-INFO is an RFC 822 header block: {@code Key: value} lines, continuation lines start
     * with whitespace, and the first blank line ends the headers. Keys are lower-cased;
     * repeated keys collect into arrays and {@code UNKNOWN} values are dropped.
     */
    static ObjectNode parsePkgInfo(String text) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        String key = null;
        StringBuilder value = new StringBuilder();
        for (String line : text.split("\r?\n", -1)) {
            if (line.isEmpty()) break;
            if (Character.isWhitespace(line.charAt(0)) && key != null) {
                String cont = line.strip();
                // description continuation lines are prefixed with "|" by setuptools
                if (cont.startsWith("|")) cont = cont.substring(1).strip();
                value.append('\n').append(cont);
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            addPkgInfoField(out, key, value);
            key = line.substring(0, colon).trim().toLowerCase();
            value.setLength(0);
            value.append(line.substring(colon + 1).trim());
        }
        addPkgInfoField(out, key, value);
        return out;
    }

    private static void addPkgInfoField(ObjectNode out, String key, StringBuilder value) {
        if (key == null) return;
        String v = value.toString().trim();
        if (v.isEmpty() || "UNKNOWN".equals(v)) return;
        JsonNode existing = out.get(key);
        if (existing == null) {
            out.put(key, v);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(v);
        } else {
            ArrayNode arr = out.arrayNode();
            arr.add(existing);
            arr.add(v);
            out.set(key, arr);
        }
    }

    private static String decodeUtf8(byte[] raw, Ecosystem ecosystem) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MetadataParseException(ecosystem.tag() + ": not valid UTF-8", e);
        }
    }
}
