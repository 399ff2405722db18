package com.codeguard.core.analyzer.base;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for analyzers that read structured manifests (JSON, XML, TOML) with
 * Jackson.
 *
 * <p>This class provides:
 * <ul>
 *   <li>JSON parsing via ObjectMapper</li>
 *   <li>XML parsing via XmlMapper</li>
 *   <li>TOML parsing via TomlMapper</li>
 *   <li>JsonNode navigation helpers</li>
 * </ul>
 *
 * <p>All mappers are thread-safe once configured and shared by all tasks of the analyzer.
 *
 * @see AbstractAnalyzer
 * @since 1.0.0
 */
public abstract class AbstractJacksonAnalyzer extends AbstractAnalyzer {

    protected final ObjectMapper objectMapper;
    protected final XmlMapper xmlMapper;
    protected final TomlMapper tomlMapper;

    protected AbstractJacksonAnalyzer() {
        super();
        this.objectMapper = new ObjectMapper();
        this.xmlMapper = new XmlMapper();
        this.tomlMapper = new TomlMapper();
    }

    // ==================== Parsing ====================

    protected JsonNode parseJsonContent(String content) throws IOException {
        return objectMapper.readTree(content);
    }

    protected JsonNode parseXmlContent(String content) throws IOException {
        return xmlMapper.readTree(content);
    }

    protected JsonNode parseTomlContent(String content) throws IOException {
        return tomlMapper.readTree(content);
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts a text attribute.
     *
     * @param node node to read from (nullable)
     * @param attributeName field name
     * @return text value, or null if absent
     */
    protected String extractAttribute(JsonNode node, String attributeName) {
        if (node == null) {
            return null;
        }
        JsonNode attrNode = node.get(attributeName);
        if (attrNode == null || attrNode.isNull()) {
            return null;
        }
        return attrNode.asText();
    }

    /**
     * Returns the children of a node that may be either a single object or an array.
     *
     * <p>XmlMapper maps one repeated element to an object and several to an array.
     *
     * @param node node (nullable)
     * @return child nodes, empty if absent
     */
    protected List<JsonNode> asList(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return result;
        }
        if (node.isArray()) {
            node.forEach(result::add);
        } else {
            result.add(node);
        }
        return result;
    }

    /**
     * Finds the first line containing a token.
     *
     * @param lines file lines
     * @param token text to search for
     * @return 1-based line number, or null if not found
     */
    protected static Integer findLine(List<String> lines, String token) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(token)) {
                return i + 1;
            }
        }
        return null;
    }
}
