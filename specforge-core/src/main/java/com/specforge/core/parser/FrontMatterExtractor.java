package com.specforge.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.specforge.core.error.ParseFault;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a specification document into its YAML front matter and markdown body.
 *
 * <p>Two layouts are recognized:
 * <ul>
 *   <li>a {@code ---} delimited block at the very start of the document</li>
 *   <li>the same block immediately after a leading {@code # Title} line and a blank line</li>
 * </ul>
 *
 * <p>A document without front matter is not an error: {@link Extracted#fields()} is null.
 * Malformed YAML inside the delimiters is the one fatal parse condition.
 */
public final class FrontMatterExtractor {

    private static final Pattern LEADING = Pattern.compile(
        "\\A---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n|\\z)", Pattern.DOTALL);

    private static final Pattern AFTER_TITLE = Pattern.compile(
        "\\A(#[^\\n]*)\\n[ \\t]*\\n---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n|\\z)", Pattern.DOTALL);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Result of front-matter extraction.
     *
     * @param fields decoded front-matter fields, or null when the document has none
     * @param body remaining markdown body
     */
    public record Extracted(Map<String, Object> fields, String body) {
    }

    /**
     * Extracts front matter from a document with normalized ({@code \n}) line endings.
     *
     * @param content document text
     * @return extracted fields and body
     * @throws ParseFault if a delimited block is present but is not a valid YAML mapping
     */
    public Extracted extract(String content) {
        Matcher leading = LEADING.matcher(content);
        if (leading.find()) {
            return new Extracted(decode(leading.group(1)), content.substring(leading.end()));
        }

        Matcher afterTitle = AFTER_TITLE.matcher(content);
        if (afterTitle.find()) {
            String body = afterTitle.group(1) + "\n" + content.substring(afterTitle.end());
            return new Extracted(decode(afterTitle.group(2)), body);
        }

        return new Extracted(null, content);
    }

    private Map<String, Object> decode(String yaml) {
        if (yaml.isBlank()) {
            return null;
        }
        JsonNode node;
        try {
            node = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ParseFault("Malformed YAML front matter: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ParseFault("Front matter must be a key/value mapping, found " + node.getNodeType());
        }
        return yamlMapper.convertValue(node, MAP_TYPE);
    }
}
