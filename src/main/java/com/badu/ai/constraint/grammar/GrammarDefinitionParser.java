package com.badu.ai.constraint.grammar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses grammar definitions written as JSON into {@link GrammarSpec}s.
 *
 * <p><b>File Structure:</b>
 * <pre>{@code
 * {
 *   "name": "numbers",
 *   "root": "list",
 *   "rules": {
 *     "list":   {"nest": {"open": "[", "body": {"optional": {"ref": "items"}}, "close": "]"}},
 *     "items":  {"seq": [{"ref": "number"}, {"repeat": {"seq": [",", {"ref": "number"}]}, "min": 0}]},
 *     "number": {"repeat": {"chars": "0-9"}, "min": 1}
 *   }
 * }
 * }</pre>
 *
 * <p>Expression forms:
 * <ul>
 *   <li>a bare string, or {@code {"literal": "..."}}</li>
 *   <li>{@code {"chars": "a-z_"}}: character class (leading {@code ^} negates)</li>
 *   <li>{@code {"seq": [...]}} and {@code {"choice": [...]}}</li>
 *   <li>{@code {"repeat": expr, "min": 0, "max": 3}}: {@code max} omitted means unbounded</li>
 *   <li>{@code {"optional": expr}}</li>
 *   <li>{@code {"ref": "rule"}}</li>
 *   <li>{@code {"nest": {"open": "{", "body": expr, "close": "}"}}}</li>
 * </ul>
 * {@code "root"} defaults to the first rule.
 *
 * @see GrammarCompiler
 */
public class GrammarDefinitionParser {
    private static final Logger logger = LoggerFactory.getLogger(GrammarDefinitionParser.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a grammar definition file.
     *
     * @param path path to the JSON definition
     * @return grammar specification
     * @throws IOException if the file cannot be read
     * @throws CompileException if the definition is malformed
     */
    public GrammarSpec parse(Path path) throws IOException, CompileException {
        if (!Files.exists(path)) {
            throw new IOException("Grammar definition does not exist: " + path);
        }
        GrammarSpec spec = parse(Files.readString(path), path.getFileName().toString());
        logger.debug("Parsed grammar '{}' from: {}", spec.getName(), path);
        return spec;
    }

    /**
     * Parses a grammar definition from a stream (e.g. a classpath resource).
     */
    public GrammarSpec parse(InputStream in, String sourceName) throws IOException, CompileException {
        return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), sourceName);
    }

    /**
     * Parses a grammar definition from JSON text.
     *
     * @param json definition text
     * @param sourceName name used in error messages when the definition has no name
     * @return grammar specification
     * @throws CompileException if the JSON is invalid or an expression is malformed
     */
    public GrammarSpec parse(String json, String sourceName) throws CompileException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CompileException(sourceName, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CompileException(sourceName, null, "definition must be a JSON object");
        }

        String name = root.path("name").asText(sourceName);
        JsonNode rules = root.path("rules");
        if (!rules.isObject() || rules.size() == 0) {
            throw new CompileException(name, null, "definition needs a non-empty \"rules\" object");
        }

        GrammarSpec.Builder builder = GrammarSpec.builder(name);
        Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> rule = fields.next();
            builder.rule(rule.getKey(), parseExpr(name, rule.getKey(), rule.getValue()));
        }
        if (root.hasNonNull("root")) {
            builder.root(root.get("root").asText());
        }
        return builder.build();
    }

    private GrammarExpr parseExpr(String grammar, String rule, JsonNode node) throws CompileException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new CompileException(grammar, rule, "missing expression");
        }
        if (node.isTextual()) {
            return GrammarExpr.literal(node.asText());
        }
        if (!node.isObject()) {
            throw new CompileException(grammar, rule, "expression must be a string or an object, got: " + node);
        }

        if (node.has("literal")) {
            return GrammarExpr.literal(text(grammar, rule, node, "literal"));
        }
        if (node.has("chars")) {
            String spec = text(grammar, rule, node, "chars");
            try {
                return GrammarExpr.chars(spec);
            } catch (IllegalArgumentException e) {
                throw new CompileException(grammar, rule, e.getMessage());
            }
        }
        if (node.has("seq")) {
            return GrammarExpr.seq(parseList(grammar, rule, node.get("seq")));
        }
        if (node.has("choice")) {
            return GrammarExpr.choice(parseList(grammar, rule, node.get("choice")));
        }
        if (node.has("repeat")) {
            GrammarExpr body = parseExpr(grammar, rule, node.get("repeat"));
            int min = node.path("min").asInt(0);
            int max = node.hasNonNull("max") ? node.get("max").asInt() : GrammarExpr.UNBOUNDED;
            return GrammarExpr.repeat(body, min, max);
        }
        if (node.has("optional")) {
            return GrammarExpr.optional(parseExpr(grammar, rule, node.get("optional")));
        }
        if (node.has("ref")) {
            return GrammarExpr.ref(text(grammar, rule, node, "ref"));
        }
        if (node.has("nest")) {
            JsonNode nest = node.get("nest");
            return GrammarExpr.nest(text(grammar, rule, nest, "open"),
                parseExpr(grammar, rule, nest.get("body")),
                text(grammar, rule, nest, "close"));
        }
        throw new CompileException(grammar, rule, "unknown expression: " + node);
    }

    private GrammarExpr[] parseList(String grammar, String rule, JsonNode array) throws CompileException {
        if (!array.isArray()) {
            throw new CompileException(grammar, rule, "expected an array, got: " + array);
        }
        List<GrammarExpr> parts = new ArrayList<>();
        for (JsonNode element : array) {
            parts.add(parseExpr(grammar, rule, element));
        }
        return parts.toArray(new GrammarExpr[0]);
    }

    private String text(String grammar, String rule, JsonNode node, String field) throws CompileException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new CompileException(grammar, rule, "\"" + field + "\" must be a string");
        }
        return value.asText();
    }
}
