package com.specguard.core.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IrJsonCodec: reads and writes the snake_case JSON form of an IR.
 *
 * CANONICAL SHAPE:
 * {
 *   "intent":     { "summary": "...", "rationale": "...", "holes": [ ... ] },
 *   "signature":  { "name": "...", "parameters": [ { "name", "type_hint", "description" } ],
 *                   "returns": "int", "holes": [ ... ] },
 *   "effects":    [ { "description": "...", "holes": [ ... ] } ],
 *   "assertions": [ { "predicate": "...", "rationale": "...", "holes": [ ... ] } ],
 *   "metadata":   { "origin", "source_path", "language", "evidence": [ ... ] }
 * }
 *
 * Absent arrays decode to empty lists. Absent intent/signature objects, or a missing
 * summary/name, are rejected with IrParseException.
 */
@Component
public class IrJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(IrJsonCodec.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();

    // =========================================================================
    // Decoding
    // =========================================================================

    public IntermediateRepresentation fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IrParseException("IR document is empty");
        }

        JsonNode root;
        try {
            root = jsonMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IrParseException("IR document is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new IrParseException("IR document must be a JSON object");
        }

        IntermediateRepresentation ir = fromTree(root);
        log.debug("[IrJsonCodec] Decoded {}", ir);
        return ir;
    }

    public IntermediateRepresentation fromTree(JsonNode root) {
        JsonNode intentNode    = requireObject(root, "intent");
        JsonNode signatureNode = requireObject(root, "signature");

        try {
            IntentClause intent = new IntentClause(
                    requireText(intentNode, "summary", "intent"),
                    textOrNull(intentNode, "rationale"),
                    parseHoles(intentNode.get("holes"))
            );

            List<Parameter> parameters = new ArrayList<>();
            for (JsonNode paramNode : arrayOrEmpty(signatureNode.get("parameters"))) {
                parameters.add(new Parameter(
                        requireText(paramNode, "name", "parameter"),
                        textOrNull(paramNode, "type_hint"),
                        textOrNull(paramNode, "description")
                ));
            }

            SigClause signature = new SigClause(
                    requireText(signatureNode, "name", "signature"),
                    parameters,
                    textOrNull(signatureNode, "returns"),
                    parseHoles(signatureNode.get("holes"))
            );

            List<EffectClause> effects = new ArrayList<>();
            for (JsonNode effectNode : arrayOrEmpty(root.get("effects"))) {
                effects.add(new EffectClause(
                        textOrNull(effectNode, "description"),
                        parseHoles(effectNode.get("holes"))
                ));
            }

            List<AssertClause> assertions = new ArrayList<>();
            for (JsonNode assertNode : arrayOrEmpty(root.get("assertions"))) {
                assertions.add(new AssertClause(
                        textOrNull(assertNode, "predicate"),
                        textOrNull(assertNode, "rationale"),
                        parseHoles(assertNode.get("holes"))
                ));
            }

            return new IntermediateRepresentation(
                    intent, signature, effects, assertions, parseMetadata(root.get("metadata")));

        } catch (IllegalArgumentException e) {
            // Model constructors reject duplicate parameters, unknown hole kinds, etc.
            throw new IrParseException("Invalid IR: " + e.getMessage(), e);
        }
    }

    private List<TypedHole> parseHoles(JsonNode holesNode) {
        List<TypedHole> holes = new ArrayList<>();
        for (JsonNode holeNode : arrayOrEmpty(holesNode)) {
            Map<String, String> constraints = new LinkedHashMap<>();
            JsonNode constraintsNode = holeNode.get("constraints");
            if (constraintsNode != null && constraintsNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = constraintsNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    constraints.put(field.getKey(), field.getValue().asText());
                }
            }
            holes.add(new TypedHole(
                    requireText(holeNode, "identifier", "hole"),
                    textOrNull(holeNode, "type_hint"),
                    textOrNull(holeNode, "description"),
                    constraints,
                    HoleKind.fromCode(textOrNull(holeNode, "kind"))
            ));
        }
        return holes;
    }

    private Metadata parseMetadata(JsonNode metadataNode) {
        if (metadataNode == null || !metadataNode.isObject()) {
            return Metadata.empty();
        }
        List<String> evidence = new ArrayList<>();
        for (JsonNode item : arrayOrEmpty(metadataNode.get("evidence"))) {
            evidence.add(item.isTextual() ? item.asText() : item.toString());
        }
        return new Metadata(
                textOrNull(metadataNode, "origin"),
                textOrNull(metadataNode, "source_path"),
                textOrNull(metadataNode, "language"),
                evidence
        );
    }

    // =========================================================================
    // Encoding
    // =========================================================================

    public String toJson(IntermediateRepresentation ir) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(ir));
        } catch (JsonProcessingException e) {
            throw new IrParseException("Failed to encode IR " + ir.getSignature().getName(), e);
        }
    }

    public ObjectNode toTree(IntermediateRepresentation ir) {
        ObjectNode root = jsonMapper.createObjectNode();

        ObjectNode intent = root.putObject("intent");
        intent.put("summary", ir.getIntent().getSummary());
        intent.put("rationale", ir.getIntent().getRationale());
        writeHoles(intent.putArray("holes"), ir.getIntent().getHoles());

        ObjectNode signature = root.putObject("signature");
        signature.put("name", ir.getSignature().getName());
        ArrayNode params = signature.putArray("parameters");
        for (Parameter p : ir.getSignature().getParameters()) {
            ObjectNode paramNode = params.addObject();
            paramNode.put("name", p.getName());
            paramNode.put("type_hint", p.getTypeHint());
            paramNode.put("description", p.getDescription());
        }
        signature.put("returns", ir.getSignature().getReturns());
        writeHoles(signature.putArray("holes"), ir.getSignature().getHoles());

        ArrayNode effects = root.putArray("effects");
        for (EffectClause effect : ir.getEffects()) {
            ObjectNode effectNode = effects.addObject();
            effectNode.put("description", effect.getDescription());
            writeHoles(effectNode.putArray("holes"), effect.getHoles());
        }

        ArrayNode assertions = root.putArray("assertions");
        for (AssertClause assertion : ir.getAssertions()) {
            ObjectNode assertNode = assertions.addObject();
            assertNode.put("predicate", assertion.getPredicate());
            assertNode.put("rationale", assertion.getRationale());
            writeHoles(assertNode.putArray("holes"), assertion.getHoles());
        }

        Metadata metadata = ir.getMetadata();
        ObjectNode metadataNode = root.putObject("metadata");
        metadataNode.put("origin", metadata.getOrigin());
        metadataNode.put("source_path", metadata.getSourcePath());
        metadataNode.put("language", metadata.getLanguage());
        ArrayNode evidence = metadataNode.putArray("evidence");
        metadata.getEvidence().forEach(evidence::add);

        return root;
    }

    private void writeHoles(ArrayNode target, List<TypedHole> holes) {
        for (TypedHole hole : holes) {
            ObjectNode holeNode = target.addObject();
            holeNode.put("identifier", hole.getIdentifier());
            holeNode.put("type_hint", hole.getTypeHint());
            holeNode.put("description", hole.getDescription());
            ObjectNode constraints = holeNode.putObject("constraints");
            hole.getConstraints().forEach(constraints::put);
            holeNode.put("kind", hole.getKind().code());
        }
    }

    // =========================================================================
    // Tree helpers
    // =========================================================================

    private JsonNode requireObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new IrParseException("IR is missing required object '" + field + "'");
        }
        return node;
    }

    private String requireText(JsonNode json, String field, String owner) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            throw new IrParseException("Missing required field '" + field + "' in " + owner);
        }
        return node.asText();
    }

    private String textOrNull(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) return null;
        return node.asText();
    }

    private Iterable<JsonNode> arrayOrEmpty(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        return node;
    }
}
