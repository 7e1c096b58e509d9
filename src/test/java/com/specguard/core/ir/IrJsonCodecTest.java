package com.specguard.core.ir;

import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.specguard.IrFixtures;

import static org.junit.jupiter.api.Assertions.*;

class IrJsonCodecTest {

    private final IrJsonCodec codec = new IrJsonCodec();

    private static final String DOCUMENT = """
        {
          "intent": { "summary": "Count words in a sentence", "rationale": "word stats" },
          "signature": {
            "name": "count_words",
            "parameters": [ { "name": "text", "type_hint": "str", "description": "input sentence" } ],
            "returns": "int",
            "holes": [
              { "identifier": "sep", "type_hint": "str", "kind": "implementation",
                "constraints": { "default": "space" } }
            ]
          },
          "effects": [
            { "description": "Split text by spaces into words" },
            { "description": "Count the elements" },
            { "description": "Return the count" }
          ],
          "assertions": [ { "predicate": "result >= 0" } ],
          "metadata": { "origin": "reverse", "source_path": "src/words.py", "language": "python",
                        "evidence": [ "def count_words(text):" ] }
        }
        """;

    @Test
    void testDecodeFullDocument() {
        IntermediateRepresentation ir = codec.fromJson(DOCUMENT);

        assertEquals("Count words in a sentence", ir.getIntent().getSummary());
        assertEquals("count_words", ir.getSignature().getName());
        assertEquals("str", ir.getSignature().getParameters().get(0).getTypeHint());
        assertEquals("int", ir.getSignature().getReturns());
        assertEquals(3, ir.getEffects().size());
        assertEquals("result >= 0", ir.getAssertions().get(0).getPredicate());
        assertEquals("src/words.py", ir.getMetadata().getSourcePath());

        TypedHole hole = ir.getSignature().getHoles().get(0);
        assertEquals(HoleKind.IMPLEMENTATION, hole.getKind());
        assertEquals("space", hole.getConstraints().get("default"));
        assertEquals(1, ir.typedHoles().size());
    }

    @Test
    void testOptionalSectionsDefault() {
        IntermediateRepresentation ir = codec.fromJson("""
            { "intent": { "summary": "Log a message" }, "signature": { "name": "log_it" } }
            """);

        assertTrue(ir.getEffects().isEmpty());
        assertTrue(ir.getAssertions().isEmpty());
        assertFalse(ir.getSignature().declaresReturn());
        assertTrue(ir.getMetadata().getEvidence().isEmpty());
    }

    @Test
    void testEncodeUsesSnakeCaseKeys() {
        String json = codec.toJson(IrFixtures.ir()
                .named("double_it")
                .param("x", "int")
                .returns("int")
                .effects("Multiply x by 2", "Return the result")
                .build());

        assertTrue(json.contains("\"type_hint\""));
        assertTrue(json.contains("\"source_path\""));

        IntermediateRepresentation back = codec.fromJson(json);
        assertEquals("double_it", back.getSignature().getName());
        assertEquals("Return the result", back.getEffects().get(1).getDescription());
    }

    @Test
    void testRejectsMalformedInput() {
        assertThrows(IrParseException.class, () -> codec.fromJson(" "));
        assertThrows(IrParseException.class, () -> codec.fromJson("{ not json"));
        assertThrows(IrParseException.class, () -> codec.fromJson("[1, 2]"));
        assertThrows(IrParseException.class, () -> codec.fromJson("{ \"intent\": { \"summary\": \"x\" } }"));
    }

    @Test
    void testRejectsInvalidModel() {
        IrParseException e = assertThrows(IrParseException.class, () -> codec.fromJson("""
            {
              "intent": { "summary": "Add two numbers" },
              "signature": { "name": "add", "parameters": [ { "name": "a" }, { "name": "a" } ] }
            }
            """));

        assertTrue(e.getMessage().startsWith("Invalid IR"));
    }

    @Test
    void testRejectsUnknownHoleKind() {
        assertThrows(IrParseException.class, () -> codec.fromJson("""
            {
              "intent": { "summary": "Guess", "holes": [ { "identifier": "h", "kind": "mystery" } ] },
              "signature": { "name": "guess" }
            }
            """));
    }

    @Test
    void testConstraintOrderSurvivesReencoding() {
        IntermediateRepresentation ir = codec.fromJson("""
            {
              "intent": { "summary": "Pad a string" },
              "signature": {
                "name": "pad",
                "holes": [
                  { "identifier": "fill", "kind": "signature",
                    "constraints": { "zeta": "1", "alpha": "2", "mid": "3" } }
                ]
              }
            }
            """);

        List<String> expected = List.of("zeta", "alpha", "mid");
        assertEquals(expected, List.copyOf(ir.getSignature().getHoles().get(0).getConstraints().keySet()));

        IntermediateRepresentation back = codec.fromJson(codec.toJson(ir));
        assertEquals(expected, List.copyOf(back.getSignature().getHoles().get(0).getConstraints().keySet()));
    }

    @Test
    void testDecodeIsLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            IntermediateRepresentation ir = codec.fromJson("""
                {
                  "intent": {
                    "summary": "Find an item",
                    "holes": [ { "identifier": "what", "kind": "intent" } ]
                  },
                  "signature": {
                    "name": "find_item",
                    "holes": [ { "identifier": "impl", "kind": "IMPLEMENTATION" } ]
                  }
                }
                """);

            assertEquals(HoleKind.INTENT, ir.getIntent().getHoles().get(0).getKind());
            assertEquals(HoleKind.IMPLEMENTATION, ir.getSignature().getHoles().get(0).getKind());
            assertTrue(codec.toJson(ir).contains("\"kind\" : \"intent\""));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
