package com.specguard.interpreter.report;

import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specguard.IrFixtures;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.Severity;
import com.specguard.interpreter.IRInterpreter;
import com.specguard.interpreter.InterpretationResult;

import static org.junit.jupiter.api.Assertions.*;

class ReportAssemblerTest {

    private final IRInterpreter interpreter = new IRInterpreter();

    private InterpretationResult branchy() {
        return interpreter.interpret(IrFixtures.ir()
                .named("describe_sign")
                .param("n", "int")
                .returns("str")
                .effects("If n is negative, store the label into sign", "Return the sign")
                .build());
    }

    @Test
    void testAssembleReport() {
        InterpretationReport report = new ReportAssembler(50).assemble(branchy());

        assertEquals("describe_sign", report.getFunction());
        assertFalse(report.isProceed());
        assertEquals(1, report.getErrorCount());
        assertEquals("sign", report.getReturnValue());
        assertTrue(report.getOperations().contains("if"));
    }

    @Test
    void testJsonUsesSnakeCase() throws Exception {
        String json = new ReportAssembler(50).toJson(branchy());

        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("describe_sign", root.get("function").asText());
        assertFalse(root.get("proceed").asBoolean());
        assertEquals(1, root.get("error_count").asInt());
        assertEquals("missing_return_path", root.get("issues").get(1).get("category").asText());
        assertEquals(0, root.get("issues").get(0).get("effect_index").asInt());
    }

    @Test
    void testTextListsErrorsFirstAndTruncates() {
        String text = new ReportAssembler(1).toText(branchy());

        assertTrue(text.contains("INTERPRETATION REPORT FOR describe_sign"));
        assertTrue(text.contains("Verdict: BLOCKED"));
        assertTrue(text.contains("[ERROR]"));
        assertFalse(text.contains("[WARNING]"));
        assertTrue(text.contains("1 more issue(s) omitted"));
    }

    @Test
    void testCleanTextReport() {
        String text = new ReportAssembler(50).toText(interpreter.interpret(IrFixtures.ir()
                .named("identity")
                .param("x", "int")
                .returns("int")
                .effects("Take parameter x", "Return x")
                .build()));

        assertTrue(text.contains("Verdict: PROCEED (0 error(s), 0 warning(s))"));
    }

    @Test
    void testCodesAreLocaleIndependent() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("missing_return", IssueCategory.MISSING_RETURN.code());
            assertEquals("invalid_logic", IssueCategory.INVALID_LOGIC.code());
            assertEquals("warning", Severity.WARNING.code());

            JsonNode root = new ObjectMapper().readTree(new ReportAssembler(50).toJson(branchy()));
            assertEquals("incomplete_branch", root.get("issues").get(0).get("category").asText());
            assertEquals("missing_return_path", root.get("issues").get(1).get("category").asText());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
