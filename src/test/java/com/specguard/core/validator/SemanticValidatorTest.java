package com.specguard.core.validator;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.specguard.IrFixtures;
import com.specguard.core.analyzer.EffectChainAnalyzer;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;

import static org.junit.jupiter.api.Assertions.*;

class SemanticValidatorTest {

    private final EffectChainAnalyzer analyzer = new EffectChainAnalyzer();
    private final SemanticValidator validator = new SemanticValidator();

    private ValidationResult validate(IntermediateRepresentation ir) {
        ExecutionTrace trace = analyzer.analyze(ir);
        return validator.validate(ir, trace);
    }

    @Test
    void testReturnTypeMismatchIsWarning() {
        IntermediateRepresentation ir = IrFixtures.ir()
                .param("s", "str")
                .returns("int")
                .effects("Split s into words", "Return the words")
                .build();

        List<SemanticIssue> issues = validator.validateReturnConsistency(ir, analyzer.analyze(ir));

        assertEquals(1, issues.size());
        assertEquals(IssueCategory.TYPE_MISMATCH, issues.get(0).getCategory());
        assertTrue(issues.get(0).isWarning());
        assertTrue(issues.get(0).getMessage().contains("'list[str]'"));
    }

    @Test
    void testUnusedParameter() {
        ValidationResult result = validate(IrFixtures.ir()
                .param("a", "int")
                .param("b", "int")
                .returns("int")
                .effects("Return a")
                .build());

        List<SemanticIssue> unused = result.getIssues().stream()
                .filter(i -> i.getCategory() == IssueCategory.UNUSED_PARAMETER)
                .toList();

        assertEquals(1, unused.size());
        assertEquals("Parameter 'b' may not be used in effects", unused.get(0).getMessage());
        assertTrue(result.isPassed(), "Warnings never fail validation");
    }

    @Test
    void testTypeSynonymCountsAsUsage() {
        ValidationResult result = validate(IrFixtures.ir()
                .param("items", "list[int]")
                .effects("Sum the numbers")
                .build());

        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void testAssertionOnUnknownResult() {
        ValidationResult result = validate(IrFixtures.ir()
                .param("x", "int")
                .effects("Multiply x by 2")
                .asserting("computed value is positive")
                .build());

        assertTrue(result.getWarnings().stream()
                .anyMatch(i -> i.getCategory() == IssueCategory.ASSERTION_COVERAGE));
    }

    @Test
    void testAssertionOnKnownValue() {
        ValidationResult result = validate(IrFixtures.ir()
                .param("x", "int")
                .returns("int")
                .effects("Calculate the doubled x", "Return the result")
                .asserting("result is even")
                .build());

        assertTrue(result.getIssues().stream()
                .noneMatch(i -> i.getCategory() == IssueCategory.ASSERTION_COVERAGE));
    }

    @Test
    void testTraceIssuesAreCarried() {
        ValidationResult result = validate(IrFixtures.ir()
                .param("text", "str")
                .returns("int")
                .effects("Split text by spaces into words", "Count the elements")
                .build());

        assertTrue(result.isPassed());
        assertEquals(IssueCategory.MISSING_RETURN, result.getIssues().get(0).getCategory());
    }

    @Test
    void testTypeCompatibility() {
        assertTrue(TypeCompatibility.compatible("float", "int"));
        assertTrue(TypeCompatibility.compatible("List[int]", "list[Any]"));
        assertTrue(TypeCompatibility.compatible("string", "str"));
        assertTrue(TypeCompatibility.compatible("int", "Any"));
        assertFalse(TypeCompatibility.compatible("int", "float"));
        assertFalse(TypeCompatibility.compatible("bool", "str"));
    }
}
