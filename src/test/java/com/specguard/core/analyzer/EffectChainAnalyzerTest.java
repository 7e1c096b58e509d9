package com.specguard.core.analyzer;

import org.junit.jupiter.api.Test;

import com.specguard.IrFixtures;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.trace.SymbolicValue;

import static org.junit.jupiter.api.Assertions.*;

class EffectChainAnalyzerTest {

    private final EffectChainAnalyzer analyzer = new EffectChainAnalyzer();

    @Test
    void testParametersSeedTheTrace() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .param("x", "int")
                .param("y", "str")
                .build());

        assertTrue(trace.getValue("x").isParameter());
        assertEquals("str", trace.getValue("y").getTypeHint());
        assertTrue(trace.getOperations().isEmpty());
    }

    @Test
    void testSplitIntoWordsProducesStringList() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .param("sentence", "str")
                .effects("Split input by spaces into words")
                .build());

        SymbolicValue words = trace.getValue("words");
        assertNotNull(words);
        assertEquals("list[str]", words.getTypeHint());
        assertEquals(0, words.getEffectIndex());
        assertTrue(trace.hasOperation(OperationVocabulary.SPLIT));
    }

    @Test
    void testCountingProducesInt() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .effects("Count the elements")
                .build());

        SymbolicValue count = trace.getValue("count");
        assertNotNull(count);
        assertEquals("int", count.getTypeHint());
        assertTrue(count.isComputed());
    }

    @Test
    void testFindIndexProducesInt() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .effects("Find the index of the target")
                .build());

        assertEquals("int", trace.getValue("index").getTypeHint());
    }

    @Test
    void testReturnResolvesComputedValue() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("int")
                .effects("Count the elements", "Return the count")
                .build());

        assertTrue(trace.hasReturnValue());
        assertEquals("count", trace.getReturnValue().getName());
        assertTrue(trace.getIssues().isEmpty());
    }

    @Test
    void testFirstResolvedReturnIsKept() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("int")
                .effects("Count the items", "Calculate the average", "Return the count", "Return the result")
                .build());

        assertEquals("count", trace.getReturnValue().getName());
    }

    @Test
    void testPlaceholderIsUpgradedByLaterResolvedReturn() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("int")
                .effects("Return early", "Count the items", "Return the count")
                .build());

        assertEquals("count", trace.getReturnValue().getName());
    }

    @Test
    void testUnknownSnakeCaseReturnIsFlagged() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("int")
                .effects("Return the final_total")
                .build());

        assertTrue(trace.getReturnValue().isPlaceholder());
        SemanticIssue issue = trace.getIssues().get(0);
        assertEquals(IssueCategory.UNDEFINED_VARIABLE, issue.getCategory());
        assertTrue(issue.isWarning());
        assertEquals(0, issue.getEffectIndex());
    }

    @Test
    void testMissingReturnListsProducedValues() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("int")
                .effects("Split input by spaces into words", "Count the elements")
                .build());

        assertFalse(trace.hasReturnValue());
        SemanticIssue issue = trace.getIssues().get(0);
        assertEquals(IssueCategory.MISSING_RETURN, issue.getCategory());
        assertTrue(issue.isWarning(), "Abbreviated effect lists stay advisory");
        assertTrue(issue.getMessage().contains("'words', 'count'"));
        assertEquals("Add effect: 'Return the count'", issue.getSuggestion());
    }

    @Test
    void testMissingReturnWithoutValues() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .returns("str")
                .effects("Sort the data")
                .build());

        assertTrue(trace.getIssues().get(0).getMessage().endsWith("produces no value"));
    }

    @Test
    void testNoReturnDeclaredNoIssue() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .effects("Print the data")
                .build());

        assertFalse(trace.hasErrors());
        assertFalse(trace.hasWarnings());
    }

    @Test
    void testRecomputedValueKeepsShadowHistory() {
        ExecutionTrace trace = analyzer.analyze(IrFixtures.ir()
                .param("text", "str")
                .effects("Strip whitespace from text into text")
                .build());

        assertTrue(trace.getValue("text").isComputed());
        assertEquals(1, trace.getShadowedValues().size());
        assertTrue(trace.getShadowedValues().get(0).isParameter());
    }

    @Test
    void testFailingEffectIsReportedAndSkipped() {
        EffectChainAnalyzer flaky = new EffectChainAnalyzer() {
            @Override
            void parseEffect(String description, int effectIndex, ExecutionTrace trace) {
                if (effectIndex == 1) {
                    throw new IllegalStateException("unparseable wording");
                }
                super.parseEffect(description, effectIndex, trace);
            }
        };
        IntermediateRepresentation ir = IrFixtures.ir()
                .returns("int")
                .effects("Count the elements", "Return the count", "Find the index of the target")
                .build();

        ExecutionTrace trace = assertDoesNotThrow(() -> flaky.analyze(ir));

        SemanticIssue failure = trace.getIssues().get(0);
        assertEquals(IssueCategory.PARSE_FAILURE, failure.getCategory());
        assertTrue(failure.isWarning());
        assertEquals(1, failure.getEffectIndex());
        assertEquals("Effect 2 could not be analyzed", failure.getMessage());

        // Effects on both sides of the failure are still analyzed
        assertNotNull(trace.getValue("count"));
        assertNotNull(trace.getValue("index"));
        assertFalse(trace.hasReturnValue());
    }

    @Test
    void testNullIrRejected() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(null));
    }

    @Test
    void testVariableNameDropsStopWords() {
        assertEquals("sorted_list", EffectChainAnalyzer.variableName("the sorted list"));
        assertEquals("value", EffectChainAnalyzer.variableName("the"));
    }
}
