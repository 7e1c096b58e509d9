package com.specguard;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.specguard.core.ir.IrJsonCodec;
import com.specguard.interpreter.BatchInterpreter;
import com.specguard.interpreter.IRInterpreter;
import com.specguard.interpreter.InterpretationResult;
import com.specguard.interpreter.report.ReportAssembler;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SpecGuardApplicationTest {

    @Autowired
    private IRInterpreter interpreter;

    @Autowired
    private BatchInterpreter batchInterpreter;

    @Autowired
    private IrJsonCodec codec;

    @Autowired
    private ReportAssembler reportAssembler;

    @Test
    void testPipelineIsWired() {
        String json = """
            {
              "intent": { "summary": "Count words in a sentence" },
              "signature": {
                "name": "count_words",
                "parameters": [ { "name": "text", "type_hint": "str" } ],
                "returns": "int"
              },
              "effects": [
                { "description": "Split text by spaces into words" },
                { "description": "Count the elements" },
                { "description": "Return the count" }
              ]
            }
            """;

        List<InterpretationResult> results = batchInterpreter.interpretAll(List.of(codec.fromJson(json)));

        assertEquals(1, results.size());
        assertTrue(interpreter.shouldGenerateCode(results.get(0)));
        assertEquals(1, batchInterpreter.summarize(results).getProceed());
        assertTrue(reportAssembler.toText(results.get(0)).contains("Verdict: PROCEED"));
    }
}
