package com.specguard.interpreter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.specguard.core.analyzer.EffectChainAnalyzer;
import com.specguard.core.detector.LogicErrorDetector;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.validator.SemanticValidator;
import com.specguard.core.validator.ValidationResult;

/**
 * IRInterpreter: single entry point for checking an IR before code generation.
 *
 * Pipeline:
 *   1. EffectChainAnalyzer builds the symbolic trace
 *   2. SemanticValidator checks the trace against the signature and assertions
 *   3. LogicErrorDetector runs the pattern detectors
 *   4. InterpreterChecks runs the cross-cutting structural checks
 *
 * Issues from all stages are merged in that order and deduplicated on
 * (category, message); the first occurrence wins.
 *
 * Stateless between calls: interpreting the same IR twice yields equal results.
 */
@Component
public class IRInterpreter {

    private static final Logger log = LoggerFactory.getLogger(IRInterpreter.class);

    private final EffectChainAnalyzer analyzer;
    private final SemanticValidator validator;
    private final LogicErrorDetector detector;
    private final InterpreterChecks checks;

    @Autowired
    public IRInterpreter(
            EffectChainAnalyzer analyzer,
            SemanticValidator validator,
            LogicErrorDetector detector,
            InterpreterChecks checks
    ) {
        this.analyzer  = analyzer;
        this.validator = validator;
        this.detector  = detector;
        this.checks    = checks;
    }

    public IRInterpreter() {
        this(new EffectChainAnalyzer(), new SemanticValidator(), new LogicErrorDetector(), new InterpreterChecks());
    }

    public InterpretationResult interpret(IntermediateRepresentation ir) {
        if (ir == null) {
            throw new IllegalArgumentException("IR must not be null");
        }

        ExecutionTrace trace = analyzer.analyze(ir);
        ValidationResult validation = validator.validate(ir, trace);

        List<SemanticIssue> merged = new ArrayList<>(validation.getIssues());
        merged.addAll(detector.detectAllPatterns(ir, trace));
        merged.addAll(checks.runAll(ir, trace));

        InterpretationResult result = new InterpretationResult(ir, trace, validation, deduplicate(merged));

        log.info("[Interpreter] {} -> {} error(s), {} warning(s), {}",
                ir.getSignature().getName(),
                result.getErrors().size(),
                result.getWarnings().size(),
                shouldGenerateCode(result) ? "PROCEED" : "BLOCKED");

        return result;
    }

    /**
     * Code generation gate: proceed iff no error-severity issue was found.
     * Warnings never block.
     */
    public boolean shouldGenerateCode(InterpretationResult result) {
        return !result.hasErrors();
    }

    private List<SemanticIssue> deduplicate(List<SemanticIssue> issues) {
        Map<String, SemanticIssue> unique = new LinkedHashMap<>();
        for (SemanticIssue issue : issues) {
            unique.putIfAbsent(issue.dedupKey(), issue);
        }
        return new ArrayList<>(unique.values());
    }
}
