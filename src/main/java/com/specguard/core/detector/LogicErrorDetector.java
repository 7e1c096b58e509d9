package com.specguard.core.detector;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.SemanticIssue;

/**
 * LogicErrorDetector: runs every pattern detector and concatenates their findings.
 *
 * Detector order is fixed (off-by-one, incomplete validation, unreachable code) so
 * the output list is deterministic; detectors themselves are independent.
 */
@Component
public class LogicErrorDetector {

    private static final Logger log = LoggerFactory.getLogger(LogicErrorDetector.class);

    private final List<LogicPatternDetector> detectors;

    @Autowired
    public LogicErrorDetector(
            OffByOneDetector offByOne,
            IncompleteValidationDetector incompleteValidation,
            UnreachableCodeDetector unreachableCode
    ) {
        this.detectors = List.of(offByOne, incompleteValidation, unreachableCode);
    }

    public LogicErrorDetector() {
        this(new OffByOneDetector(), new IncompleteValidationDetector(), new UnreachableCodeDetector());
    }

    public List<SemanticIssue> detectAllPatterns(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        for (LogicPatternDetector detector : detectors) {
            List<SemanticIssue> found = detector.detect(ir, trace);
            if (!found.isEmpty()) {
                log.debug("[Detector] {} found {} issue(s) in {}",
                        detector.getName(), found.size(), ir.getSignature().getName());
            }
            issues.addAll(found);
        }
        return issues;
    }

    public List<LogicPatternDetector> getDetectors() {
        return detectors;
    }
}
