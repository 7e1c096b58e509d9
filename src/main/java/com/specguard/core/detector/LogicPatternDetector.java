package com.specguard.core.detector;

import java.util.List;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.SemanticIssue;

/**
 * One heuristic detector for a known bug shape.
 *
 * Implementations are pure: they read the IR and the finished trace, never mutate
 * either, and do not depend on the output of other detectors.
 */
public interface LogicPatternDetector {

    String getName();

    List<SemanticIssue> detect(IntermediateRepresentation ir, ExecutionTrace trace);
}
