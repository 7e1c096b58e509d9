package com.specguard.interpreter.report;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.interpreter.InterpretationResult;

@Component
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final int maxIssues;

    public ReportAssembler(@Value("${specguard.report.max-issues:50}") int maxIssues) {
        this.maxIssues = maxIssues;
    }

    public InterpretationReport assemble(InterpretationResult result) {
        ExecutionTrace trace = result.getTrace();

        List<InterpretationReport.IssueView> issues = result.getAllIssues().stream()
                .map(this::toView)
                .collect(Collectors.toList());

        return new InterpretationReport(
                result.getIr().getSignature().getName(),
                !result.hasErrors(),
                result.getErrors().size(),
                result.getWarnings().size(),
                trace.getOperations(),
                trace.hasReturnValue() ? trace.getReturnValue().getName() : null,
                issues
        );
    }

    public String toJson(InterpretationResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(assemble(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize interpretation report", e);
        }
    }

    /**
     * Human-readable report. At most {@code maxIssues} issues are listed, errors first;
     * the rest are summarized in a trailing line.
     */
    public String toText(InterpretationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=================================================\n");
        sb.append("INTERPRETATION REPORT FOR ").append(result.getIr().getSignature().getName()).append('\n');
        sb.append("-------------------------------------------------\n");
        sb.append("Verdict: ").append(result.hasErrors() ? "BLOCKED" : "PROCEED")
                .append(" (").append(result.getErrors().size()).append(" error(s), ")
                .append(result.getWarnings().size()).append(" warning(s))\n");

        List<SemanticIssue> ordered = new ArrayList<>(result.getErrors());
        ordered.addAll(result.getWarnings());

        int shown = Math.min(ordered.size(), Math.max(0, maxIssues));
        for (int i = 0; i < shown; i++) {
            SemanticIssue issue = ordered.get(i);
            sb.append("  ").append(issue).append('\n');
            if (issue.getSuggestion() != null) {
                sb.append("      -> ").append(issue.getSuggestion()).append('\n');
            }
        }
        if (ordered.size() > shown) {
            sb.append("  ... ").append(ordered.size() - shown).append(" more issue(s) omitted\n");
            log.debug("[Report] Truncated {} issue(s) for {}", ordered.size() - shown,
                    result.getIr().getSignature().getName());
        }

        sb.append("=================================================");
        return sb.toString();
    }

    private InterpretationReport.IssueView toView(SemanticIssue issue) {
        return new InterpretationReport.IssueView(
                issue.getSeverity().code(),
                issue.getCategory().code(),
                issue.getMessage(),
                issue.getEffectIndex(),
                issue.getSuggestion()
        );
    }
}
