package com.specguard.core.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ExecutionTrace: symbolic data-flow record built by the effect-chain analyzer.
 *
 * Owned exclusively by the interpret call that created it. Only the analyzer writes
 * to it; validator, detectors and interpreter checks read it after analysis ends.
 *
 * Values are keyed by name. Registering a name that already exists replaces the
 * current record and moves the old one to the shadow history, so a parameter that
 * is later recomputed is still visible to the shadowing check.
 */
public class ExecutionTrace {

    private final Map<String, SymbolicValue> values = new LinkedHashMap<>();
    private final List<SymbolicValue> shadowed      = new ArrayList<>();
    private final List<String> operations           = new ArrayList<>();
    private final List<SemanticIssue> issues        = new ArrayList<>();

    private SymbolicValue returnValue;

    // =========================================================================
    // Values
    // =========================================================================

    public void addValue(SymbolicValue value) {
        SymbolicValue previous = values.put(value.getName(), value);
        if (previous != null) {
            shadowed.add(previous);
        }
    }

    /** Returns the current value registered under {@code name}, or {@code null}. */
    public SymbolicValue getValue(String name) {
        return values.get(name);
    }

    public Map<String, SymbolicValue> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /** Records replaced by a later value with the same name, in replacement order. */
    public List<SymbolicValue> getShadowedValues() {
        return Collections.unmodifiableList(shadowed);
    }

    public List<SymbolicValue> getComputedValues() {
        return values.values().stream()
                .filter(SymbolicValue::isComputed)
                .collect(Collectors.toList());
    }

    // =========================================================================
    // Operations
    // =========================================================================

    public void addOperation(String operation) {
        operations.add(operation);
    }

    public List<String> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean hasOperation(String operation) {
        return operations.contains(operation);
    }

    // =========================================================================
    // Return value
    // =========================================================================

    public SymbolicValue getReturnValue() { return returnValue; }

    public void setReturnValue(SymbolicValue returnValue) {
        this.returnValue = returnValue;
    }

    public boolean hasReturnValue() {
        return returnValue != null;
    }

    // =========================================================================
    // Issues
    // =========================================================================

    public void addIssue(SemanticIssue issue) {
        issues.add(issue);
    }

    public List<SemanticIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(SemanticIssue::isError);
    }

    public boolean hasWarnings() {
        return issues.stream().anyMatch(SemanticIssue::isWarning);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Execution Trace:\n");
        sb.append("  Values: ").append(values.size()).append('\n');
        for (SymbolicValue value : values.values()) {
            sb.append("    - ").append(value).append('\n');
        }
        sb.append("  Operations: ").append(String.join(", ", operations)).append('\n');
        sb.append("  Return: ").append(returnValue != null ? returnValue : "None");
        if (!issues.isEmpty()) {
            sb.append("\n  Issues: ").append(issues.size());
            for (SemanticIssue issue : issues) {
                sb.append("\n    ").append(issue);
            }
        }
        return sb.toString();
    }
}
