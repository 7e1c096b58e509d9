package com.specguard.core.ir;

import java.util.List;

/**
 * Provenance of an IR. Read-only context; the validation core never interprets it.
 */
public class Metadata {

    private final String origin;
    private final String sourcePath;
    private final String language;
    private final List<String> evidence;

    public Metadata(String origin, String sourcePath, String language, List<String> evidence) {
        this.origin     = origin;
        this.sourcePath = sourcePath;
        this.language   = language;
        this.evidence   = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static Metadata empty() {
        return new Metadata(null, null, null, List.of());
    }

    public String getOrigin()         { return origin; }
    public String getSourcePath()     { return sourcePath; }
    public String getLanguage()       { return language; }
    public List<String> getEvidence() { return evidence; }
}
