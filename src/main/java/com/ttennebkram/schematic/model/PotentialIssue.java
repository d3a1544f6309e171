package com.ttennebkram.schematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A topology anomaly worth showing to the user. Never fatal.
 */
public final class PotentialIssue {
    public static final String ISOLATION = "isolation";
    public static final String HIGH_CONNECTIVITY = "high_connectivity";
    public static final String SHORT_CONNECTIONS = "short_connections";
    public static final String DANGLING_CONNECTIONS = "dangling_connections";

    private final String type;
    private final IssueSeverity severity;
    private final String message;
    private final List<String> affectedIds;

    public PotentialIssue(String type, IssueSeverity severity, String message, List<String> affectedIds) {
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.affectedIds = affectedIds != null
            ? Collections.unmodifiableList(new ArrayList<>(affectedIds))
            : Collections.emptyList();
    }

    public String getType() { return type; }
    public IssueSeverity getSeverity() { return severity; }
    public String getMessage() { return message; }

    /** Component or node IDs the issue refers to; empty for aggregate issues. */
    public List<String> getAffectedIds() { return affectedIds; }

    @Override
    public String toString() {
        return "[" + severity.getLabel() + "] " + type + ": " + message;
    }
}
