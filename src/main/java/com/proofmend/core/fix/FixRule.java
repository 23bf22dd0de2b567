package com.proofmend.core.fix;

import java.util.List;

/**
 * One row of the deterministic fix table.
 *
 * Fires when any signature occurs in the joined error text and the remedy
 * marker is not yet in the source. The remedy is a single line inserted at
 * the top of the file.
 */
public final class FixRule {

    private final String name;
    private final List<String> signatures;
    private final String remedyMarker;
    private final String remedyLine;

    public FixRule(String name, List<String> signatures, String remedyMarker, String remedyLine) {
        this.name = name;
        this.signatures = List.copyOf(signatures);
        this.remedyMarker = remedyMarker;
        this.remedyLine = remedyLine;
    }

    /** Rule whose marker is the remedy line itself. */
    public static FixRule insertLine(String name, String remedyLine, String... signatures) {
        return new FixRule(name, List.of(signatures), remedyLine, remedyLine);
    }

    public boolean matches(String errorBlob) {
        return signatures.stream().anyMatch(errorBlob::contains);
    }

    public boolean isApplied(String source) {
        return source.contains(remedyMarker);
    }

    public Edit toEdit() {
        return Edit.insertAtStart(remedyLine + "\n", name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FixRule{" + name + "}";
    }
}
