package com.proofmend.core.fix;

/**
 * Textual replacement over the half-open range {@code [start, end)} of a source text.
 */
public final class Edit {

    private final int start;
    private final int end;
    private final String replacement;
    private final String rationale;

    public Edit(int start, int end, String replacement, String rationale) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.replacement = replacement != null ? replacement : "";
        this.rationale = rationale != null ? rationale : "";
    }

    public static Edit insertAtStart(String text, String rationale) {
        return new Edit(0, 0, text, rationale);
    }

    public String applyTo(String source) {
        if (end > source.length()) {
            throw new IllegalArgumentException(
                    "Edit range [" + start + ", " + end + ") exceeds source length " + source.length());
        }
        return source.substring(0, start) + replacement + source.substring(end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacement() {
        return replacement;
    }

    public String getRationale() {
        return rationale;
    }

    @Override
    public String toString() {
        return "Edit{'" + rationale + "' [" + start + ", " + end + ")}";
    }
}
