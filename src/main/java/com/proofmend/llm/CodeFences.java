package com.proofmend.llm;

/**
 * Removes a surrounding Markdown code fence from model output.
 */
public final class CodeFences {

    private static final String FENCE = "```";

    private CodeFences() {
    }

    /**
     * {@code "```lean\nX\n```"} becomes {@code "X"}; text without a leading fence is only trimmed.
     */
    public static String strip(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.strip();
        if (!text.startsWith(FENCE)) {
            return text;
        }
        int newline = text.indexOf('\n');
        text = newline >= 0 ? text.substring(newline + 1) : "";
        String trailing = text.stripTrailing();
        if (trailing.endsWith(FENCE)) {
            text = trailing.substring(0, trailing.length() - FENCE.length());
        }
        return text.strip();
    }
}
