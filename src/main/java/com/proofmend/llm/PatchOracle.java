package com.proofmend.llm;

import java.util.List;
import java.util.Optional;

/**
 * PatchOracle - boundary to the external generative fixer.
 *
 * Every call is single-shot and stateless. Empty means "no suggestion" and is
 * never an error: a missing credential, a failed request and a blank answer
 * all come back empty. Returned text has any Markdown code fence removed.
 */
public interface PatchOracle {

    /** Complete corrected replacement of {@code fileText}. */
    Optional<String> repair(String fileText, List<String> errors);

    /** Complete replacement that adds new content in {@code theme} and removes nothing. */
    Optional<String> extend(String fileText, String theme);

    /** Complete replacement that only adds explanatory annotation. */
    Optional<String> document(String fileText);

    /** Unified diff against {@code fileName} that fixes {@code errors}. */
    Optional<String> proposePatch(String fileName, List<String> errors);

    /** False for the declining oracle used when no credential is configured. */
    default boolean isAvailable() {
        return true;
    }
}
