package com.proofmend.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * LlmPatchOracle - builds the repair, extend, document and patch prompts and
 * turns model output into optional file text.
 *
 * Request failures are logged and reported as "no suggestion"; the loop decides what that means.
 */
public class LlmPatchOracle implements PatchOracle {

    private static final Logger log = LoggerFactory.getLogger(LlmPatchOracle.class);

    private final LLMClient client;
    private final int maxErrors;

    public LlmPatchOracle(LLMClient client, int maxErrors) {
        this.client = client;
        this.maxErrors = Math.max(1, maxErrors);
    }

    @Override
    public Optional<String> repair(String fileText, List<String> errors) {
        String errorBlob = joinErrors(errors, "\n\n");
        String prompt = """
                The Lean 4 file below fails to compile with the following errors:

                %s

                Return a complete corrected version of the file that compiles with `lake build`.
                Respond with LEAN CODE ONLY (no explanations). If imports are needed, add them.

                ```lean
                %s
                ```
                """.formatted(errorBlob.isEmpty() ? "(no diagnostics available)" : errorBlob, fileText);
        return ask(OracleRole.REPAIR, prompt);
    }

    @Override
    public Optional<String> extend(String fileText, String theme) {
        String prompt = """
                The Lean 4 file below compiles and collects results in the theme: "%s".
                Add a main new result or definition that is not in the file yet, together with any
                lemmas or definitions its proof needs that are not already present. Follow the
                comments in the file and continue its logical order. Keep every existing declaration.
                The result must still compile. Return LEAN CODE ONLY.

                ```lean
                %s
                ```
                """.formatted(theme == null ? "" : theme, fileText);
        return ask(OracleRole.EXTEND, prompt);
    }

    @Override
    public Optional<String> document(String fileText) {
        String prompt = """
                Add documentation and comments to the Lean 4 file below WITHOUT changing its behavior.
                - Add a module docstring `/-! ... -/` summarizing the theme and listing the main definitions, lemmas and theorems.
                - Immediately before each `def`, `lemma` or `theorem`, add a short `--` comment on what it states and its role.
                - For nontrivial proofs, add a few `--` comments inside `by` blocks explaining key steps.
                - Do NOT rename identifiers. Do NOT reorder imports. Do NOT introduce non-compiling code.
                Return LEAN CODE ONLY. No explanations outside comments.

                ```lean
                %s
                ```
                """.formatted(fileText);
        return ask(OracleRole.DOCUMENT, prompt);
    }

    @Override
    public Optional<String> proposePatch(String fileName, List<String> errors) {
        String prompt = """
                You are editing a Lean 4 file.
                Errors:
                %s

                Return a unified diff (patch) that modifies only '%s' to fix the errors.
                Paths in the diff headers must be relative to the file's directory.
                If unsure, add missing imports or 'open' statements minimally.
                """.formatted(joinErrors(errors, "\n"), fileName);
        return ask(OracleRole.PATCH, prompt);
    }

    private Optional<String> ask(OracleRole role, String prompt) {
        String raw;
        try {
            raw = client.generateWithRole(role, prompt.strip());
        } catch (OracleException e) {
            log.error("[Oracle] {} request failed; treating as no suggestion: {}", role, e.getMessage());
            return Optional.empty();
        }

        String text = role == OracleRole.PATCH ? stripPatchFence(raw) : CodeFences.strip(raw);
        if (text.isBlank()) {
            log.warn("[Oracle] {} returned no content", role);
            return Optional.empty();
        }
        log.info("[Oracle] {} returned {} chars", role, text.length());
        return Optional.of(text);
    }

    // patch(1) wants the trailing newline that strip() removes
    private String stripPatchFence(String raw) {
        String text = CodeFences.strip(raw);
        return text.isEmpty() ? text : text + "\n";
    }

    private String joinErrors(List<String> errors, String separator) {
        return String.join(separator, errors.subList(0, Math.min(maxErrors, errors.size()))).strip();
    }
}
