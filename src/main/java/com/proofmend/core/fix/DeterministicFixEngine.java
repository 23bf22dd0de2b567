package com.proofmend.core.fix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * DeterministicFixEngine - maps known error signatures to canned insertions.
 *
 * Pure: no file or process access. Edits come back in table order, one per
 * matching rule, and a rule whose remedy is already in the source never fires.
 * Ranking and trial application belong to {@link BeamTrialRunner}.
 */
@Component
public class DeterministicFixEngine {

    private static final Logger log = LoggerFactory.getLogger(DeterministicFixEngine.class);

    static final List<FixRule> DEFAULT_RULES = List.of(
            new FixRule("import log",
                    List.of("unknown identifier 'Real.log'"),
                    "Mathlib.Analysis.SpecialFunctions.Log.Basic",
                    "import Mathlib.Analysis.SpecialFunctions.Log.Basic"),
            FixRule.insertLine("open Classical", "open Classical",
                    "unknown identifier 'Classical'", "unknown namespace 'Classical'"),
            new FixRule("import exp",
                    List.of("unknown identifier 'Real.exp'"),
                    "Mathlib.Analysis.SpecialFunctions.Exp",
                    "import Mathlib.Analysis.SpecialFunctions.Exp"),
            FixRule.insertLine("open BigOperators", "open BigOperators",
                    "unknown namespace 'BigOperators'"),
            new FixRule("import sqrt",
                    List.of("unknown identifier 'Real.sqrt'"),
                    "Mathlib.Analysis.SpecialFunctions.Sqrt",
                    "import Mathlib.Analysis.SpecialFunctions.Sqrt")
    );

    private final List<FixRule> rules;

    public DeterministicFixEngine() {
        this(DEFAULT_RULES);
    }

    public DeterministicFixEngine(List<FixRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Edit> propose(Path file, String source, List<String> errors) {

        List<Edit> edits = new ArrayList<>();
        String errorBlob = String.join(" ", errors);

        for (FixRule rule : rules) {
            if (!rule.matches(errorBlob)) {
                continue;
            }
            if (rule.isApplied(source)) {
                log.debug("[FixEngine] Rule '{}' matches but is already applied to {}", rule.getName(), file);
                continue;
            }
            edits.add(rule.toEdit());
        }

        log.info("[FixEngine] {} candidate edit(s) for {}: {}", edits.size(),
                file != null ? file.getFileName() : "<text>", edits);
        return edits;
    }
}
