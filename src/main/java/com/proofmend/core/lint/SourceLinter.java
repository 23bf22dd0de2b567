package com.proofmend.core.lint;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags proof placeholders in source text.
 *
 * A disqualifying marker (default {@code sorry}) keeps a passing build from
 * counting as repaired.
 */
@Component
public class SourceLinter {

    private static final List<String> PLACEHOLDERS = List.of("sorry", "admit");

    private final List<String> disqualifyingMarkers;

    public SourceLinter(@Value("${proofmend.repair.disqualifying-markers:sorry}") String[] disqualifyingMarkers) {
        this.disqualifyingMarkers = Arrays.stream(disqualifyingMarkers)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public List<String> findIssues(String source) {
        List<String> issues = new ArrayList<>();
        for (String placeholder : PLACEHOLDERS) {
            if (source.contains(placeholder)) {
                issues.add("contains `" + placeholder + "`");
            }
        }
        return issues;
    }

    public boolean hasDisqualifyingMarker(String source) {
        return disqualifyingMarkers.stream().anyMatch(source::contains);
    }

    public List<String> getDisqualifyingMarkers() {
        return disqualifyingMarkers;
    }
}
