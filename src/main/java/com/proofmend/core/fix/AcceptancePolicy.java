package com.proofmend.core.fix;

/**
 * How {@link BeamTrialRunner} picks among candidates that do not raise the error count.
 *
 * BEST_OF_BEAM        - try the whole beam; strictly fewer errors wins, ties go to table order
 * FIRST_NON_WORSENING - stop at the first candidate whose error count is not above the baseline
 */
public enum AcceptancePolicy {
    BEST_OF_BEAM,
    FIRST_NON_WORSENING
}
