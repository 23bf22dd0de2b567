package com.proofmend.core.state;

/**
 * Status of a repair session.
 *
 * DIRTY - errors present or not yet known (initial)
 * OK    - last build passed and no disqualifying marker is in the source (terminal)
 * STUCK - a required recovery step failed; nothing safe is left to try (terminal)
 *
 * Running out of iterations is not a status: the loop stops in whatever status holds.
 */
public enum SessionStatus {
    DIRTY,
    OK,
    STUCK
}
