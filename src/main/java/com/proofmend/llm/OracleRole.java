package com.proofmend.llm;

/**
 * The four kinds of request the repair loop sends to the oracle.
 *
 * REPAIR   - full corrected file for the current errors
 * EXTEND   - full file with new, thematically consistent results added
 * DOCUMENT - full file with documentation added, behaviour unchanged
 * PATCH    - unified diff fixing the current errors (patch-graph mode)
 */
public enum OracleRole {
    REPAIR,
    EXTEND,
    DOCUMENT,
    PATCH
}
