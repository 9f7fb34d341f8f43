package com.vidnyan.flowc.domain.analysis;

/**
 * Finding severity levels.
 */
public enum Severity {
    BLOCKER,  // Structural - conversion cannot proceed
    ERROR,    // Non-fatal error - conversion continues without the affected code
    WARN,     // Reported, conversion unaffected or degraded
    INFO      // Informational only
}
