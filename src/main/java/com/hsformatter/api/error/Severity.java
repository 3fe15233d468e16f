package com.hsformatter.api.error;

public enum Severity {
    ERROR,    // Input could not be formatted, no output produced
    WARNING,  // Style violation, fixed or requiring attention
    ADVISORY  // Suggestion left to the author
}
