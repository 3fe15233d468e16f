package com.hsformatter.api.error;

/**
 * Every finding the formatter and linter can report, with its default severity
 * and whether the formatter rewrites the offending code itself.
 */
public enum DiagnosticKind {
    ENCODING_ERROR(Severity.ERROR, Category.FATAL),
    PARSE_ERROR(Severity.ERROR, Category.FATAL),
    IDEMPOTENCE_VIOLATION(Severity.ERROR, Category.FATAL),

    INDENTATION(Severity.WARNING, Category.MECHANICAL),
    ALIGNMENT(Severity.WARNING, Category.MECHANICAL),
    EXPORT_LIST_LAYOUT(Severity.WARNING, Category.MECHANICAL),
    IMPORT_ORDERING(Severity.WARNING, Category.MECHANICAL),
    PRAGMA_PLACEMENT(Severity.WARNING, Category.MECHANICAL),
    DERIVING_LAYOUT(Severity.WARNING, Category.MECHANICAL),
    TRAILING_WHITESPACE(Severity.WARNING, Category.MECHANICAL),

    MISSING_EXPORT_LIST(Severity.WARNING, Category.ADVISORY),
    MISSING_IMPORT_LIST(Severity.WARNING, Category.ADVISORY),
    QUALIFICATION_CANDIDATE(Severity.ADVISORY, Category.ADVISORY),
    NAMING_VIOLATION(Severity.ADVISORY, Category.ADVISORY),
    ABBREVIATION_CASING(Severity.ADVISORY, Category.ADVISORY),
    OPERATOR_DEFINITION(Severity.ADVISORY, Category.ADVISORY),
    MISSING_SIGNATURE(Severity.WARNING, Category.ADVISORY),
    RECORD_IN_SUM_TYPE(Severity.ADVISORY, Category.ADVISORY),
    MISSING_STRICTNESS_ANNOTATION(Severity.ADVISORY, Category.ADVISORY),
    UNNECESSARY_DERIVE(Severity.ADVISORY, Category.ADVISORY),
    MISSING_DERIVING_STRATEGY(Severity.ADVISORY, Category.ADVISORY),
    POINT_FREE_CANDIDATE(Severity.ADVISORY, Category.ADVISORY),
    EXCESSIVE_COMPOSITION(Severity.ADVISORY, Category.ADVISORY),
    LONG_LINE(Severity.ADVISORY, Category.ADVISORY);

    public enum Category {
        FATAL,      // Input rejected
        MECHANICAL, // Rewritten by the formatter
        ADVISORY    // Reported only
    }

    private final Severity defaultSeverity;
    private final Category category;

    DiagnosticKind(Severity defaultSeverity, Category category) {
        this.defaultSeverity = defaultSeverity;
        this.category = category;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isMechanical() {
        return category == Category.MECHANICAL;
    }

    public boolean isAdvisory() {
        return category == Category.ADVISORY;
    }
}
