package com.civicintel.dumping.service;

import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

/**
 * A modeled table breaks one of the star schema invariants. Always fatal:
 * the build stops before any file is written.
 */
@Getter
public abstract class StarSchemaValidationException extends RuntimeException implements ExitCodeGenerator {

    static final int EXIT_CODE = 2;

    /** Short name of the failed gate, e.g. "fact-grain". */
    private final String check;

    /** Number of offending rows. */
    private final long violations;

    protected StarSchemaValidationException(String check, long violations, String message) {
        super(message);
        this.check = check;
        this.violations = violations;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
