package com.demo.loanmodel.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base of every failure that aborts an export run.
 * Spring Boot reads {@link #getExitCode()} from the cause chain when the runner fails,
 * so each subtype terminates the process with its own status.
 */
public abstract class LoanModelExportException extends RuntimeException implements ExitCodeGenerator {

    protected LoanModelExportException(String message) {
        super(message);
    }

    protected LoanModelExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
