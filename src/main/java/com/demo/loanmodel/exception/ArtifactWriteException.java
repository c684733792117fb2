package com.demo.loanmodel.exception;

import java.nio.file.Path;

/** The artifact could not be serialized or moved into place; any previous file is left as it was. */
public class ArtifactWriteException extends LoanModelExportException {

    public ArtifactWriteException(Path target, Throwable cause) {
        super("Failed to write " + target + ": " + cause.getMessage(), cause);
    }

    @Override
    public int getExitCode() {
        return 7;
    }
}
