package com.demo.loanmodel.exception;

import java.nio.file.Path;

public class DatasetReadException extends LoanModelExportException {

    public DatasetReadException(Path path, Throwable cause) {
        super("Could not read dataset " + path + ": " + cause.getMessage(), cause);
    }

    public DatasetReadException(Path path, String reason) {
        super("Could not read dataset " + path + ": " + reason);
    }

    @Override
    public int getExitCode() {
        return 3;
    }
}
