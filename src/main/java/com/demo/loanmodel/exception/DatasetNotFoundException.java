package com.demo.loanmodel.exception;

import java.nio.file.Path;

public class DatasetNotFoundException extends LoanModelExportException {

    public DatasetNotFoundException(Path path) {
        super("Dataset not found: " + path.toAbsolutePath()
                + ". Place the loan CSV there or set app.export.input");
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
