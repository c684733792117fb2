package com.demo.loanmodel.exception;

public class MissingColumnException extends LoanModelExportException {

    public MissingColumnException(String column) {
        super("Required column '" + column + "' is missing from the dataset");
    }

    @Override
    public int getExitCode() {
        return 4;
    }
}
