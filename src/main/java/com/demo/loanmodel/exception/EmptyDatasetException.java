package com.demo.loanmodel.exception;

public class EmptyDatasetException extends LoanModelExportException {

    public EmptyDatasetException() {
        super("Dataset contains no records");
    }

    @Override
    public int getExitCode() {
        return 5;
    }
}
