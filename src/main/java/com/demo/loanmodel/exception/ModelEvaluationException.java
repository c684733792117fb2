package com.demo.loanmodel.exception;

public class ModelEvaluationException extends LoanModelExportException {

    public ModelEvaluationException(String message) {
        super(message);
    }

    public ModelEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 6;
    }
}
