package com.demo.loanmodel.exception;

/** A cell of a numeric column is empty or not a finite number. */
public class NumericConversionException extends LoanModelExportException {

    public NumericConversionException(String column, int row, String value) {
        super(String.format("Column '%s' row %d: '%s' is not a number", column, row + 1, value));
    }

    @Override
    public int getExitCode() {
        return 4;
    }
}
