package com.demo.loanmodel.normalize;

import com.demo.loanmodel.dataset.LoanColumns;

/**
 * The six model features in the order the client builds its query vector.
 * Each entry maps a table column to the key the client looks up in {@code normalization_ranges}.
 * Reordering or renaming an entry breaks the client.
 */
public enum FeatureColumn {

    DEPENDENTS(LoanColumns.NO_OF_DEPENDENTS, "dependents", false),
    EDUCATION(LoanColumns.EDUCATION_NUM, "education", false),
    INCOME(LoanColumns.INCOME_ANNUM, "income", true),
    LOAN_AMOUNT(LoanColumns.LOAN_AMOUNT, "loan_amount", true),
    CIBIL(LoanColumns.CIBIL_SCORE, "cibil", false),
    ASSETS_TOTAL(LoanColumns.ASSETS_TOTAL, "assets_total", true);

    /** Currency columns are expressed in lakhs (100,000 units). */
    public static final double CURRENCY_UNIT = 100_000.0;

    private final String column;
    private final String clientKey;
    private final boolean currency;

    FeatureColumn(String column, String clientKey, boolean currency) {
        this.column = column;
        this.clientKey = clientKey;
        this.currency = currency;
    }

    public String column() {
        return column;
    }

    public String clientKey() {
        return clientKey;
    }

    public boolean currency() {
        return currency;
    }

    /** Value in model units, before min-max scaling. */
    public double toModelUnits(double raw) {
        return currency ? raw / CURRENCY_UNIT : raw;
    }
}
