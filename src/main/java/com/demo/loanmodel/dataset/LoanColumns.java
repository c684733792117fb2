package com.demo.loanmodel.dataset;

import java.util.List;

/** Column names of the loan approval CSV and of the columns derived from it. */
public final class LoanColumns {

    public static final String LOAN_ID = "loan_id";
    public static final String NO_OF_DEPENDENTS = "no_of_dependents";
    public static final String EDUCATION = "education";
    public static final String INCOME_ANNUM = "income_annum";
    public static final String LOAN_AMOUNT = "loan_amount";
    public static final String LOAN_TERM = "loan_term";
    public static final String CIBIL_SCORE = "cibil_score";
    public static final String RESIDENTIAL_ASSETS_VALUE = "residential_assets_value";
    public static final String COMMERCIAL_ASSETS_VALUE = "commercial_assets_value";
    public static final String LUXURY_ASSETS_VALUE = "luxury_assets_value";
    public static final String BANK_ASSET_VALUE = "bank_asset_value";
    public static final String LOAN_STATUS = "loan_status";

    // derived
    public static final String EDUCATION_NUM = "education_num";
    public static final String ASSETS_TOTAL = "assets_total";
    public static final String LOAN_STATUS_NUM = "loan_status_num";

    public static final List<String> ASSET_COMPONENTS = List.of(
            RESIDENTIAL_ASSETS_VALUE,
            COMMERCIAL_ASSETS_VALUE,
            LUXURY_ASSETS_VALUE,
            BANK_ASSET_VALUE
    );

    private LoanColumns() {
    }
}
