package com.demo.loanmodel.features;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;

public record DerivedDataset(LoanTable table, LabelDistribution distribution) {

    public int[] labels() {
        return labelsOf(table);
    }

    static int[] labelsOf(LoanTable table) {
        double[] raw = table.numeric(LoanColumns.LOAN_STATUS_NUM);
        int[] out = new int[raw.length];
        for (int i = 0; i < raw.length; i++) out[i] = (int) raw[i];
        return out;
    }
}
