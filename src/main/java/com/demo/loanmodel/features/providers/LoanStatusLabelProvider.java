package com.demo.loanmodel.features.providers;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.features.DerivedColumnProvider;
import com.demo.loanmodel.features.SynonymSet;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

/** Approved = 1, anything else (Rejected, blank, typos) = 0. */
@Component
@Order(3)
public class LoanStatusLabelProvider implements DerivedColumnProvider {
    private static final Set<String> REQ = Set.of(LoanColumns.LOAN_STATUS);

    @Override public String column() { return LoanColumns.LOAN_STATUS_NUM; }
    @Override public Set<String> requiredColumns() { return REQ; }

    @Override
    public List<Integer> compute(LoanTable table) {
        List<Integer> out = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            out.add(SynonymSet.APPROVAL.indicator(table.text(LoanColumns.LOAN_STATUS, i)));
        }
        return out;
    }
}
