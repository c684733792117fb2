package com.demo.loanmodel.features.providers;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.features.DerivedColumnProvider;
import com.demo.loanmodel.features.SynonymSet;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
@Order(1)
public class EducationIndicatorProvider implements DerivedColumnProvider {
    private static final Set<String> REQ = Set.of(LoanColumns.EDUCATION);

    @Override public String column() { return LoanColumns.EDUCATION_NUM; }
    @Override public Set<String> requiredColumns() { return REQ; }

    @Override
    public List<Integer> compute(LoanTable table) {
        List<Integer> out = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            out.add(SynonymSet.GRADUATE.indicator(table.text(LoanColumns.EDUCATION, i)));
        }
        return out;
    }
}
