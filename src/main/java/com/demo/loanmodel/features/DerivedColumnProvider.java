package com.demo.loanmodel.features;

import com.demo.loanmodel.dataset.LoanTable;

import java.util.List;
import java.util.Set;

public interface DerivedColumnProvider {

    String column();
    Set<String> requiredColumns();

    /** One value per row, in table order. */
    List<? extends Number> compute(LoanTable table);
}
