package com.demo.loanmodel.features.providers;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.features.DerivedColumnProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

/** Residential + commercial + luxury + bank assets. No imputation: a blank component aborts the run. */
@Component
@Order(2)
public class AssetsTotalProvider implements DerivedColumnProvider {
    private static final Set<String> REQ = new LinkedHashSet<>(LoanColumns.ASSET_COMPONENTS);

    @Override public String column() { return LoanColumns.ASSETS_TOTAL; }
    @Override public Set<String> requiredColumns() { return Collections.unmodifiableSet(REQ); }

    @Override
    public List<Double> compute(LoanTable table) {
        double[] total = new double[table.rowCount()];
        for (String component : LoanColumns.ASSET_COMPONENTS) {
            double[] values = table.numeric(component);
            for (int i = 0; i < total.length; i++) total[i] += values[i];
        }
        List<Double> out = new ArrayList<>(total.length);
        for (double t : total) out.add(t);
        return out;
    }
}
