package com.demo.loanmodel.ranges;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
public class RangeExtractor {

    static final long CURRENCY_STEP = 100_000L;

    private static final Set<String> EXCLUDED = Set.of(
            LoanColumns.LOAN_ID,
            LoanColumns.LOAN_STATUS_NUM,
            LoanColumns.EDUCATION,
            LoanColumns.LOAN_STATUS
    );

    private static final Set<String> UNIT_STEP = Set.of(
            LoanColumns.NO_OF_DEPENDENTS,
            LoanColumns.LOAN_TERM,
            LoanColumns.CIBIL_SCORE
    );

    /** Ranges for every numeric column, raw and derived, in table order. */
    public Map<String, InputRange> extract(LoanTable table) {
        Map<String, InputRange> out = new LinkedHashMap<>();
        for (String col : table.columnNames()) {
            if (EXCLUDED.contains(col) || !table.isNumeric(col)) continue;

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : table.numeric(col)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            long step = UNIT_STEP.contains(col) ? 1L : CURRENCY_STEP;
            out.put(col, new InputRange((long) min, (long) max, step));
        }
        return out;
    }
}
