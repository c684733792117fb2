package com.demo.loanmodel.features;

import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.exception.MissingColumnException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Normalizes the categorical text columns, then appends each provider's column in order. */
@Slf4j
@Component
public class FeatureDeriver {

    private static final List<String> TEXT_COLUMNS = List.of(LoanColumns.EDUCATION, LoanColumns.LOAN_STATUS);

    private final List<DerivedColumnProvider> providers;

    public FeatureDeriver(List<DerivedColumnProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public DerivedDataset derive(LoanTable table) {
        LoanTable out = table;
        for (String col : TEXT_COLUMNS) {
            if (!out.hasColumn(col)) throw new MissingColumnException(col);
            List<String> cleaned = new ArrayList<>(out.rowCount());
            for (int i = 0; i < out.rowCount(); i++) {
                cleaned.add(SynonymSet.normalize(out.text(col, i)));
            }
            out = out.withColumn(col, cleaned);
        }

        for (DerivedColumnProvider p : providers) {
            for (String req : p.requiredColumns()) {
                if (!out.hasColumn(req)) throw new MissingColumnException(req);
            }
            out = out.withColumn(p.column(), p.compute(out));
        }

        DerivedDataset derived = new DerivedDataset(out, LabelDistribution.of(DerivedDataset.labelsOf(out)));
        LabelDistribution dist = derived.distribution();
        log.info("Loan status distribution: {}", dist);
        if (dist.isDegenerate()) {
            log.warn("Only one class present in {} (expected 'Approved'/'Rejected' values); accuracy check will be skipped",
                    LoanColumns.LOAN_STATUS_NUM);
        }
        return derived;
    }
}
