package com.demo.loanmodel.ranges;

import com.demo.loanmodel.TestDatasets;
import com.demo.loanmodel.dataset.DatasetLoader;
import com.demo.loanmodel.dataset.LoanColumns;
import com.demo.loanmodel.dataset.LoanTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RangeExtractorTest {

    @TempDir
    Path dir;

    private Map<String, InputRange> extract() {
        LoanTable raw = new DatasetLoader().load(TestDatasets.writeCsv(dir, TestDatasets.THREE_ROWS));
        return new RangeExtractor().extract(TestDatasets.featureDeriver().derive(raw).table());
    }

    @Test
    void coversRawAndDerivedNumericColumnsInTableOrder() {
        assertThat(extract().keySet()).containsExactly(
                LoanColumns.NO_OF_DEPENDENTS,
                LoanColumns.INCOME_ANNUM,
                LoanColumns.LOAN_AMOUNT,
                LoanColumns.LOAN_TERM,
                LoanColumns.CIBIL_SCORE,
                LoanColumns.RESIDENTIAL_ASSETS_VALUE,
                LoanColumns.COMMERCIAL_ASSETS_VALUE,
                LoanColumns.LUXURY_ASSETS_VALUE,
                LoanColumns.BANK_ASSET_VALUE,
                LoanColumns.EDUCATION_NUM,
                LoanColumns.ASSETS_TOTAL);
    }

    @Test
    void skipsIdentifierLabelAndTextColumns() {
        assertThat(extract()).doesNotContainKeys(
                LoanColumns.LOAN_ID, LoanColumns.LOAN_STATUS_NUM,
                LoanColumns.EDUCATION, LoanColumns.LOAN_STATUS, "self_employed");
    }

    @Test
    void smallIntegerColumnsStepByOneOthersByCurrencyUnit() {
        Map<String, InputRange> ranges = extract();

        assertThat(ranges.get(LoanColumns.NO_OF_DEPENDENTS)).isEqualTo(new InputRange(0, 2, 1));
        assertThat(ranges.get(LoanColumns.LOAN_TERM)).isEqualTo(new InputRange(8, 12, 1));
        assertThat(ranges.get(LoanColumns.CIBIL_SCORE)).isEqualTo(new InputRange(600, 750, 1));
        assertThat(ranges.get(LoanColumns.INCOME_ANNUM)).isEqualTo(new InputRange(300000, 500000, 100000));
        assertThat(ranges.get(LoanColumns.ASSETS_TOTAL)).isEqualTo(new InputRange(0, 300000, 100000));
        assertThat(ranges.get(LoanColumns.EDUCATION_NUM)).isEqualTo(new InputRange(0, 1, 100000));
    }

    @Test
    void fractionalBoundsAreTruncated() {
        LoanTable table = LoanTable.of(List.of("bank_asset_value"),
                List.of(List.of("-2.7"), List.of("1999.9")));

        assertThat(new RangeExtractor().extract(table))
                .containsEntry("bank_asset_value", new InputRange(-2, 1999, 100000));
    }
}
