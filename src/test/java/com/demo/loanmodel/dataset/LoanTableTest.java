package com.demo.loanmodel.dataset;

import com.demo.loanmodel.exception.MissingColumnException;
import com.demo.loanmodel.exception.NumericConversionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoanTableTest {

    private final LoanTable table = LoanTable.of(
            List.of("id", "income", "status"),
            List.of(List.of("1", " 1200 ", "Approved"),
                    List.of("2", "800.5", "Rejected")));

    @Test
    void numericViewParsesTrimmedCells() {
        assertThat(table.numeric("income")).containsExactly(1200.0, 800.5);
        assertThat(table.isNumeric("income")).isTrue();
        assertThat(table.isNumeric("status")).isFalse();
    }

    @Test
    void nonNumericCellNamesColumnAndRow() {
        assertThatThrownBy(() -> table.numeric("status"))
                .isInstanceOf(NumericConversionException.class)
                .hasMessageContaining("'status' row 1")
                .hasMessageContaining("Approved");
    }

    @Test
    void unknownColumnIsMissing() {
        assertThatThrownBy(() -> table.column("cibil_score"))
                .isInstanceOf(MissingColumnException.class);
    }

    @Test
    void withColumnLeavesOriginalUntouched() {
        LoanTable extended = table.withColumn("flag", List.of(1, 0));

        assertThat(extended.columnNames()).containsExactly("id", "income", "status", "flag");
        assertThat(extended.numeric("flag")).containsExactly(1.0, 0.0);
        assertThat(table.hasColumn("flag")).isFalse();
    }

    @Test
    void withColumnRejectsWrongLength() {
        assertThatThrownBy(() -> table.withColumn("flag", List.of(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void typeSuffixesAndHexFloatsAreNotNumbers() {
        LoanTable odd = LoanTable.of(List.of("a", "b", "c", "d"),
                List.of(List.of("12f", "3d", "0x1p3", "-1.5e3"),
                        List.of("1", "2", "3", ".5")));

        assertThat(odd.isNumeric("a")).isFalse();
        assertThat(odd.isNumeric("b")).isFalse();
        assertThat(odd.isNumeric("c")).isFalse();
        assertThat(odd.numeric("d")).containsExactly(-1500.0, 0.5);
        assertThatThrownBy(() -> odd.numeric("a"))
                .isInstanceOf(NumericConversionException.class)
                .hasMessageContaining("12f");
    }

    @Test
    void duplicateHeaderNamesAreRejected() {
        assertThatThrownBy(() -> LoanTable.of(List.of("a", "a"), List.of(List.of("1", "2"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'a'");
    }
}
