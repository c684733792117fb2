package com.demo.loanmodel.dataset;

import com.demo.loanmodel.exception.MissingColumnException;
import com.demo.loanmodel.exception.NumericConversionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * In-memory loan dataset indexed by column name.
 * <p>
 * Raw cells stay as the text read from the file; derived columns may hold numbers.
 * Instances never change: {@link #withColumn} returns a new table sharing the untouched columns.
 */
public final class LoanTable {

    // plain decimal notation only; no hex floats or f/d type suffixes
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private LoanTable(Map<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    /**
     * Builds a table from a header and rows of cells; short rows are padded with empty cells
     * and cells past the header width are ignored.
     *
     * @throws IllegalArgumentException when two header names are equal
     */
    public static LoanTable of(List<String> header, List<List<String>> rows) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        for (int c = 0; c < header.size(); c++) {
            if (cols.containsKey(header.get(c))) {
                throw new IllegalArgumentException("Duplicate column '" + header.get(c) + "'");
            }
            List<Object> cells = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                cells.add(c < row.size() && row.get(c) != null ? row.get(c) : "");
            }
            cols.put(header.get(c), Collections.unmodifiableList(cells));
        }
        return new LoanTable(Collections.unmodifiableMap(cols), rows.size());
    }

    public int rowCount() {
        return rowCount;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> column(String name) {
        List<Object> cells = columns.get(name);
        if (cells == null) throw new MissingColumnException(name);
        return cells;
    }

    public String text(String name, int row) {
        Object v = column(name).get(row);
        return v == null ? "" : v.toString();
    }

    /** Numeric view of a column; fails on the first cell that is empty or not a finite number. */
    public double[] numeric(String name) {
        List<Object> cells = column(name);
        double[] out = new double[cells.size()];
        for (int i = 0; i < out.length; i++) {
            Double d = toDouble(cells.get(i));
            if (d == null) throw new NumericConversionException(name, i, String.valueOf(cells.get(i)));
            out[i] = d;
        }
        return out;
    }

    /** True when the table has rows and every cell of the column reads as a finite number. */
    public boolean isNumeric(String name) {
        List<Object> cells = columns.get(name);
        if (cells == null || cells.isEmpty()) return false;
        for (Object cell : cells) {
            if (toDouble(cell) == null) return false;
        }
        return true;
    }

    /** Returns a copy with {@code name} replaced, or appended when the column does not exist yet. */
    public LoanTable withColumn(String name, List<?> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d values, table has %d rows", name, values.size(), rowCount));
        }
        Map<String, List<Object>> cols = new LinkedHashMap<>(columns);
        cols.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new LoanTable(Collections.unmodifiableMap(cols), rowCount);
    }

    private static Double toDouble(Object cell) {
        if (cell instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String s = cell == null ? "" : cell.toString().trim();
        if (!DECIMAL.matcher(s).matches()) return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
