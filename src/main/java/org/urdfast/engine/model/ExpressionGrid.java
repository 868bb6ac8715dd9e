package org.urdfast.engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular grid of expression strings: the cells of a matrix-valued
 * result, or a single cell for a scalar result.
 */
public record ExpressionGrid(List<List<String>> rows) {

    public ExpressionGrid {
        Objects.requireNonNull(rows, "Rows cannot be null");
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new IllegalArgumentException("Expression grid cannot be empty");
        }
        int columns = rows.get(0).size();
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns) {
                throw new IllegalArgumentException(
                        "Ragged expression grid: expected " + columns + " columns, got " + row.size());
            }
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    public static ExpressionGrid scalar(String expression) {
        return new ExpressionGrid(List.of(List.of(expression)));
    }

    /**
     * Builds a grid from row-major cells.
     */
    public static ExpressionGrid of(int rowCount, int columnCount, List<String> cells) {
        if (cells.size() != rowCount * columnCount) {
            throw new IllegalArgumentException(
                    "Expected " + rowCount * columnCount + " cells, got " + cells.size());
        }
        List<List<String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            rows.add(cells.subList(r * columnCount, (r + 1) * columnCount));
        }
        return new ExpressionGrid(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.get(0).size();
    }

    public boolean isScalar() {
        return rowCount() == 1 && columnCount() == 1;
    }

    public String cell(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * @return All cells in row-major order
     */
    public List<String> cells() {
        List<String> cells = new ArrayList<>(rowCount() * columnCount());
        rows.forEach(cells::addAll);
        return cells;
    }

    /**
     * @return A grid of the same shape holding {@code cells} (row-major)
     */
    public ExpressionGrid withCells(List<String> cells) {
        return of(rowCount(), columnCount(), cells);
    }
}
