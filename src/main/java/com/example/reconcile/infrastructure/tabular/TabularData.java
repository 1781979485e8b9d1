package com.example.reconcile.infrastructure.tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows of a statement sheet in file order. Cells are {@link String}, {@link java.math.BigDecimal},
 * {@link java.time.LocalDate} or {@code null} for empty cells.
 *
 * @param rows row cells, ragged rows allowed
 */
public record TabularData(List<List<Object>> rows) {

    public TabularData {
        List<List<Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int size() {
        return rows.size();
    }

    public List<Object> row(int index) {
        return rows.get(index);
    }

    public static boolean isBlank(List<Object> row) {
        for (Object cell : row) {
            if (cell != null && !cell.toString().isBlank()) {
                return false;
            }
        }
        return true;
    }
}
