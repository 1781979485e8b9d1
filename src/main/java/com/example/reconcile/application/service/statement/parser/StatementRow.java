package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.StatementField;

import java.util.List;
import java.util.Map;

/**
 * One data row with its resolved logical columns.
 */
public final class StatementRow {

    private final int rowNumber;
    private final List<Object> cells;
    private final Map<StatementField, Integer> columns;

    StatementRow(int rowNumber, List<Object> cells, Map<StatementField, Integer> columns) {
        this.rowNumber = rowNumber;
        this.cells = cells;
        this.columns = columns;
    }

    /**
     * @return 1-based row number in the source file
     */
    public int rowNumber() {
        return rowNumber;
    }

    public boolean has(StatementField field) {
        return columns.containsKey(field);
    }

    public Object raw(StatementField field) {
        Integer index = columns.get(field);
        if (index == null || index >= cells.size()) {
            return null;
        }
        return cells.get(index);
    }

    public String text(StatementField field) {
        return StatementValues.text(raw(field));
    }

    public String firstCellText() {
        return cells.isEmpty() ? null : StatementValues.text(cells.get(0));
    }
}
