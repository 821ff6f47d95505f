package de.anton.spectro.processor.spectro_processor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The numeric output of a run before formatting: one labelled array per (channel, column) pair,
 * all of equal length.
 */
public final class DataTable {

    private final List<String> labels;
    private final List<double[]> columns;
    private final int rowCount;

    public DataTable(List<String> labels, List<double[]> columns) {
        if (labels.size() != columns.size()) {
            throw new IllegalArgumentException(labels.size() + " labels for " + columns.size() + " columns");
        }
        int rows = columns.isEmpty() ? 0 : columns.get(0).length;
        List<double[]> copies = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).length != rows) {
                throw new IllegalArgumentException("Column " + labels.get(i) + " has " + columns.get(i).length
                        + " rows, expected " + rows);
            }
            copies.add(columns.get(i).clone());
        }
        this.labels = List.copyOf(labels);
        this.columns = Collections.unmodifiableList(copies);
        this.rowCount = rows;
    }

    public List<String> getLabels() {
        return labels;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rowCount;
    }

    public double value(int row, int column) {
        return columns.get(column)[row];
    }

    public double[] column(int column) {
        return columns.get(column).clone();
    }
}
