package de.anton.spectro.processor.spectro_processor.service;

import de.anton.spectro.processor.spectro_processor.model.TableRenderer;

/**
 * Immutable rendering settings for a processing run.
 */
public record ProcessingConfiguration(
    int columnWidth,     // characters per output column
    int decimals,        // decimal places of the values
    boolean setupHeader  // emit the user/date/comments block when such parameters are present
) {
    public ProcessingConfiguration {
        if (columnWidth < 1) {
            throw new IllegalArgumentException("Column width must be positive: " + columnWidth);
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("Decimal places cannot be negative: " + decimals);
        }
    }

    public static ProcessingConfiguration defaults() {
        return new ProcessingConfiguration(TableRenderer.DEFAULT_COLUMN_WIDTH, TableRenderer.DEFAULT_DECIMALS, true);
    }

    public ProcessingConfiguration withColumnWidth(int width) {
        return new ProcessingConfiguration(width, decimals, setupHeader);
    }

    public TableRenderer renderer() {
        return new TableRenderer(columnWidth, decimals);
    }
}
