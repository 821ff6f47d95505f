package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns corrected channels into the fixed-width, R-readable table: a header row with a blank first
 * cell and {@code s_}/{@code r_} prefixed labels, then one row per data point starting with the
 * zero-based row index.
 */
public class TableRenderer {

    private static final Logger logger = LoggerFactory.getLogger(TableRenderer.class);

    public static final int DEFAULT_COLUMN_WIDTH = 12;
    public static final int DEFAULT_DECIMALS = 3;

    private final int columnWidth;
    private final int decimals;

    public TableRenderer() {
        this(DEFAULT_COLUMN_WIDTH, DEFAULT_DECIMALS);
    }

    public TableRenderer(int columnWidth, int decimals) {
        if (columnWidth < 1) {
            throw new IllegalArgumentException("Column width must be positive: " + columnWidth);
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("Decimal places cannot be negative: " + decimals);
        }
        this.columnWidth = columnWidth;
        this.decimals = decimals;
    }

    /** Prefix of a channel's columns: first letter of its name and an underscore. */
    public static String prefixFor(Channel channel) {
        return channel.getName().substring(0, 1).toLowerCase(Locale.ROOT) + "_";
    }

    /**
     * Collects the requested arrays of every channel, channel by channel.
     *
     * @throws IllegalStateException if a requested trace was never produced for a channel.
     */
    public DataTable tabulate(List<Channel> channels, List<OutputColumn> columns) {
        List<String> labels = new ArrayList<>();
        List<double[]> values = new ArrayList<>();
        for (Channel channel : channels) {
            String prefix = prefixFor(channel);
            for (OutputColumn column : columns) {
                labels.add(prefix + column.label());
                values.add(channel.getTrace(column.trace()));
            }
        }
        logger.debug("Tabulated {} columns for {} channel(s)", labels.size(), channels.size());
        return new DataTable(labels, values);
    }

    public String render(List<Channel> channels, List<OutputColumn> columns) {
        return render(tabulate(channels, columns));
    }

    public String render(DataTable table) {
        String textFormat = "%" + columnWidth + "s";
        String indexFormat = "%" + columnWidth + "d";
        String valueFormat = "%" + columnWidth + "." + decimals + "f";

        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, textFormat, " "));
        for (String label : table.getLabels()) {
            out.append(String.format(Locale.ROOT, textFormat, label));
        }
        out.append('\n');

        for (int row = 0; row < table.rowCount(); row++) {
            out.append(String.format(Locale.ROOT, indexFormat, row));
            for (int col = 0; col < table.columnCount(); col++) {
                out.append(String.format(Locale.ROOT, valueFormat, table.value(row, col)));
            }
            out.append('\n');
        }
        return out.toString();
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    public int getDecimals() {
        return decimals;
    }
}
