package de.anton.spectro.processor.spectro_processor.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableRendererTest {

    private final List<OutputColumn> columns = List.of(
            OutputColumn.of("x", Trace.X),
            OutputColumn.of("raw", Trace.RAW_SIGNAL));

    @Test
    void rendersFixedWidthTable() {
        Channel sample = new Channel("sample", new double[] {0.0, 1.5}, new double[] {-10.0, 2.25});

        String table = new TableRenderer().render(List.of(sample), columns);

        String[] lines = table.split("\n");
        assertEquals(3, lines.length);
        assertEquals("                     s_x       s_raw", lines[0]);
        assertEquals("           0       0.000     -10.000", lines[1]);
        assertEquals("           1       1.500       2.250", lines[2]);
    }

    @Test
    void channelsArePrefixedInOrder() {
        Channel sample = new Channel("sample", new double[] {1}, new double[] {2});
        Channel reference = new Channel("reference", new double[] {1}, new double[] {3});

        DataTable table = new TableRenderer().tabulate(List.of(sample, reference), columns);

        assertEquals(List.of("s_x", "s_raw", "r_x", "r_raw"), table.getLabels());
        assertEquals(3.0, table.value(0, 3), 1e-9);
    }

    @Test
    void columnWidthIsConfigurable() {
        Channel sample = new Channel("sample", new double[] {1}, new double[] {2});

        String table = new TableRenderer(8, 1).render(List.of(sample), columns);

        assertEquals("             s_x   s_raw\n       0     1.0     2.0\n", table);
    }

    @Test
    void missingTraceIsReported() {
        Channel sample = new Channel("sample", new double[] {1}, new double[] {2});

        assertThrows(IllegalStateException.class,
                () -> new TableRenderer().tabulate(List.of(sample), List.of(OutputColumn.of("MME", Trace.MME))));
    }
}
