package de.anton.spectro.processor.spectro_processor.view;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelChartWriterTest {

    private final ChannelChartWriter writer = new ChannelChartWriter();

    @Test
    void oneSeriesPerChannelWithoutNonFinitePoints() {
        Channel sample = new Channel("sample", new double[] {1, 2, 3}, new double[] {0.5, Double.NaN, 0.7});
        Channel reference = new Channel("reference", new double[] {1, 2, 3}, new double[] {0.1, 0.2, 0.3});

        XYSeriesCollection dataset = writer.createDataset(List.of(sample, reference));

        assertEquals(2, dataset.getSeriesCount());
        assertEquals("sample", dataset.getSeries(0).getKey());
        assertEquals(2, dataset.getSeries(0).getItemCount());
        assertEquals(3, dataset.getSeries(1).getItemCount());
    }

    @Test
    void measurementOrderIsKept() {
        Channel sample = new Channel("sample", new double[] {3, 1, 2}, new double[] {1, 2, 3});

        XYSeriesCollection dataset = writer.createDataset(List.of(sample));

        assertEquals(3.0, dataset.getSeries(0).getX(0).doubleValue(), 1e-9);
    }

    @Test
    void chartCarriesAxisLabel() {
        Channel sample = new Channel("sample", new double[] {1, 2}, new double[] {1, 2});

        JFreeChart chart = writer.createChart("CD/Temperature", "temp", List.of(sample));

        assertEquals("temp", ((XYPlot) chart.getPlot()).getDomainAxis().getLabel());
        assertEquals("CD/Temperature", chart.getTitle().getText());
    }
}
