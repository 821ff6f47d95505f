package de.anton.spectro.processor.spectro_processor.view;

import de.anton.spectro.processor.spectro_processor.model.Channel;
import de.anton.spectro.processor.spectro_processor.model.Trace;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Renders the corrected signal of every channel against its x-axis as a line chart and saves it as PNG.
 */
public class ChannelChartWriter {

    private static final Logger logger = LoggerFactory.getLogger(ChannelChartWriter.class);

    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 600;

    private final int width;
    private final int height;

    public ChannelChartWriter() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public ChannelChartWriter(int width, int height) {
        this.width = width;
        this.height = height;
    }

    /**
     * @return One series per channel, named after the channel; non-finite points are skipped.
     */
    public XYSeriesCollection createDataset(List<Channel> channels) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        for (Channel channel : channels) {
            double[] x = channel.getTrace(Trace.X);
            double[] y = channel.getTrace(Trace.Y);
            // autoSort off keeps the measurement order, duplicates allowed for repeated x values
            XYSeries series = new XYSeries(channel.getName(), false, true);
            for (int i = 0; i < y.length; i++) {
                if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                    series.add(x[i], y[i]);
                }
            }
            dataset.addSeries(series);
        }
        return dataset;
    }

    public JFreeChart createChart(String title, String xLabel, List<Channel> channels) {
        JFreeChart chart = ChartFactory.createXYLineChart(
                title, xLabel, "signal", createDataset(channels),
                PlotOrientation.VERTICAL, true, false, false);

        XYPlot plot = (XYPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));
        plot.setRenderer(new XYLineAndShapeRenderer(true, true));
        return chart;
    }

    /**
     * @throws IOException if the PNG cannot be written.
     */
    public void write(String title, String xLabel, List<Channel> channels, Path file) throws IOException {
        Objects.requireNonNull(file, "Output file cannot be null.");
        JFreeChart chart = createChart(title, xLabel, channels);
        ChartUtils.saveChartAsPNG(file.toFile(), chart, width, height);
        logger.info("Chart of {} channel(s) written to {}", channels.size(), file);
    }
}
