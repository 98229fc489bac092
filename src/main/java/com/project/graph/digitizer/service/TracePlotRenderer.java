package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.Sample;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartFrame;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import java.awt.Color;
import java.awt.GraphicsEnvironment;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import javax.swing.JFrame;
import javax.swing.SwingUtilities;

/** Line chart of a digitized trace. Purely for display; nothing flows back. */
public class TracePlotRenderer {

    static final String TITLE = "Normalized Graph";

    public JFreeChart createChart(List<Sample> samples) {
        XYSeries series = new XYSeries("Trace", true, false);
        for (Sample s : samples) {
            series.add(s.x(), s.y());
        }
        JFreeChart chart = ChartFactory.createXYLineChart(TITLE, "X-axis", "Normalized Amplitude (0-1)",
                new XYSeriesCollection(series), PlotOrientation.VERTICAL, false, true, false);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.getRenderer().setSeriesPaint(0, new Color(0, 90, 200));
        ((NumberAxis) plot.getRangeAxis()).setRange(0.0, 1.0);
        return chart;
    }

    public byte[] toPng(List<Sample> samples, int width, int height) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ChartUtils.writeChartAsPNG(baos, createChart(samples), width, height);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode plot", e);
        }
    }

    /**
     * Opens a window with the chart and blocks until it is closed. Needs a display.
     *
     * @throws IllegalStateException when no window can be opened
     */
    public void show(List<Sample> samples) throws InterruptedException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IllegalStateException("Cannot show a plot in a headless environment");
        }
        JFreeChart chart = createChart(samples);
        CountDownLatch closed = new CountDownLatch(1);
        try {
            SwingUtilities.invokeAndWait(() -> {
                ChartFrame frame = new ChartFrame(TITLE, chart);
                frame.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
                frame.addWindowListener(new WindowAdapter() {
                    @Override
                    public void windowClosed(WindowEvent e) {
                        closed.countDown();
                    }
                });
                frame.setSize(1000, 600);
                frame.setLocationRelativeTo(null);
                frame.setVisible(true);
            });
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Cannot open plot window: " + e.getCause().getMessage(), e.getCause());
        }
        closed.await();
    }
}
