package org.carball.autolysis.render;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeEvent;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws the report charts on off-screen images with Java2D and saves them as PNG.
 */
@Slf4j
public class Java2DChartRenderer implements ChartRenderer {

    private static final String FORMAT = "png";
    private static final int WIDTH = 1000;
    private static final int HEIGHT = 700;
    private static final int MARGIN = 80;

    private static final Color NOISE_COLOR = new Color(160, 160, 160);
    private static final Color[] PALETTE = {
            new Color(31, 119, 180), new Color(255, 127, 14), new Color(44, 160, 44),
            new Color(214, 39, 40), new Color(148, 103, 189), new Color(140, 86, 75),
            new Color(227, 119, 194), new Color(188, 189, 34), new Color(23, 190, 207)
    };

    @Override
    public Map<String, Path> render(Table table, ProfileReport report, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Map<String, Path> charts = new LinkedHashMap<>();

        CorrelationMatrix correlation = report.correlation();
        if (correlation != null && correlation.size() > 0) {
            charts.put(CORRELATION_CHART, save(drawHeatmap(correlation), outputDirectory, CORRELATION_CHART));
        } else {
            log.debug("No correlation data, skipping {}", CORRELATION_CHART);
        }

        List<Column> numeric = table.numericColumns();
        ClusterAssignment clusters = report.clusters();
        if (clusters != null && clusters.size() > 0 && numeric.size() >= 2) {
            charts.put(DENSITY_CHART, save(drawScatter(numeric.get(0), numeric.get(1), clusters),
                    outputDirectory, DENSITY_CHART));
        } else {
            log.debug("No clustered rows or fewer than two numeric columns, skipping {}", DENSITY_CHART);
        }

        MergeTree tree = report.mergeTree();
        if (tree != null && !tree.insufficientData()) {
            charts.put(HIERARCHY_CHART, save(drawDendrogram(tree), outputDirectory, HIERARCHY_CHART));
        } else {
            log.debug("No merge tree, skipping {}", HIERARCHY_CHART);
        }

        log.info("Rendered {} charts into {}", charts.size(), outputDirectory);
        return charts;
    }

    private static Path save(BufferedImage image, Path directory, String name) throws IOException {
        Path file = directory.resolve(name + "." + FORMAT);
        log.debug("Saving chart to {}", file.toAbsolutePath());
        if (!ImageIO.write(image, FORMAT, file.toFile())) {
            throw new IOException("No image writer available for " + FORMAT);
        }
        return file;
    }

    BufferedImage drawHeatmap(CorrelationMatrix matrix) {
        int n = matrix.size();
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas(image, "Correlation Matrix");

        int labelSpace = 140;
        int side = Math.min(WIDTH - labelSpace - MARGIN, HEIGHT - labelSpace - MARGIN / 2);
        int cell = Math.max(1, side / n);
        int left = labelSpace;
        int top = MARGIN;

        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, Math.max(8, Math.min(14, cell / 4))));
        FontMetrics metrics = g.getFontMetrics();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double r = matrix.coefficient(i, j);
                g.setColor(coolWarm(r));
                g.fillRect(left + j * cell, top + i * cell, cell, cell);
                if (cell >= 30) {
                    String text = Double.isNaN(r) ? "NaN" : String.format("%.2f", r);
                    g.setColor(Math.abs(r) > 0.6 ? Color.WHITE : Color.BLACK);
                    g.drawString(text, left + j * cell + (cell - metrics.stringWidth(text)) / 2,
                            top + i * cell + (cell + metrics.getAscent()) / 2 - 2);
                }
            }
            String name = matrix.columnNames().get(i);
            g.setColor(Color.BLACK);
            g.drawString(name, left - metrics.stringWidth(name) - 6, top + i * cell + (cell + metrics.getAscent()) / 2);
            g.drawString(name, left + i * cell + 2, top + n * cell + metrics.getHeight());
        }
        g.dispose();
        return image;
    }

    BufferedImage drawScatter(Column xColumn, Column yColumn, ClusterAssignment clusters) {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas(image, "DBSCAN Clustering");

        int n = clusters.size();
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            int row = clusters.rowIndex(i);
            xs[i] = xColumn.numericValue(row);
            ys[i] = yColumn.numericValue(row);
        }
        double[] xRange = range(xs);
        double[] yRange = range(ys);

        drawAxes(g, xColumn.getName(), yColumn.getName());
        for (int i = 0; i < n; i++) {
            int label = clusters.label(i);
            g.setColor(label == ClusterAssignment.NOISE ? NOISE_COLOR : PALETTE[label % PALETTE.length]);
            double px = MARGIN + (xs[i] - xRange[0]) / (xRange[1] - xRange[0]) * (WIDTH - 2 * MARGIN);
            double py = HEIGHT - MARGIN - (ys[i] - yRange[0]) / (yRange[1] - yRange[0]) * (HEIGHT - 2 * MARGIN);
            g.fill(new Ellipse2D.Double(px - 4, py - 4, 8, 8));
        }
        g.dispose();
        return image;
    }

    BufferedImage drawDendrogram(MergeTree tree) {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas(image, "Hierarchical Clustering Dendrogram");
        drawAxes(g, "Rows", "Distance");

        int leaves = tree.leafCount();
        int nodes = leaves + tree.size();
        double[] x = new double[nodes];
        double[] height = new double[nodes];

        // leaves are spaced in depth-first order so that branches never cross
        int position = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(tree.rootId());
        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (tree.isLeaf(id)) {
                x[id] = position++;
            } else {
                MergeEvent merge = tree.mergeOf(id);
                stack.push(merge.right());
                stack.push(merge.left());
            }
        }
        for (int i = 0; i < tree.size(); i++) {
            MergeEvent merge = tree.event(i);
            x[leaves + i] = (x[merge.left()] + x[merge.right()]) / 2.0;
            height[leaves + i] = merge.distance();
        }

        double maxHeight = tree.maxDistance() > 0 ? tree.maxDistance() : 1.0;
        double xScale = (WIDTH - 2.0 * MARGIN) / Math.max(1, leaves - 1);
        double yScale = (HEIGHT - 2.0 * MARGIN) / maxHeight;

        g.setColor(PALETTE[0]);
        g.setStroke(new BasicStroke(leaves > 200 ? 0.5f : 1.5f));
        for (int i = 0; i < tree.size(); i++) {
            MergeEvent merge = tree.event(i);
            int top = (int) Math.round(HEIGHT - MARGIN - merge.distance() * yScale);
            int leftX = (int) Math.round(MARGIN + x[merge.left()] * xScale);
            int rightX = (int) Math.round(MARGIN + x[merge.right()] * xScale);
            int leftY = (int) Math.round(HEIGHT - MARGIN - height[merge.left()] * yScale);
            int rightY = (int) Math.round(HEIGHT - MARGIN - height[merge.right()] * yScale);
            g.drawLine(leftX, leftY, leftX, top);
            g.drawLine(rightX, rightY, rightX, top);
            g.drawLine(leftX, top, rightX, top);
        }
        g.dispose();
        return image;
    }

    private static Graphics2D canvas(BufferedImage image, String title) {
        Graphics2D g = image.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
        g.setColor(Color.BLACK);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 20));
        FontMetrics metrics = g.getFontMetrics();
        g.drawString(title, (image.getWidth() - metrics.stringWidth(title)) / 2, MARGIN / 2);
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
        return g;
    }

    private static void drawAxes(Graphics2D g, String xLabel, String yLabel) {
        g.setColor(Color.BLACK);
        g.drawLine(MARGIN, HEIGHT - MARGIN, WIDTH - MARGIN, HEIGHT - MARGIN);
        g.drawLine(MARGIN, MARGIN, MARGIN, HEIGHT - MARGIN);
        g.drawString(xLabel, WIDTH / 2, HEIGHT - MARGIN / 3);
        g.drawString(yLabel, 10, MARGIN - 10);
    }

    private static double[] range(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isFinite(v)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        if (min > max) {
            return new double[]{0.0, 1.0};
        }
        if (min == max) {
            return new double[]{min - 0.5, max + 0.5};
        }
        double pad = (max - min) * 0.05;
        return new double[]{min - pad, max + pad};
    }

    /**
     * Diverging blue-white-red scale for coefficients in [-1, 1]; NaN is drawn light grey.
     */
    static Color coolWarm(double r) {
        if (Double.isNaN(r)) {
            return new Color(220, 220, 220);
        }
        double t = Math.max(-1.0, Math.min(1.0, r));
        if (t < 0) {
            double s = -t;
            return new Color((int) Math.round(255 - s * (255 - 59)), (int) Math.round(255 - s * (255 - 76)),
                    (int) Math.round(255 - s * (255 - 192)));
        }
        return new Color((int) Math.round(255 - t * (255 - 180)), (int) Math.round(255 - t * (255 - 4)),
                (int) Math.round(255 - t * (255 - 38)));
    }
}
