package com.lohika.morning.risk.spark.driver.service.reporting;

import com.lohika.morning.risk.spark.driver.service.model.ConfusionMatrix;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

/**
 * Draws report figures as PNG images with Java2D. Runs headless.
 */
@Component
public class ChartRenderer {

    static final int WIDTH = 800;
    static final int HEIGHT = 600;

    private static final int MARGIN = 90;
    private static final Color LIGHT = new Color(255, 255, 217);
    private static final Color DARK = new Color(8, 29, 88);
    private static final Color AREA = new Color(99, 110, 250, 90);
    private static final Color LINE = new Color(99, 110, 250);

    public void renderConfusionMatrix(ConfusionMatrix matrix, Path target) throws IOException {
        BufferedImage image = canvas();
        Graphics2D g = image.createGraphics();
        try {
            prepare(g);
            drawTitle(g, "Confusion Matrix");

            long[][] cells = matrix.toArray();
            long max = 1;
            for (long[] row : cells) {
                for (long cell : row) {
                    max = Math.max(max, cell);
                }
            }

            int plotWidth = WIDTH - 2 * MARGIN;
            int plotHeight = HEIGHT - 2 * MARGIN;
            int cellWidth = plotWidth / 2;
            int cellHeight = plotHeight / 2;
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 20));
            for (int actual = 0; actual < 2; actual++) {
                for (int predicted = 0; predicted < 2; predicted++) {
                    int x = MARGIN + predicted * cellWidth;
                    int y = MARGIN + actual * cellHeight;
                    double shade = (double) cells[actual][predicted] / max;
                    g.setColor(blend(LIGHT, DARK, shade));
                    g.fillRect(x, y, cellWidth, cellHeight);
                    g.setColor(shade > 0.5 ? Color.WHITE : Color.BLACK);
                    centered(g, Long.toString(cells[actual][predicted]), x + cellWidth / 2, y + cellHeight / 2);
                }
            }

            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 13));
            for (int i = 0; i < 2; i++) {
                centered(g, FigureDescription.PREDICTED_LABELS[i], MARGIN + i * cellWidth + cellWidth / 2, HEIGHT - MARGIN + 20);
                centered(g, FigureDescription.ACTUAL_LABELS[i], MARGIN / 2 + 5, MARGIN + i * cellHeight + cellHeight / 2);
            }
            centered(g, "Predicted", WIDTH / 2, HEIGHT - MARGIN / 3);
        } finally {
            g.dispose();
        }
        write(image, target);
    }

    public void renderRocCurve(RocCurve curve, Path target) throws IOException {
        BufferedImage image = canvas();
        Graphics2D g = image.createGraphics();
        try {
            prepare(g);
            drawTitle(g, FigureDescription.title(curve));

            int size = Math.min(WIDTH, HEIGHT) - 2 * MARGIN;
            int left = (WIDTH - size) / 2;
            int bottom = MARGIN + size;

            double[] fpr = curve.getFalsePositiveRates();
            double[] tpr = curve.getTruePositiveRates();
            Polygon area = new Polygon();
            area.addPoint(left, bottom);
            int[] xs = new int[fpr.length];
            int[] ys = new int[fpr.length];
            for (int i = 0; i < fpr.length; i++) {
                xs[i] = left + (int) Math.round(fpr[i] * size);
                ys[i] = bottom - (int) Math.round(tpr[i] * size);
                area.addPoint(xs[i], ys[i]);
            }
            area.addPoint(left + size, bottom);

            g.setColor(AREA);
            g.fillPolygon(area);
            g.setColor(LINE);
            g.setStroke(new BasicStroke(2f));
            g.drawPolyline(xs, ys, fpr.length);

            g.setColor(Color.GRAY);
            g.setStroke(new BasicStroke(1f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, new float[]{6f, 6f}, 0f));
            g.drawLine(left, bottom, left + size, MARGIN);

            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1f));
            g.drawRect(left, MARGIN, size, size);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 13));
            centered(g, "False Positive Rate", WIDTH / 2, bottom + 35);
            centered(g, "True Positive Rate", left - 60, MARGIN + size / 2);
            centered(g, "0", left, bottom + 15);
            centered(g, "1", left + size, bottom + 15);
            centered(g, "1", left - 12, MARGIN);
        } finally {
            g.dispose();
        }
        write(image, target);
    }

    private static BufferedImage canvas() {
        return new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    }

    private static void prepare(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, WIDTH, HEIGHT);
    }

    private static void drawTitle(Graphics2D g, String title) {
        g.setColor(Color.BLACK);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 18));
        centered(g, title, WIDTH / 2, MARGIN / 2);
    }

    private static void centered(Graphics2D g, String text, int x, int y) {
        FontMetrics metrics = g.getFontMetrics();
        g.drawString(text, x - metrics.stringWidth(text) / 2, y + metrics.getAscent() / 2);
    }

    private static Color blend(Color from, Color to, double ratio) {
        return new Color(
                (int) Math.round(from.getRed() + (to.getRed() - from.getRed()) * ratio),
                (int) Math.round(from.getGreen() + (to.getGreen() - from.getGreen()) * ratio),
                (int) Math.round(from.getBlue() + (to.getBlue() - from.getBlue()) * ratio));
    }

    private static void write(BufferedImage image, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temporary = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            if (!ImageIO.write(image, "png", temporary.toFile())) {
                throw new IOException("no PNG writer available");
            }
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temporary);
        }
    }
}
