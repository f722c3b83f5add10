package com.lohika.morning.risk.spark.driver.service.reporting;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lohika.morning.risk.spark.driver.service.model.ConfusionMatrix;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Serializable description of a report figure: its traces under {@code data} and its
 * titles and axes under {@code layout}, so a dashboard can redraw it.
 */
public final class FigureDescription {

    static final String[] PREDICTED_LABELS = {"Predicted Not Exited", "Predicted Exited"};
    static final String[] ACTUAL_LABELS = {"Actual Not Exited", "Actual Exited"};

    private final ObjectNode figure;

    private FigureDescription(ObjectNode figure) {
        this.figure = figure;
    }

    public static FigureDescription confusionMatrix(ConfusionMatrix matrix) {
        ObjectNode figure = JsonFiles.mapper().createObjectNode();

        ObjectNode heatmap = figure.putArray("data").addObject();
        heatmap.put("type", "heatmap");
        ArrayNode z = heatmap.putArray("z");
        for (long[] row : matrix.toArray()) {
            ArrayNode cells = z.addArray();
            for (long cell : row) {
                cells.add(cell);
            }
        }
        strings(heatmap.putArray("x"), PREDICTED_LABELS);
        strings(heatmap.putArray("y"), ACTUAL_LABELS);
        heatmap.put("texttemplate", "%{z}");
        heatmap.put("colorscale", "YlGnBu");

        ObjectNode layout = figure.putObject("layout");
        layout.putObject("title").put("text", "Confusion Matrix");
        layout.putObject("xaxis").putObject("title").put("text", "Predicted");
        layout.putObject("yaxis").putObject("title").put("text", "Actual");
        return new FigureDescription(figure);
    }

    public static FigureDescription roc(RocCurve curve) {
        ObjectNode figure = JsonFiles.mapper().createObjectNode();

        ObjectNode area = figure.putArray("data").addObject();
        area.put("type", "scatter");
        area.put("mode", "lines");
        area.put("fill", "tozeroy");
        ArrayNode x = area.putArray("x");
        for (double rate : curve.getFalsePositiveRates()) {
            x.add(rate);
        }
        ArrayNode y = area.putArray("y");
        for (double rate : curve.getTruePositiveRates()) {
            y.add(rate);
        }

        ObjectNode layout = figure.putObject("layout");
        layout.putObject("title").put("text", title(curve));
        layout.putObject("xaxis").putObject("title").put("text", "False Positive Rate");
        ObjectNode yaxis = layout.putObject("yaxis");
        yaxis.putObject("title").put("text", "True Positive Rate");
        yaxis.put("scaleanchor", "x");
        yaxis.put("scaleratio", 1);

        ObjectNode diagonal = layout.putArray("shapes").addObject();
        diagonal.put("type", "line");
        diagonal.putObject("line").put("dash", "dash");
        diagonal.put("x0", 0).put("x1", 1).put("y0", 0).put("y1", 1);

        layout.put("auc", curve.getAreaUnderCurve());
        return new FigureDescription(figure);
    }

    static String title(RocCurve curve) {
        return String.format(Locale.ROOT, "ROC Curve (AUC=%.4f)", curve.getAreaUnderCurve());
    }

    public ObjectNode toJson() {
        return figure.deepCopy();
    }

    public void write(Path file) throws IOException {
        JsonFiles.write(file, figure);
    }

    private static void strings(ArrayNode array, String[] values) {
        for (String value : values) {
            array.add(value);
        }
    }
}
