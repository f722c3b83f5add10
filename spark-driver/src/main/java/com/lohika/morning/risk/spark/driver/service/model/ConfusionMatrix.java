package com.lohika.morning.risk.spark.driver.service.model;

import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.EXITED;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.PREDICTION;
import static org.apache.spark.sql.functions.col;

import java.util.List;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary confusion matrix with label 1 as the positive class.
 */
public class ConfusionMatrix {

    private static final Logger log = LoggerFactory.getLogger(ConfusionMatrix.class);

    private final long trueNegatives;
    private final long falsePositives;
    private final long falseNegatives;
    private final long truePositives;

    public ConfusionMatrix(long trueNegatives, long falsePositives, long falseNegatives, long truePositives) {
        this.trueNegatives = trueNegatives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
        this.truePositives = truePositives;
    }

    /**
     * Counts actual vs. predicted labels of a prediction frame. Records without a label are skipped.
     */
    public static ConfusionMatrix of(Dataset<Row> predictions) {
        List<Row> cells = predictions
                .groupBy(
                        col(EXITED.getName()).cast(DataTypes.IntegerType).as("actual"),
                        col(PREDICTION.getName()).cast(DataTypes.IntegerType).as("predicted"))
                .count()
                .collectAsList();

        long tn = 0, fp = 0, fn = 0, tp = 0;
        for (Row cell : cells) {
            if (cell.isNullAt(0)) {
                log.warn("Skipping {} records without a label", cell.getLong(2));
                continue;
            }
            boolean actual = cell.getInt(0) == 1;
            boolean predicted = cell.getInt(1) == 1;
            long count = cell.getLong(2);
            if (actual && predicted) {
                tp += count;
            } else if (actual) {
                fn += count;
            } else if (predicted) {
                fp += count;
            } else {
                tn += count;
            }
        }
        return new ConfusionMatrix(tn, fp, fn, tp);
    }

    /** F1 of the positive class; 0 when there is neither a positive label nor a positive prediction. */
    public double f1() {
        long denominator = 2 * truePositives + falsePositives + falseNegatives;
        return denominator == 0 ? 0.0 : (2.0 * truePositives) / denominator;
    }

    public double precision() {
        long predictedPositive = truePositives + falsePositives;
        return predictedPositive == 0 ? 0.0 : (double) truePositives / predictedPositive;
    }

    public double recall() {
        long actualPositive = truePositives + falseNegatives;
        return actualPositive == 0 ? 0.0 : (double) truePositives / actualPositive;
    }

    public long total() {
        return trueNegatives + falsePositives + falseNegatives + truePositives;
    }

    /** Rows are actual labels (0, 1), columns are predicted labels (0, 1). */
    public long[][] toArray() {
        return new long[][]{
                {trueNegatives, falsePositives},
                {falseNegatives, truePositives}
        };
    }

    public long getTrueNegatives() {
        return trueNegatives;
    }

    public long getFalsePositives() {
        return falsePositives;
    }

    public long getFalseNegatives() {
        return falseNegatives;
    }

    public long getTruePositives() {
        return truePositives;
    }

    @Override
    public String toString() {
        return "ConfusionMatrix{tn=" + trueNegatives + ", fp=" + falsePositives
                + ", fn=" + falseNegatives + ", tp=" + truePositives + "}";
    }
}
