package com.lohika.morning.risk.spark.driver.service.reporting;

import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.EXITED;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.PROBABILITY;
import static org.apache.spark.sql.functions.col;

import com.lohika.morning.risk.spark.distributed.library.function.map.generic.mllib.MapRowToScoreAndLabel;
import java.util.ArrayList;
import java.util.List;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.mllib.evaluation.BinaryClassificationMetrics;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import scala.Tuple2;

/**
 * Receiver operating characteristic of a scored dataset, using the positive class probability
 * as the score.
 */
public class RocCurve {

    private final double[] falsePositiveRates;
    private final double[] truePositiveRates;
    private final double areaUnderCurve;

    public RocCurve(double[] falsePositiveRates, double[] truePositiveRates, double areaUnderCurve) {
        this.falsePositiveRates = falsePositiveRates;
        this.truePositiveRates = truePositiveRates;
        this.areaUnderCurve = areaUnderCurve;
    }

    public static RocCurve of(Dataset<Row> predictions) {
        JavaRDD<Tuple2<Object, Object>> scoreAndLabels = predictions
                .select(col(PROBABILITY.getName()), col(EXITED.getName()))
                .filter(col(EXITED.getName()).isNotNull())
                .toJavaRDD()
                .map(new MapRowToScoreAndLabel(PROBABILITY.getName(), EXITED.getName()));

        BinaryClassificationMetrics metrics = new BinaryClassificationMetrics(scoreAndLabels.rdd());
        try {
            List<Tuple2<Object, Object>> points = new ArrayList<>(metrics.roc().toJavaRDD().collect());
            double[] fpr = new double[points.size()];
            double[] tpr = new double[points.size()];
            for (int i = 0; i < points.size(); i++) {
                fpr[i] = (Double) points.get(i)._1();
                tpr[i] = (Double) points.get(i)._2();
            }
            return new RocCurve(fpr, tpr, metrics.areaUnderROC());
        } finally {
            metrics.unpersist();
        }
    }

    public double[] getFalsePositiveRates() {
        return falsePositiveRates.clone();
    }

    public double[] getTruePositiveRates() {
        return truePositiveRates.clone();
    }

    public double getAreaUnderCurve() {
        return areaUnderCurve;
    }

    public int size() {
        return falsePositiveRates.length;
    }
}
