package com.lohika.morning.risk.spark.distributed.library.function.map.generic.mllib;

import org.apache.spark.api.java.function.Function;
import org.apache.spark.ml.linalg.Vector;
import org.apache.spark.sql.Row;
import scala.Tuple2;

/**
 * Maps a scored row to the (score, label) pair expected by
 * {@link org.apache.spark.mllib.evaluation.BinaryClassificationMetrics}.
 * The score is the probability of the positive class.
 */
public class MapRowToScoreAndLabel implements Function<Row, Tuple2<Object, Object>> {

    private final String probabilityColumn;
    private final String labelColumn;

    public MapRowToScoreAndLabel(String probabilityColumn, String labelColumn) {
        this.probabilityColumn = probabilityColumn;
        this.labelColumn = labelColumn;
    }

    @Override
    public Tuple2<Object, Object> call(Row inputRow) {
        Vector probability = inputRow.getAs(probabilityColumn);
        Number label = inputRow.getAs(labelColumn);

        return new Tuple2<>(probability.apply(1), label.doubleValue());
    }
}
