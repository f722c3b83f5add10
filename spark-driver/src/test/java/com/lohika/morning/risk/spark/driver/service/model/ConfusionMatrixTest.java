package com.lohika.morning.risk.spark.driver.service.model;

import static org.junit.Assert.assertEquals;

import com.lohika.morning.risk.spark.driver.BaseTest;
import java.util.Arrays;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.junit.Test;

public class ConfusionMatrixTest extends BaseTest {

    @Test
    public void countsPredictionsAgainstLabels() {
        StructType schema = new StructType(new StructField[]{
                DataTypes.createStructField("exited", DataTypes.IntegerType, true),
                DataTypes.createStructField("prediction", DataTypes.DoubleType, false)
        });
        Dataset<Row> predictions = getSparkSession().createDataFrame(Arrays.asList(
                RowFactory.create(1, 1.0),
                RowFactory.create(1, 1.0),
                RowFactory.create(1, 0.0),
                RowFactory.create(0, 1.0),
                RowFactory.create(0, 0.0),
                RowFactory.create(0, 0.0),
                RowFactory.create(0, 0.0),
                RowFactory.create(null, 1.0)), schema);

        ConfusionMatrix matrix = ConfusionMatrix.of(predictions);

        assertEquals(3, matrix.getTrueNegatives());
        assertEquals(1, matrix.getFalsePositives());
        assertEquals(1, matrix.getFalseNegatives());
        assertEquals(2, matrix.getTruePositives());
        assertEquals(7, matrix.total());
    }

    @Test
    public void f1OfPositiveClass() {
        ConfusionMatrix matrix = new ConfusionMatrix(3, 1, 1, 2);

        assertEquals(2.0 / 3.0, matrix.precision(), 1e-12);
        assertEquals(2.0 / 3.0, matrix.recall(), 1e-12);
        assertEquals(4.0 / 6.0, matrix.f1(), 1e-12);
    }

    @Test
    public void f1IsZeroWithoutAnyPositives() {
        assertEquals(0.0, new ConfusionMatrix(5, 0, 0, 0).f1(), 0.0);
        assertEquals(0.0, new ConfusionMatrix(0, 0, 4, 0).f1(), 0.0);
    }
}
