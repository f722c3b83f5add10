package com.lohika.morning.risk.spark.driver.service.model;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

/**
 * A trained binary classifier. Callers only ever predict with it; how it was fitted and
 * how it is stored is up to the implementation.
 */
public interface Classifier {

    /**
     * Predicts a label for every record.
     *
     * @param features records holding at least the feature columns; other columns are carried through
     * @return the same records with a {@code prediction} column (0.0 or 1.0) and, when the model
     *         supports it, a {@code probability} vector
     */
    Dataset<Row> predict(Dataset<Row> features);
}
