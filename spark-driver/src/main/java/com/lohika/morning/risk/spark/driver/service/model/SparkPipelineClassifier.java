package com.lohika.morning.risk.spark.driver.service.model;

import org.apache.spark.ml.PipelineModel;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

public class SparkPipelineClassifier implements Classifier {

    private final PipelineModel pipelineModel;

    public SparkPipelineClassifier(PipelineModel pipelineModel) {
        this.pipelineModel = pipelineModel;
    }

    @Override
    public Dataset<Row> predict(Dataset<Row> features) {
        return pipelineModel.transform(features);
    }

    public PipelineModel getPipelineModel() {
        return pipelineModel;
    }
}
