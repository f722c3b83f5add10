package com.lohika.morning.risk.spark.driver.orchestrator;

public enum PipelineState {
    CHECK_NEW_DATA,
    INGEST,
    SCORE,
    COMPARE,
    RETRAIN,
    REDEPLOY,
    REPORT,
    DONE
}
