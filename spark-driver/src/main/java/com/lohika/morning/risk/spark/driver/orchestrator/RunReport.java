package com.lohika.morning.risk.spark.driver.orchestrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one orchestration run did. Scores the run never computed are {@code null}.
 */
public class RunReport {

    private final List<PipelineState> states = new ArrayList<>();
    private List<String> newFiles = Collections.emptyList();
    private boolean bootstrap;
    private Double baselineScore;
    private Double workingScore;
    private Double newModelScore;
    private boolean drift;

    void visit(PipelineState state) {
        states.add(state);
    }

    void setNewFiles(List<String> newFiles) {
        this.newFiles = Collections.unmodifiableList(new ArrayList<>(newFiles));
    }

    void setBootstrap(boolean bootstrap) {
        this.bootstrap = bootstrap;
    }

    void setBaselineScore(Double baselineScore) {
        this.baselineScore = baselineScore;
    }

    void setWorkingScore(Double workingScore) {
        this.workingScore = workingScore;
    }

    void setNewModelScore(Double newModelScore) {
        this.newModelScore = newModelScore;
    }

    void setDrift(boolean drift) {
        this.drift = drift;
    }

    public List<PipelineState> getStates() {
        return Collections.unmodifiableList(states);
    }

    public List<String> getNewFiles() {
        return newFiles;
    }

    /** True when no model had been deployed before this run. */
    public boolean isBootstrap() {
        return bootstrap;
    }

    public Double getBaselineScore() {
        return baselineScore;
    }

    public Double getWorkingScore() {
        return workingScore;
    }

    public Double getNewModelScore() {
        return newModelScore;
    }

    public boolean isDrift() {
        return drift;
    }

    public boolean isRedeployed() {
        return states.contains(PipelineState.REDEPLOY);
    }

    /** True when there was no new data and the run wrote nothing. */
    public boolean isNoOp() {
        return !states.contains(PipelineState.INGEST);
    }

    @Override
    public String toString() {
        return "RunReport{states=" + states + ", newFiles=" + newFiles + ", bootstrap=" + bootstrap
                + ", baseline=" + baselineScore + ", working=" + workingScore
                + ", newModel=" + newModelScore + ", drift=" + drift + "}";
    }
}
