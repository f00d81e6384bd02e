package com.rainfall.cleansing.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单个传感器的一次清洗任务，封装输入、结果与运行时状态。
 */
public class SensorTask {
    private final String sensorId;
    private final List<RawSample> samples;
    private TaskStatus status;
    private List<CleanRow> rows = Collections.emptyList();
    private Map<ImputationMethod, Integer> imputationCounts = Collections.emptyMap();
    private String lastErrorMessage;

    public SensorTask(String sensorId, List<RawSample> samples) {
        this.sensorId = sensorId;
        this.samples = samples;
        this.status = TaskStatus.PENDING;
    }

    public String getSensorId() { return sensorId; }
    public List<RawSample> getSamples() { return samples; }
    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }
    public List<CleanRow> getRows() { return rows; }
    public void setRows(List<CleanRow> rows) { this.rows = rows; }
    public Map<ImputationMethod, Integer> getImputationCounts() { return imputationCounts; }
    public void setImputationCounts(Map<ImputationMethod, Integer> imputationCounts) { this.imputationCounts = imputationCounts; }
    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }
}
