package com.rainfall.cleansing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次清洗运行的汇总：成功传感器的结果行、失败传感器及各插补方法计数。
 */
public class RunReport {
    private final List<CleanRow> rows = new ArrayList<>();
    private final List<String> failedSensors = new ArrayList<>();
    /** 失败传感器 -> 失败原因 */
    private final Map<String, String> failureReasons = new LinkedHashMap<>();
    private final Map<ImputationMethod, Integer> imputationCounts = new EnumMap<>(ImputationMethod.class);
    private int sensorsProcessed;
    private int rawRows;
    private int cleanRowCount;
    private int upsertedRows;

    public void addTask(SensorTask task) {
        sensorsProcessed++;
        rawRows += task.getSamples().size();
        if (task.getStatus() == TaskStatus.COMPLETED) {
            rows.addAll(task.getRows());
            cleanRowCount += task.getRows().size();
            task.getImputationCounts().forEach((m, c) -> imputationCounts.merge(m, c, Integer::sum));
        } else {
            failedSensors.add(task.getSensorId());
            failureReasons.put(task.getSensorId(), task.getLastErrorMessage());
        }
    }

    /** 合并另一份报告的计数，用于回填时逐窗口累计；结果行已按窗口写入，不再合并 */
    public void merge(RunReport other) {
        cleanRowCount += other.cleanRowCount;
        failedSensors.addAll(other.failedSensors);
        failureReasons.putAll(other.failureReasons);
        other.imputationCounts.forEach((m, c) -> imputationCounts.merge(m, c, Integer::sum));
        sensorsProcessed += other.sensorsProcessed;
        rawRows += other.rawRows;
        upsertedRows += other.upsertedRows;
    }

    public List<CleanRow> getRows() { return Collections.unmodifiableList(rows); }
    public List<String> getFailedSensors() { return Collections.unmodifiableList(failedSensors); }
    public Map<String, String> getFailureReasons() { return Collections.unmodifiableMap(failureReasons); }
    public Map<ImputationMethod, Integer> getImputationCounts() { return Collections.unmodifiableMap(imputationCounts); }
    public int getSensorsProcessed() { return sensorsProcessed; }
    public int getRawRows() { return rawRows; }
    public int getCleanRowCount() { return cleanRowCount; }
    public int getUpsertedRows() { return upsertedRows; }
    public void setUpsertedRows(int upsertedRows) { this.upsertedRows = upsertedRows; }

    @Override
    public String toString() {
        return "RunReport{sensors=" + sensorsProcessed
                + ", failed=" + failedSensors.size()
                + ", rawRows=" + rawRows
                + ", cleanRows=" + cleanRowCount
                + ", upserted=" + upsertedRows
                + ", imputed=" + imputationCounts + "}";
    }
}
