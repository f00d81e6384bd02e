package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * 单个传感器的工作序列：严格升序、时间戳唯一、值可空。
 *
 * 在一次清洗运行期间由管道独占，不在传感器之间共享。
 * 时间索引在构造后不可变，各阶段只能通过下标修改值。
 */
public class WorkingSeries implements Serializable {
    private final String sensorId;
    private final List<DataPoint> dataPoints;

    public WorkingSeries(String sensorId) {
        this.sensorId = sensorId;
        this.dataPoints = new ArrayList<>();
    }

    /**
     * 由原始记录构建工作序列。
     * 按时间戳排序，重复时间戳保留最后一条；非有限数值视为缺失。
     */
    public static WorkingSeries fromRawSamples(String sensorId, List<RawSample> samples) {
        TreeMap<Instant, DataPoint> byTime = new TreeMap<>();
        for (RawSample sample : samples) {
            if (sample.getTimestamp() == null) {
                continue;
            }
            byTime.put(sample.getTimestamp(), new DataPoint(
                    sample.getTimestamp(),
                    finiteOrNull(sample.getValue()),
                    finiteOrNull(sample.getQuality())));
        }
        WorkingSeries series = new WorkingSeries(sensorId);
        byTime.values().forEach(series::addDataPoint);
        return series;
    }

    /**
     * 追加一个数据点，时间戳必须严格大于末尾点。
     */
    public void addDataPoint(DataPoint point) {
        if (!dataPoints.isEmpty()
                && !point.getTimestamp().isAfter(dataPoints.get(dataPoints.size() - 1).getTimestamp())) {
            throw new IllegalArgumentException("Timestamps must be strictly ascending for sensor '"
                    + sensorId + "', got " + point.getTimestamp());
        }
        dataPoints.add(point);
    }

    public String getSensorId() { return sensorId; }

    public List<DataPoint> getDataPoints() {
        return Collections.unmodifiableList(dataPoints);
    }

    public int size() {
        return dataPoints.size();
    }

    public boolean isEmpty() {
        return dataPoints.isEmpty();
    }

    public Instant getTimestamp(int index) {
        return dataPoints.get(index).getTimestamp();
    }

    public Double getValue(int index) {
        return dataPoints.get(index).getValue();
    }

    public Double getQuality(int index) {
        return dataPoints.get(index).getQuality();
    }

    public boolean isMissing(int index) {
        return dataPoints.get(index).isMissing();
    }

    public void setValue(int index, Double value) {
        dataPoints.get(index).setValue(finiteOrNull(value));
    }

    public int missingCount() {
        int count = 0;
        for (DataPoint dp : dataPoints) {
            if (dp.isMissing()) count++;
        }
        return count;
    }

    public int labeledCount() {
        return size() - missingCount();
    }

    /** 首个有值点的下标，无则返回-1 */
    public int firstLabeledIndex() {
        for (int i = 0; i < dataPoints.size(); i++) {
            if (!isMissing(i)) return i;
        }
        return -1;
    }

    /** 末个有值点的下标，无则返回-1 */
    public int lastLabeledIndex() {
        for (int i = dataPoints.size() - 1; i >= 0; i--) {
            if (!isMissing(i)) return i;
        }
        return -1;
    }

    /** 全部有值点的数值，按时间顺序 */
    public double[] labeledValues() {
        double[] values = new double[labeledCount()];
        int k = 0;
        for (DataPoint dp : dataPoints) {
            if (!dp.isMissing()) values[k++] = dp.getValue();
        }
        return values;
    }

    /** 深拷贝，用于需要回合起点快照的阶段 */
    public WorkingSeries copy() {
        WorkingSeries copy = new WorkingSeries(sensorId);
        for (DataPoint dp : dataPoints) {
            copy.dataPoints.add(new DataPoint(dp.getTimestamp(), dp.getValue(), dp.getQuality()));
        }
        return copy;
    }

    private static Double finiteOrNull(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }
}
