package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 工作序列中的单个数据点：时间戳 + 可空降水量 + 可空质量值。
 * value为null表示该点缺失（原始缺失或被质控剔除）。
 */
public class DataPoint implements Serializable {
    private Instant timestamp;
    private Double value;
    private Double quality;

    public DataPoint() {}

    public DataPoint(Instant timestamp, Double value, Double quality) {
        this.timestamp = timestamp;
        this.value = value;
        this.quality = quality;
    }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public Double getValue() { return value; }
    public void setValue(Double value) { this.value = value; }
    public Double getQuality() { return quality; }
    public void setQuality(Double quality) { this.quality = quality; }

    public boolean isMissing() {
        return value == null;
    }

    @Override
    public String toString() {
        return "DataPoint{" + timestamp + ", value=" + value + ", quality=" + quality + "}";
    }
}
