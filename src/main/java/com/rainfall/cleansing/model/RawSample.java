package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 原始观测记录，来自原始库或采集消息。
 * 同一传感器内时间戳唯一；value为null表示原始值缺失或无法解析为数值。
 */
public class RawSample implements Serializable {
    private String sensorId;
    private Instant timestamp;
    private Double value;
    /** 可选的质量值，缺失时视为通过质控 */
    private Double quality;
    private String variable;
    private String source;

    public RawSample() {}

    public RawSample(String sensorId, Instant timestamp, Double value, Double quality,
                     String variable, String source) {
        this.sensorId = sensorId;
        this.timestamp = timestamp;
        this.value = value;
        this.quality = quality;
        this.variable = variable;
        this.source = source;
    }

    public String getSensorId() { return sensorId; }
    public void setSensorId(String sensorId) { this.sensorId = sensorId; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public Double getValue() { return value; }
    public void setValue(Double value) { this.value = value; }
    public Double getQuality() { return quality; }
    public void setQuality(Double quality) { this.quality = quality; }
    public String getVariable() { return variable; }
    public void setVariable(String variable) { this.variable = variable; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawSample)) return false;
        RawSample that = (RawSample) o;
        return Objects.equals(sensorId, that.sensorId)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(value, that.value)
                && Objects.equals(quality, that.quality)
                && Objects.equals(variable, that.variable)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, timestamp, value, quality, variable, source);
    }

    @Override
    public String toString() {
        return "RawSample{sensor='" + sensorId + "', ts=" + timestamp + ", value=" + value
                + ", quality=" + quality + ", variable='" + variable + "', source='" + source + "'}";
    }
}
