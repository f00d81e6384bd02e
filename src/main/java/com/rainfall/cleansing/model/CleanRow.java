package com.rainfall.cleansing.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 清洗结果行，按 (sensorId, timestamp, version) 幂等写入清洗库。
 */
public class CleanRow implements Serializable {
    private String sensorId;
    private Instant timestamp;
    private double value;
    private int qcFlags;
    /** 插补方法标签；保留原始测量值时为null */
    private String imputationMethod;
    private int version;

    public CleanRow() {}

    public CleanRow(String sensorId, Instant timestamp, double value, int qcFlags,
                    String imputationMethod, int version) {
        this.sensorId = sensorId;
        this.timestamp = timestamp;
        this.value = value;
        this.qcFlags = qcFlags;
        this.imputationMethod = imputationMethod;
        this.version = version;
    }

    public String getSensorId() { return sensorId; }
    public void setSensorId(String sensorId) { this.sensorId = sensorId; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public double getValue() { return value; }
    public void setValue(double value) { this.value = value; }
    public int getQcFlags() { return qcFlags; }
    public void setQcFlags(int qcFlags) { this.qcFlags = qcFlags; }
    public String getImputationMethod() { return imputationMethod; }
    public void setImputationMethod(String imputationMethod) { this.imputationMethod = imputationMethod; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public boolean isImputed() {
        return QcFlags.has(qcFlags, QcFlags.IMPUTED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CleanRow)) return false;
        CleanRow that = (CleanRow) o;
        return Double.compare(that.value, value) == 0
                && qcFlags == that.qcFlags
                && version == that.version
                && Objects.equals(sensorId, that.sensorId)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(imputationMethod, that.imputationMethod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, timestamp, value, qcFlags, imputationMethod, version);
    }

    @Override
    public String toString() {
        return "CleanRow{sensor='" + sensorId + "', ts=" + timestamp + ", value=" + value
                + ", flags=" + QcFlags.describe(qcFlags) + ", method=" + imputationMethod
                + ", version=" + version + "}";
    }
}
