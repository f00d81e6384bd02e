package com.rainfall.cleansing.core.impl;

import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.model.CleanRow;
import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.ProvenanceTracker;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 阶段上下文默认实现。
 * 一个实例对应一个传感器的一次运行，在级联各阶段之间顺序传递。
 */
public class DefaultOperatorContext implements OperatorContext {

    private final String sensorId;
    private WorkingSeries series;
    private ProvenanceTracker provenance;

    /** 输出缓冲 */
    private final List<CleanRow> outputBuffer = new ArrayList<>();

    public DefaultOperatorContext(WorkingSeries series) {
        this.sensorId = series.getSensorId();
        this.series = series;
        this.provenance = new ProvenanceTracker(series.size());
    }

    @Override
    public String getSensorId() {
        return sensorId;
    }

    @Override
    public WorkingSeries getSeries() {
        return series;
    }

    @Override
    public void replaceSeries(WorkingSeries replacement) {
        if (provenance.isTouched()) {
            throw new IllegalStateException("Cannot replace series of sensor '" + sensorId
                    + "' after points have been flagged or imputed");
        }
        this.series = replacement;
        this.provenance = new ProvenanceTracker(replacement.size());
    }

    @Override
    public ProvenanceTracker getProvenance() {
        return provenance;
    }

    @Override
    public void rejectValue(int index, int flag) {
        series.setValue(index, null);
        provenance.addFlag(index, flag);
    }

    @Override
    public boolean fillValue(int index, double value, ImputationMethod method) {
        if (!series.isMissing(index) || Double.isNaN(value) || Double.isInfinite(value)) {
            return false;
        }
        if (!provenance.recordImputation(index, method)) {
            return false;
        }
        series.setValue(index, value);
        return true;
    }

    @Override
    public void emit(CleanRow row) {
        outputBuffer.add(row);
    }

    @Override
    public List<CleanRow> getOutput() {
        return Collections.unmodifiableList(outputBuffer);
    }
}
