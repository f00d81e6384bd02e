package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 截断输出算子，级联的最后一个阶段。
 * 数值截断到物理量程；有插补标签的点置IMPUTED标志；
 * 仍缺失的点不输出；结果按时间顺序写入输出。
 */
public class ClampEmitOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(ClampEmitOperator.class);

    public static final String FUNCTION_ID = "clamp_emit";

    private final double lowerLimit;
    private final double upperLimit;
    private final int version;

    public ClampEmitOperator(double lowerLimit, double upperLimit, int version) {
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
        this.version = version;
    }

    @Override
    public void execute(OperatorContext context) {
        WorkingSeries series = context.getSeries();
        ProvenanceTracker provenance = context.getProvenance();

        int dropped = 0;
        for (int i = 0; i < series.size(); i++) {
            if (provenance.isImputed(i)) {
                provenance.addFlag(i, QcFlags.IMPUTED);
            }
            if (series.isMissing(i)) {
                dropped++;
                continue;
            }
            double value = Math.max(lowerLimit, Math.min(upperLimit, series.getValue(i)));
            ImputationMethod method = provenance.getMethod(i);
            context.emit(new CleanRow(context.getSensorId(), series.getTimestamp(i), value,
                    provenance.getFlags(i), method == null ? null : method.getLabel(), version));
        }
        if (dropped > 0) {
            log.debug("Sensor '{}': dropped {} points still missing after the cascade",
                    context.getSensorId(), dropped);
        }
    }

    @Override
    public FunctionMetadata getMetadata() {
        FunctionMetadata meta = new FunctionMetadata(FUNCTION_ID, "截断输出算子", "1.0.0", 70,
                "将清洗结果截断到物理量程并附加质控标志、插补方法和版本号后输出。");
        meta.setParameterDefinitions(Arrays.asList(
                ParameterDefinition.number(CleansingConfig.MIN_VALUE_MM, 0.0, null, null, "量程下限"),
                ParameterDefinition.number(CleansingConfig.MAX_VALUE_MM, 150.0, null, null, "量程上限")));
        return meta;
    }
}
