package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 质控算子。
 * 基于物理量程检测异常值，超出范围的数据点置空并标记OUTLIER；
 * 配置了质量下限时，质量值低于下限的点置空并标记POOR_QUALITY。
 *
 * 参数：
 * - cleaner.min.value.mm: 量程下限 (NUMBER, 默认0.0)
 * - cleaner.max.value.mm: 量程上限 (NUMBER, 默认150.0)
 * - cleaner.min.quality: 质量下限 (NUMBER, 可选，缺省不检查)
 *
 * 已缺失的点不会被判为异常值；质量值缺失的点通过质量检查。
 */
public class QualityControlOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(QualityControlOperator.class);

    public static final String FUNCTION_ID = "quality_control";

    private final double lowerLimit;
    private final double upperLimit;
    private final Double minQuality;

    public QualityControlOperator(double lowerLimit, double upperLimit, Double minQuality) {
        if (lowerLimit >= upperLimit) {
            throw new IllegalArgumentException("Lower limit " + lowerLimit
                    + " must be below upper limit " + upperLimit);
        }
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
        this.minQuality = minQuality;
    }

    @Override
    public void execute(OperatorContext context) {
        WorkingSeries series = context.getSeries();
        if (series.isEmpty()) return;

        int outliers = 0;
        int poorQuality = 0;
        for (int i = 0; i < series.size(); i++) {
            Double value = series.getValue(i);
            if (value != null && (value < lowerLimit || value > upperLimit)) {
                context.rejectValue(i, QcFlags.OUTLIER);
                outliers++;
            }

            Double quality = series.getQuality(i);
            if (minQuality != null && quality != null && quality < minQuality) {
                context.rejectValue(i, QcFlags.POOR_QUALITY);
                poorQuality++;
            }
        }

        if (outliers > 0 || poorQuality > 0) {
            log.debug("Sensor '{}': {} outliers outside [{}, {}], {} points below quality {}",
                    context.getSensorId(), outliers, lowerLimit, upperLimit, poorQuality, minQuality);
        }
    }

    @Override
    public FunctionMetadata getMetadata() {
        FunctionMetadata meta = new FunctionMetadata(FUNCTION_ID, "质控算子", "1.0.0", 20,
                "基于物理量程检测异常值（如计量翻斗卡滞产生的超大读数），并按可选的质量下限剔除低质量样本。");

        ParameterDefinition lowerDef = ParameterDefinition.number(CleansingConfig.MIN_VALUE_MM, 0.0,
                null, null, "量程下限，低于此值判定为异常");
        ParameterDefinition upperDef = ParameterDefinition.number(CleansingConfig.MAX_VALUE_MM, 150.0,
                null, null, "量程上限，超过此值判定为异常");
        ParameterDefinition qualityDef = ParameterDefinition.number(CleansingConfig.MIN_QUALITY, null,
                null, null, "质量下限，缺省时不做质量检查");

        meta.setParameterDefinitions(Arrays.asList(lowerDef, upperDef, qualityDef));
        return meta;
    }
}
