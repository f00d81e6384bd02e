package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * 插值填充算子。
 * 对缺失区间按时间线性插值补全，插值权重取两侧有值点之间的实际时长比例，
 * 因此采样间隔不均匀时同样适用。
 *
 * 参数：
 * - cleaner.interpolation.limit: 每个缺失区间从两端各最多填充的样本数 (NUMBER, 默认6)
 *
 * 区间内的点距离任一端不超过limit个样本即填充；
 * 序列首尾的缺失段取最近的有值点数值，只填紧邻该点的limit个样本。
 * 没有任何有值点时不做处理。
 */
public class InterpolationFillOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(InterpolationFillOperator.class);

    public static final String FUNCTION_ID = "interpolation_fill";

    private final int limit;

    public InterpolationFillOperator(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Interpolation limit must not be negative, got " + limit);
        }
        this.limit = limit;
    }

    @Override
    public void execute(OperatorContext context) {
        WorkingSeries series = context.getSeries();
        int first = series.firstLabeledIndex();
        if (first < 0 || limit == 0) return;
        int last = series.lastLabeledIndex();

        int filled = 0;

        // 首部缺失段：保持第一个有值点
        double head = series.getValue(first);
        for (int i = Math.max(0, first - limit); i < first; i++) {
            if (context.fillValue(i, head, ImputationMethod.TIME_INTERP)) filled++;
        }

        // 中间缺失段
        int prev = first;
        for (int i = first + 1; i <= last; i++) {
            if (series.isMissing(i)) continue;
            if (i - prev > 1) {
                filled += fillGap(context, series, prev, i);
            }
            prev = i;
        }

        // 尾部缺失段：保持最后一个有值点
        double tail = series.getValue(last);
        for (int i = last + 1; i <= Math.min(series.size() - 1, last + limit); i++) {
            if (context.fillValue(i, tail, ImputationMethod.TIME_INTERP)) filled++;
        }

        if (filled > 0) {
            log.debug("Sensor '{}': interpolated {} points (limit {})", context.getSensorId(), filled, limit);
        }
    }

    /**
     * 填充 before 与 after 两个有值点之间的缺失段
     */
    private int fillGap(OperatorContext context, WorkingSeries series, int before, int after) {
        long t0 = series.getTimestamp(before).toEpochMilli();
        long t1 = series.getTimestamp(after).toEpochMilli();
        double v0 = series.getValue(before);
        double v1 = series.getValue(after);

        int filled = 0;
        for (int i = before + 1; i < after; i++) {
            int fromStart = i - before;
            int fromEnd = after - i;
            if (fromStart > limit && fromEnd > limit) {
                continue;
            }
            double ratio = (double) (series.getTimestamp(i).toEpochMilli() - t0) / (t1 - t0);
            if (context.fillValue(i, v0 + ratio * (v1 - v0), ImputationMethod.TIME_INTERP)) {
                filled++;
            }
        }
        return filled;
    }

    @Override
    public FunctionMetadata getMetadata() {
        FunctionMetadata meta = new FunctionMetadata(FUNCTION_ID, "插值填充算子", "1.0.0", 40,
                "对短时缺失区间按时间线性插值补全，长区间只填两端附近的点。");
        meta.setParameterDefinitions(Collections.singletonList(
                ParameterDefinition.number(CleansingConfig.INTERPOLATION_LIMIT, 6.0, 0.0, null,
                        "每个缺失区间从两端各最多填充的样本数")));
        return meta;
    }
}
