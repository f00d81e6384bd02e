package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * 窗口预聚合算子（质控之前，可选）。
 * 将时间戳向下取整到固定宽度的窗口（以纪元为起点对齐），
 * 窗口内数值取最大值、质量取均值，无数据的窗口不产生点。
 *
 * 对已聚合的序列再次执行结果不变。
 */
public class WindowAggregationOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(WindowAggregationOperator.class);

    public static final String FUNCTION_ID = "window_aggregation";

    private final long bucketMillis;

    public WindowAggregationOperator(Duration bucket) {
        if (bucket == null || bucket.isNegative() || bucket.isZero()) {
            throw new IllegalArgumentException("Aggregation bucket must be positive, got " + bucket);
        }
        this.bucketMillis = bucket.toMillis();
    }

    @Override
    public void execute(OperatorContext context) {
        WorkingSeries series = context.getSeries();
        if (series.isEmpty()) return;

        TreeMap<Long, Bucket> buckets = new TreeMap<>();
        for (DataPoint dp : series.getDataPoints()) {
            long start = floor(dp.getTimestamp().toEpochMilli());
            buckets.computeIfAbsent(start, k -> new Bucket()).add(dp);
        }

        WorkingSeries aggregated = new WorkingSeries(series.getSensorId());
        for (Map.Entry<Long, Bucket> entry : buckets.entrySet()) {
            Bucket bucket = entry.getValue();
            aggregated.addDataPoint(new DataPoint(Instant.ofEpochMilli(entry.getKey()),
                    bucket.maxValue(), bucket.meanQuality()));
        }

        log.debug("Sensor '{}': aggregated {} points into {} buckets of {} ms",
                context.getSensorId(), series.size(), aggregated.size(), bucketMillis);
        context.replaceSeries(aggregated);
    }

    long floor(long epochMillis) {
        return Math.floorDiv(epochMillis, bucketMillis) * bucketMillis;
    }

    private static final class Bucket {
        private Double max;
        private double qualitySum;
        private int qualityCount;

        void add(DataPoint dp) {
            Double value = dp.getValue();
            if (value != null && (max == null || value > max)) {
                max = value;
            }
            if (dp.getQuality() != null) {
                qualitySum += dp.getQuality();
                qualityCount++;
            }
        }

        Double maxValue() {
            return max;
        }

        Double meanQuality() {
            return qualityCount == 0 ? null : qualitySum / qualityCount;
        }
    }

    @Override
    public FunctionMetadata getMetadata() {
        FunctionMetadata meta = new FunctionMetadata(FUNCTION_ID, "窗口预聚合算子", "1.0.0", 10,
                "将高频原始样本按固定窗口聚合为最大值，用于上报频率不一致的传感器。");
        meta.setParameterDefinitions(Arrays.asList(
                ParameterDefinition.bool(CleansingConfig.AGGREGATION_ENABLED, false, "是否启用预聚合"),
                ParameterDefinition.number(CleansingConfig.AGGREGATION_BUCKET_MINUTES, 10.0, 1.0, 1440.0,
                        "聚合窗口宽度（分钟）")));
        return meta;
    }
}
