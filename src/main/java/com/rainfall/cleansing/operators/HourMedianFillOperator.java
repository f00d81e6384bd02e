package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.*;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.ResizableDoubleArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;

/**
 * 同小时中位数填充算子。
 * 按UTC小时分组计算当前有值点（含前序阶段已填的点）的中位数，
 * 用于填充同一小时内仍缺失的点。没有有值点时不做处理。
 */
public class HourMedianFillOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(HourMedianFillOperator.class);

    public static final String FUNCTION_ID = "hour_median_fill";

    private static final int HOURS = 24;

    @Override
    public void execute(OperatorContext context) {
        WorkingSeries series = context.getSeries();
        if (series.missingCount() == 0) return;
        if (series.firstLabeledIndex() < 0) {
            log.debug("Sensor '{}': no labeled data for hourly medians", context.getSensorId());
            return;
        }

        ResizableDoubleArray[] byHour = new ResizableDoubleArray[HOURS];
        for (int i = 0; i < series.size(); i++) {
            if (series.isMissing(i)) continue;
            int hour = hourOf(series, i);
            if (byHour[hour] == null) {
                byHour[hour] = new ResizableDoubleArray();
            }
            byHour[hour].addElement(series.getValue(i));
        }

        Double[] medians = new Double[HOURS];
        Median median = new Median();
        for (int hour = 0; hour < HOURS; hour++) {
            if (byHour[hour] != null) {
                medians[hour] = median.evaluate(byHour[hour].getElements());
            }
        }

        int filled = 0;
        for (int i = 0; i < series.size(); i++) {
            if (!series.isMissing(i)) continue;
            Double value = medians[hourOf(series, i)];
            if (value != null && context.fillValue(i, value, ImputationMethod.HOUR_MEDIAN)) {
                filled++;
            }
        }
        if (filled > 0) {
            log.debug("Sensor '{}': filled {} points with hour-of-day medians", context.getSensorId(), filled);
        }
    }

    private static int hourOf(WorkingSeries series, int index) {
        return series.getTimestamp(index).atZone(ZoneOffset.UTC).getHour();
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "同小时中位数填充算子", "1.0.0", 50,
                "以同一UTC小时的历史中位数填充剩余缺失点，保留降水的日变化特征。");
    }
}
