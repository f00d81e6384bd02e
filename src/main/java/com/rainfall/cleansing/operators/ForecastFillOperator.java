package com.rainfall.cleansing.operators;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.forecast.ForecastStrategy;
import com.rainfall.cleansing.forecast.InsufficientDataException;
import com.rainfall.cleansing.forecast.ModelFailureException;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 预测填补算子。
 * 由预测策略驱动，按回合重复"拟合-预测-写回"，直到某回合没有新填的点或达到最大回合数。
 *
 * 每回合的预测都基于回合开始时的序列快照计算，全部算完后再写回；
 * 预测值截断到物理量程后写入。
 *
 * 失败处理：
 * - 训练数据不足：跳过本阶段，留给后续阶段
 * - 拟合失败：跳过本阶段
 * - 单点预测失败：经典模型跳过该点；回归模型中止本阶段（本回合结果丢弃，之前回合保留）
 */
public class ForecastFillOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(ForecastFillOperator.class);

    public static final String FUNCTION_ID = "forecast_fill";

    private final ForecastStrategy<?> strategy;
    private final double lowerLimit;
    private final double upperLimit;

    public ForecastFillOperator(ForecastStrategy<?> strategy, double lowerLimit, double upperLimit) {
        if (strategy == null) {
            throw new IllegalArgumentException("Forecast strategy must not be null");
        }
        this.strategy = strategy;
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
    }

    @Override
    public void execute(OperatorContext context) {
        if (context.getSeries().isEmpty() || context.getSeries().missingCount() == 0) return;
        int filled = runRounds(strategy, context);
        if (filled > 0) {
            log.debug("Sensor '{}': {} filled {} points", context.getSensorId(),
                    strategy.getMethod().getLabel(), filled);
        }
    }

    private <M> int runRounds(ForecastStrategy<M> forecaster, OperatorContext context) {
        String sensorId = context.getSensorId();
        int total = 0;

        for (int round = 1; round <= forecaster.getMaxIterations(); round++) {
            WorkingSeries snapshot = context.getSeries().copy();

            M model;
            try {
                model = forecaster.fit(snapshot);
            } catch (InsufficientDataException e) {
                log.debug("Sensor '{}': {} skipped in round {}: {}",
                        sensorId, forecaster.getMethod().getLabel(), round, e.getMessage());
                break;
            } catch (ModelFailureException e) {
                log.warn("Sensor '{}': {} fit failed in round {}: {}",
                        sensorId, forecaster.getMethod().getLabel(), round, e.getMessage());
                break;
            }

            Map<Integer, Double> predictions = new LinkedHashMap<>();
            List<Integer> targets = forecaster.selectTargets(model, snapshot);
            boolean aborted = false;
            for (int index : targets) {
                try {
                    predictions.put(index, clip(forecaster.predict(model, snapshot, index)));
                } catch (ModelFailureException e) {
                    if (forecaster.skipsFailedPoints()) {
                        log.debug("Sensor '{}': skipping point {}: {}", sensorId, index, e.getMessage());
                        continue;
                    }
                    log.warn("Sensor '{}': {} aborted in round {} at point {}: {}",
                            sensorId, forecaster.getMethod().getLabel(), round, index, e.getMessage());
                    aborted = true;
                    break;
                }
            }
            if (aborted) {
                break;
            }

            int filledThisRound = 0;
            for (Map.Entry<Integer, Double> entry : predictions.entrySet()) {
                if (context.fillValue(entry.getKey(), entry.getValue(), forecaster.getMethod())) {
                    filledThisRound++;
                }
            }
            total += filledThisRound;
            if (filledThisRound == 0 || context.getSeries().missingCount() == 0) {
                break;
            }
        }
        return total;
    }

    private double clip(double value) {
        return Math.max(lowerLimit, Math.min(upperLimit, value));
    }

    @Override
    public FunctionMetadata getMetadata() {
        FunctionMetadata meta = new FunctionMetadata(FUNCTION_ID, "预测填补算子", "1.0.0", 30,
                "以历史数据拟合预测模型填补缺失点，模型族（经典自回归/梯度提升回归）由配置选择。");
        meta.setParameterDefinitions(Arrays.asList(
                ParameterDefinition.bool(CleansingConfig.FORECAST_ENABLED, true, "是否启用预测填补"),
                ParameterDefinition.enumeration(CleansingConfig.FORECAST_MODEL, "arima",
                        Arrays.asList("arima", "gbm"), "预测模型族"),
                ParameterDefinition.number(CleansingConfig.ARIMA_MIN_TRAIN, 48.0, 2.0, null,
                        "经典模型最少训练样本数"),
                ParameterDefinition.number(CleansingConfig.ARIMA_MAX_ORDER, 3.0, 1.0, 12.0,
                        "自回归阶数上限"),
                ParameterDefinition.bool(CleansingConfig.ARIMA_SEASONAL, true, "是否加入季节自回归项"),
                ParameterDefinition.number(CleansingConfig.ARIMA_SEASONAL_PERIOD, 24.0, 2.0, null,
                        "季节周期（样本数）"),
                ParameterDefinition.number(CleansingConfig.ARIMA_MAX_STEPS, 100.0, 1.0, null,
                        "最大预测步数"),
                ParameterDefinition.number(CleansingConfig.ARIMA_MAX_ITERATIONS, 3.0, 1.0, null,
                        "经典模型最大回合数"),
                ParameterDefinition.number(CleansingConfig.GBM_MAX_DEPTH, 3.0, 1.0, 16.0, "回归树最大深度"),
                ParameterDefinition.number(CleansingConfig.GBM_LEARNING_RATE, 0.1, 0.0, 1.0, "学习率"),
                ParameterDefinition.number(CleansingConfig.GBM_ESTIMATORS, 100.0, 1.0, 10000.0, "提升轮数"),
                ParameterDefinition.number(CleansingConfig.GBM_MIN_SAMPLES_LEAF, 5.0, 1.0, null,
                        "叶子最少样本数"),
                ParameterDefinition.number(CleansingConfig.GBM_SUBSAMPLE, 1.0, 0.0, 1.0, "行子采样比例"),
                ParameterDefinition.number(CleansingConfig.GBM_MIN_TRAIN, 24.0, 1.0, null,
                        "回归模型最少训练样本数"),
                ParameterDefinition.number(CleansingConfig.GBM_MAX_ITERATIONS, 3.0, 1.0, null,
                        "回归模型最大回合数")));
        return meta;
    }
}
