package com.rainfall.cleansing.forecast;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.WorkingSeries;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 滞后特征梯度提升回归预测策略。
 *
 * 每个时刻的特征为前三个点的值（按位置滞后）及UTC小时、星期（周一为0）、月份。
 * 每回合用目标与三个滞后均存在的点训练；预测滞后齐全的缺失点。
 * 回合内特征取回合开始时的序列，新填的点要到下一回合才能作为滞后使用。
 */
public class GradientBoostingForecastStrategy implements ForecastStrategy<GradientBoostedTrees> {

    static final int LAGS = 3;
    static final int FEATURES = LAGS + 3;

    private final int maxDepth;
    private final double learningRate;
    private final int estimators;
    private final int minSamplesLeaf;
    private final double subsample;
    private final int minTrain;
    private final int maxIterations;
    private final long randomSeed;

    public GradientBoostingForecastStrategy(CleansingConfig config) {
        this.maxDepth = config.getGbmMaxDepth();
        this.learningRate = config.getGbmLearningRate();
        this.estimators = config.getGbmEstimators();
        this.minSamplesLeaf = config.getGbmMinSamplesLeaf();
        this.subsample = config.getGbmSubsample();
        this.minTrain = config.getGbmMinTrain();
        this.maxIterations = config.getGbmMaxIterations();
        this.randomSeed = config.getGbmRandomSeed();
    }

    @Override
    public ImputationMethod getMethod() {
        return ImputationMethod.GBM_FORECAST;
    }

    @Override
    public int getMaxIterations() {
        return Math.max(1, maxIterations);
    }

    @Override
    public GradientBoostedTrees fit(WorkingSeries history) throws InsufficientDataException, ModelFailureException {
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int i = LAGS; i < history.size(); i++) {
            if (!history.isMissing(i) && lagsPresent(history, i)) {
                rows.add(features(history, i));
                targets.add(history.getValue(i));
            }
        }
        if (rows.size() < Math.max(1, minTrain)) {
            throw new InsufficientDataException(rows.size(), Math.max(1, minTrain));
        }

        double[][] x = rows.toArray(new double[0][]);
        double[] y = new double[targets.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = targets.get(i);
        }
        try {
            return GradientBoostedTrees.fit(x, y, estimators, maxDepth, minSamplesLeaf,
                    learningRate, subsample, randomSeed);
        } catch (IllegalArgumentException e) {
            throw new ModelFailureException("Gradient boosting fit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Integer> selectTargets(GradientBoostedTrees model, WorkingSeries series) {
        List<Integer> targets = new ArrayList<>();
        for (int i = LAGS; i < series.size(); i++) {
            if (series.isMissing(i) && lagsPresent(series, i)) {
                targets.add(i);
            }
        }
        return targets;
    }

    @Override
    public double predict(GradientBoostedTrees model, WorkingSeries series, int index) throws ModelFailureException {
        if (index < LAGS || !lagsPresent(series, index)) {
            throw new ModelFailureException("Lag features incomplete at index " + index);
        }
        double value = model.predict(features(series, index));
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ModelFailureException("Non-finite prediction at index " + index);
        }
        return value;
    }

    @Override
    public boolean skipsFailedPoints() {
        return false;
    }

    static boolean lagsPresent(WorkingSeries series, int index) {
        for (int lag = 1; lag <= LAGS; lag++) {
            if (index - lag < 0 || series.isMissing(index - lag)) {
                return false;
            }
        }
        return true;
    }

    /** [lag1, lag2, lag3, hour, dayOfWeek, month] */
    static double[] features(WorkingSeries series, int index) {
        double[] row = new double[FEATURES];
        for (int lag = 1; lag <= LAGS; lag++) {
            row[lag - 1] = series.getValue(index - lag);
        }
        ZonedDateTime ts = series.getTimestamp(index).atZone(ZoneOffset.UTC);
        row[LAGS] = ts.getHour();
        row[LAGS + 1] = ts.getDayOfWeek().getValue() - 1;
        row[LAGS + 2] = ts.getMonthValue();
        return row;
    }
}
