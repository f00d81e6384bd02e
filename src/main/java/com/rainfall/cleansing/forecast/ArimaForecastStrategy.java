package com.rainfall.cleansing.forecast;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.WorkingSeries;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 经典自回归预测策略。
 *
 * 在以最后一个有值点结尾的连续有值区间上以条件最小二乘拟合 ARIMA(p,d,0)，
 * 历史长度不少于两个季节周期时追加一个季节自回归项；
 * 阶数p在 1..maxOrder 内按AIC选择。只预测最后一个有值点之后的缺失点，
 * 步数超过上限的点不预测；中间缺失段和首部缺失段留给后续阶段。
 */
public class ArimaForecastStrategy implements ForecastStrategy<ArimaModel> {

    private static final Logger log = LoggerFactory.getLogger(ArimaForecastStrategy.class);

    /** 一阶自相关超过该值时做一阶差分 */
    private static final double UNIT_ROOT_AUTOCORRELATION = 0.9;
    private static final double VARIANCE_EPSILON = 1e-12;

    private final int minTrain;
    private final int maxOrder;
    private final boolean seasonal;
    private final int seasonalPeriod;
    private final int maxSteps;
    private final int maxIterations;

    public ArimaForecastStrategy(CleansingConfig config) {
        this(config.getArimaMinTrain(), config.getArimaMaxOrder(), config.isArimaSeasonal(),
                config.getArimaSeasonalPeriod(), config.getArimaMaxSteps(), config.getArimaMaxIterations());
    }

    public ArimaForecastStrategy(int minTrain, int maxOrder, boolean seasonal, int seasonalPeriod,
                                 int maxSteps, int maxIterations) {
        this.minTrain = minTrain;
        this.maxOrder = Math.max(1, maxOrder);
        this.seasonal = seasonal;
        this.seasonalPeriod = seasonalPeriod;
        this.maxSteps = maxSteps;
        this.maxIterations = maxIterations;
    }

    @Override
    public ImputationMethod getMethod() {
        return ImputationMethod.ARIMA_FORECAST;
    }

    @Override
    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    public ArimaModel fit(WorkingSeries history) throws InsufficientDataException, ModelFailureException {
        int[] run = trailingLabeledRun(history);
        int length = run == null ? 0 : run[1] - run[0] + 1;
        if (length < Math.max(minTrain, 2)) {
            throw new InsufficientDataException(length, Math.max(minTrain, 2));
        }

        double[] y = new double[length];
        for (int i = 0; i < length; i++) {
            y[i] = history.getValue(run[0] + i);
        }

        int d = needsDifferencing(y) ? 1 : 0;
        double[] w = d == 1 ? difference(y) : y;
        int seasonalLag = (seasonal && seasonalPeriod > 0 && length >= 2 * seasonalPeriod) ? seasonalPeriod : 0;

        if (StatUtils.variance(w) < VARIANCE_EPSILON) {
            double[] coefficients = {StatUtils.mean(w)};
            return new ArimaModel(run[0], run[1], 0, d, 0,
                    forecastPath(y, w, d, 0, 0, coefficients));
        }

        double[] best = null;
        int bestOrder = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        int firstRow = Math.max(maxOrder, seasonalLag);
        for (int p = 1; p <= maxOrder; p++) {
            int parameters = p + (seasonalLag > 0 ? 1 : 0) + 1;
            if (w.length - firstRow <= parameters) {
                log.debug("AR order {} needs more than {} rows on run [{}, {}]",
                        p, w.length - firstRow, run[0], run[1]);
                continue;
            }
            try {
                OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
                double[][] x = designMatrix(w, p, seasonalLag, firstRow);
                double[] target = new double[w.length - firstRow];
                System.arraycopy(w, firstRow, target, 0, target.length);
                ols.newSampleData(target, x);
                double[] coefficients = ols.estimateRegressionParameters();
                double rss = ols.calculateResidualSumOfSquares();
                int n = target.length;
                double aic = n * Math.log(Math.max(rss / n, VARIANCE_EPSILON)) + 2.0 * coefficients.length;
                if (aic < bestAic) {
                    bestAic = aic;
                    best = coefficients;
                    bestOrder = p;
                }
            } catch (MathIllegalArgumentException e) {
                log.debug("AR order {} not estimable on run [{}, {}]: {}", p, run[0], run[1], e.getMessage());
            }
        }
        if (best == null) {
            throw new ModelFailureException("No AR order in 1.." + maxOrder + " could be estimated on "
                    + length + " points");
        }
        return new ArimaModel(run[0], run[1], bestOrder, d, seasonalLag,
                forecastPath(y, w, d, bestOrder, seasonalLag, best));
    }

    @Override
    public List<Integer> selectTargets(ArimaModel model, WorkingSeries series) {
        List<Integer> targets = new ArrayList<>();
        int from = Math.max(model.getRunEnd(), series.lastLabeledIndex()) + 1;
        int last = Math.min(series.size() - 1, model.getRunEnd() + maxSteps);
        for (int i = from; i <= last; i++) {
            if (series.isMissing(i)) {
                targets.add(i);
            }
        }
        return targets;
    }

    @Override
    public double predict(ArimaModel model, WorkingSeries series, int index) throws ModelFailureException {
        int steps = index - model.getRunEnd();
        if (steps < 1) {
            throw new ModelFailureException("Backward extrapolation to index " + index
                    + " before training run end " + model.getRunEnd());
        }
        if (steps > model.getMaxSteps()) {
            throw new ModelFailureException("Forecast horizon " + steps + " exceeds " + model.getMaxSteps());
        }
        double value = model.forecast(steps);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ModelFailureException("Non-finite forecast at step " + steps + " of " + model.describe());
        }
        return value;
    }

    @Override
    public boolean skipsFailedPoints() {
        return true;
    }

    /**
     * 以最后一个有值点结尾的连续有值区间 [start, end]；无有值点返回null
     */
    static int[] trailingLabeledRun(WorkingSeries series) {
        int end = series.lastLabeledIndex();
        if (end < 0) {
            return null;
        }
        int start = end;
        while (start > 0 && !series.isMissing(start - 1)) {
            start--;
        }
        return new int[]{start, end};
    }

    private static boolean needsDifferencing(double[] y) {
        double mean = StatUtils.mean(y);
        double denominator = 0.0;
        double numerator = 0.0;
        for (int t = 0; t < y.length; t++) {
            double dev = y[t] - mean;
            denominator += dev * dev;
            if (t > 0) {
                numerator += dev * (y[t - 1] - mean);
            }
        }
        return denominator > VARIANCE_EPSILON && numerator / denominator > UNIT_ROOT_AUTOCORRELATION;
    }

    private static double[] difference(double[] y) {
        double[] w = new double[y.length - 1];
        for (int t = 1; t < y.length; t++) {
            w[t - 1] = y[t] - y[t - 1];
        }
        return w;
    }

    private static double[][] designMatrix(double[] w, int p, int seasonalLag, int firstRow) {
        int columns = p + (seasonalLag > 0 ? 1 : 0);
        double[][] x = new double[w.length - firstRow][columns];
        for (int t = firstRow; t < w.length; t++) {
            double[] row = x[t - firstRow];
            for (int i = 1; i <= p; i++) {
                row[i - 1] = w[t - i];
            }
            if (seasonalLag > 0) {
                row[p] = w[t - seasonalLag];
            }
        }
        return x;
    }

    /**
     * 递推多步预测，差分模型再累加回原尺度
     */
    private double[] forecastPath(double[] y, double[] w, int d, int p, int seasonalLag, double[] coefficients) {
        double[] extended = new double[w.length + maxSteps];
        System.arraycopy(w, 0, extended, 0, w.length);
        double[] path = new double[maxSteps];
        double level = y[y.length - 1];
        for (int h = 0; h < maxSteps; h++) {
            int t = w.length + h;
            double next = coefficients[0];
            for (int i = 1; i <= p; i++) {
                next += coefficients[i] * extended[t - i];
            }
            if (seasonalLag > 0) {
                next += coefficients[p + 1] * extended[t - seasonalLag];
            }
            extended[t] = next;
            if (d == 1) {
                level += next;
                path[h] = level;
            } else {
                path[h] = next;
            }
        }
        return path;
    }
}
