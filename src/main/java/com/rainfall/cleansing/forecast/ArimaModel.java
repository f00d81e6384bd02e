package com.rainfall.cleansing.forecast;

/**
 * 拟合后的(季节)自回归求和模型。
 *
 * 训练区间为工作序列末尾的连续有值区间 [runStart, runEnd]，
 * 拟合时即按最大步数递推出完整的预测路径，predict只做查表。
 */
public class ArimaModel {

    private final int runStart;
    private final int runEnd;
    private final int arOrder;
    private final int differencing;
    /** 季节自回归项的滞后，0表示无季节项 */
    private final int seasonalLag;
    private final double[] forecastPath;

    ArimaModel(int runStart, int runEnd, int arOrder, int differencing, int seasonalLag,
               double[] forecastPath) {
        this.runStart = runStart;
        this.runEnd = runEnd;
        this.arOrder = arOrder;
        this.differencing = differencing;
        this.seasonalLag = seasonalLag;
        this.forecastPath = forecastPath;
    }

    public int getRunStart() { return runStart; }
    public int getRunEnd() { return runEnd; }
    public int getArOrder() { return arOrder; }
    public int getDifferencing() { return differencing; }
    public int getSeasonalLag() { return seasonalLag; }

    public int getMaxSteps() {
        return forecastPath.length;
    }

    /**
     * 训练区间末点之后第steps步的预测值，steps从1开始
     */
    public double forecast(int steps) {
        return forecastPath[steps - 1];
    }

    public String describe() {
        String order = "ARIMA(" + arOrder + "," + differencing + ",0)";
        return seasonalLag > 0 ? order + "(1,0,0)[" + seasonalLag + "]" : order;
    }

    @Override
    public String toString() {
        return describe() + " on [" + runStart + ", " + runEnd + "]";
    }
}
