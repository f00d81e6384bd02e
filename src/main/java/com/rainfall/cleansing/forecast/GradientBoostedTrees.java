package com.rainfall.cleansing.forecast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 最小二乘梯度提升回归模型。
 * 初值取训练目标均值，每轮用一棵回归树拟合残差并按学习率累加。
 * 子采样比例小于1时按随机种子无放回抽样，同一种子结果完全一致。
 */
public class GradientBoostedTrees {

    private final double baseline;
    private final double learningRate;
    private final List<RegressionTree> trees;

    private GradientBoostedTrees(double baseline, double learningRate, List<RegressionTree> trees) {
        this.baseline = baseline;
        this.learningRate = learningRate;
        this.trees = trees;
    }

    public static GradientBoostedTrees fit(double[][] x, double[] y, int estimators, int maxDepth,
                                           int minSamplesLeaf, double learningRate, double subsample,
                                           long seed) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Training set must be non-empty with matching sizes, got "
                    + x.length + " rows and " + y.length + " targets");
        }
        double sum = 0.0;
        for (double v : y) {
            sum += v;
        }
        double baseline = sum / y.length;

        double[] predictions = new double[y.length];
        Arrays.fill(predictions, baseline);
        double[] residuals = new double[y.length];
        Random random = new Random(seed);
        List<RegressionTree> trees = new ArrayList<>(estimators);

        for (int m = 0; m < estimators; m++) {
            for (int i = 0; i < y.length; i++) {
                residuals[i] = y[i] - predictions[i];
            }
            int[] rows = sampleRows(y.length, subsample, random);
            RegressionTree tree = RegressionTree.fit(x, residuals, rows, maxDepth, minSamplesLeaf);
            trees.add(tree);
            for (int i = 0; i < y.length; i++) {
                predictions[i] += learningRate * tree.predict(x[i]);
            }
        }
        return new GradientBoostedTrees(baseline, learningRate, Collections.unmodifiableList(trees));
    }

    public double predict(double[] features) {
        double value = baseline;
        for (RegressionTree tree : trees) {
            value += learningRate * tree.predict(features);
        }
        return value;
    }

    public int getTreeCount() {
        return trees.size();
    }

    private static int[] sampleRows(int size, double subsample, Random random) {
        int count = subsample >= 1.0 ? size : Math.max(1, (int) Math.round(size * subsample));
        int[] rows = new int[size];
        for (int i = 0; i < size; i++) {
            rows[i] = i;
        }
        if (count == size) {
            return rows;
        }
        // 部分Fisher-Yates洗牌，取前count个
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(size - i);
            int tmp = rows[i];
            rows[i] = rows[j];
            rows[j] = tmp;
        }
        return Arrays.copyOf(rows, count);
    }
}
