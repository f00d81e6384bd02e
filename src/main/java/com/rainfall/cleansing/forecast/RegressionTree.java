package com.rainfall.cleansing.forecast;

import java.util.Arrays;
import java.util.Comparator;

/**
 * 最小二乘回归树（CART），作为梯度提升的基学习器。
 * 分裂阈值取相邻不同取值的中点；增益相同时取先遇到的特征与位置，结果确定。
 */
class RegressionTree {

    private static final double MIN_GAIN = 1e-12;

    private final Node root;

    private RegressionTree(Node root) {
        this.root = root;
    }

    /**
     * 在给定样本行上拟合一棵树。
     *
     * @param x              特征矩阵
     * @param y              目标（残差）
     * @param rows           参与训练的行下标
     * @param maxDepth       最大深度
     * @param minSamplesLeaf 叶子最少样本数
     */
    static RegressionTree fit(double[][] x, double[] y, int[] rows, int maxDepth, int minSamplesLeaf) {
        return new RegressionTree(build(x, y, rows, 0, maxDepth, Math.max(1, minSamplesLeaf)));
    }

    double predict(double[] features) {
        Node node = root;
        while (!node.isLeaf()) {
            node = features[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    int depth() {
        return depth(root);
    }

    private static int depth(Node node) {
        return node.isLeaf() ? 0 : 1 + Math.max(depth(node.left), depth(node.right));
    }

    private static Node build(double[][] x, double[] y, int[] rows, int depth, int maxDepth, int minSamplesLeaf) {
        double sum = 0.0;
        for (int r : rows) {
            sum += y[r];
        }
        double mean = sum / rows.length;
        if (depth >= maxDepth || rows.length < 2 * minSamplesLeaf) {
            return Node.leaf(mean);
        }

        int bestFeature = -1;
        double bestThreshold = 0.0;
        double bestGain = MIN_GAIN;
        int bestSplit = -1;
        Integer[] bestOrder = null;
        double parentScore = sum * sum / rows.length;

        int features = x[rows[0]].length;
        for (int f = 0; f < features; f++) {
            final int feature = f;
            Integer[] order = new Integer[rows.length];
            for (int i = 0; i < rows.length; i++) {
                order[i] = rows[i];
            }
            Arrays.sort(order, Comparator.comparingDouble(r -> x[r][feature]));

            double leftSum = 0.0;
            for (int i = 0; i < order.length - 1; i++) {
                leftSum += y[order[i]];
                int leftCount = i + 1;
                int rightCount = order.length - leftCount;
                if (leftCount < minSamplesLeaf || rightCount < minSamplesLeaf) {
                    continue;
                }
                double current = x[order[i]][feature];
                double next = x[order[i + 1]][feature];
                if (current == next) {
                    continue;
                }
                double rightSum = sum - leftSum;
                double gain = leftSum * leftSum / leftCount + rightSum * rightSum / rightCount - parentScore;
                if (gain > bestGain) {
                    bestGain = gain;
                    bestFeature = feature;
                    bestThreshold = (current + next) / 2.0;
                    bestSplit = leftCount;
                    bestOrder = order;
                }
            }
        }

        if (bestFeature < 0) {
            return Node.leaf(mean);
        }

        int[] leftRows = new int[bestSplit];
        int[] rightRows = new int[rows.length - bestSplit];
        for (int i = 0; i < bestOrder.length; i++) {
            if (i < bestSplit) {
                leftRows[i] = bestOrder[i];
            } else {
                rightRows[i - bestSplit] = bestOrder[i];
            }
        }
        return Node.split(bestFeature, bestThreshold,
                build(x, y, leftRows, depth + 1, maxDepth, minSamplesLeaf),
                build(x, y, rightRows, depth + 1, maxDepth, minSamplesLeaf));
    }

    private static final class Node {
        private final int feature;
        private final double threshold;
        private final double value;
        private final Node left;
        private final Node right;

        private Node(int feature, double threshold, double value, Node left, Node right) {
            this.feature = feature;
            this.threshold = threshold;
            this.value = value;
            this.left = left;
            this.right = right;
        }

        static Node leaf(double value) {
            return new Node(-1, 0.0, value, null, null);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, 0.0, left, right);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
