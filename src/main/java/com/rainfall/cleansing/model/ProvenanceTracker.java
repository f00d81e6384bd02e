package com.rainfall.cleansing.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 溯源附表：与工作序列按下标对齐，记录每个点的质控标志和插补方法。
 *
 * 标志只增不减；插补方法以首次记录为准，之后的阶段无法覆盖。
 */
public class ProvenanceTracker {

    private final int[] flags;
    private final ImputationMethod[] methods;

    public ProvenanceTracker(int size) {
        this.flags = new int[size];
        this.methods = new ImputationMethod[size];
    }

    public int size() {
        return flags.length;
    }

    public void addFlag(int index, int flag) {
        flags[index] |= flag;
    }

    public int getFlags(int index) {
        return flags[index];
    }

    /**
     * 记录插补方法。
     *
     * @return 该点此前未被插补且本次记录成功时返回true
     */
    public boolean recordImputation(int index, ImputationMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("Imputation method must not be null");
        }
        if (methods[index] != null) {
            return false;
        }
        methods[index] = method;
        return true;
    }

    public ImputationMethod getMethod(int index) {
        return methods[index];
    }

    public boolean isImputed(int index) {
        return methods[index] != null;
    }

    /** 是否已有任何标志或插补记录 */
    public boolean isTouched() {
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] != 0 || methods[i] != null) return true;
        }
        return false;
    }

    public Map<ImputationMethod, Integer> countByMethod() {
        Map<ImputationMethod, Integer> counts = new EnumMap<>(ImputationMethod.class);
        for (ImputationMethod method : methods) {
            if (method != null) {
                counts.merge(method, 1, Integer::sum);
            }
        }
        return counts;
    }
}
