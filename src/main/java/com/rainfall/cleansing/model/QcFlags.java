package com.rainfall.cleansing.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 质控标志位。
 * 各阶段对数据点的处理以位或方式累积，标志一旦设置永不清除。
 */
public final class QcFlags {

    /** 超出物理量程被剔除 */
    public static final int OUTLIER = 1;
    /** 数值由插补阶段生成 */
    public static final int IMPUTED = 2;
    /** 质量值低于阈值被剔除 */
    public static final int POOR_QUALITY = 4;

    private QcFlags() {}

    public static boolean has(int flags, int flag) {
        return (flags & flag) == flag;
    }

    /** 标志位的可读形式，如 "OUTLIER|IMPUTED" */
    public static String describe(int flags) {
        List<String> names = new ArrayList<>();
        if (has(flags, OUTLIER)) names.add("OUTLIER");
        if (has(flags, IMPUTED)) names.add("IMPUTED");
        if (has(flags, POOR_QUALITY)) names.add("POOR_QUALITY");
        return names.isEmpty() ? "NONE" : String.join("|", names);
    }
}
