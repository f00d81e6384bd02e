package com.rainfall.cleansing.core;

import com.rainfall.cleansing.model.CleanRow;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 数据存储器接口：原始库与清洗库的持久化层。
 *
 * 清洗管道从这里读取待处理的原始记录，并把结果以幂等upsert写回。
 * 默认由SQLite实现，通过切换适配层可对接其他关系数据库。
 */
public interface DataStorage extends AutoCloseable {

    /**
     * 查询指定时间之后、尚未以给定版本清洗过的原始记录。
     *
     * @param variable 观测变量名
     * @param since    起始时间（含）
     * @param version  清洗版本
     * @return 原始记录，按 (sensorId, timestamp) 升序
     */
    List<RawSample> fetchRawSamples(String variable, Instant since, int version);

    /**
     * 查询时间范围内、尚未以给定版本清洗过的原始记录，用于回填。
     *
     * @return 原始记录，按 (sensorId, timestamp) 升序
     */
    List<RawSample> fetchRawRange(String variable, TimeRange range, int version);

    /**
     * 原始库中指定变量的最早与最晚时间戳。
     *
     * @return 无记录时返回empty；范围的end为最晚时间戳本身
     */
    Optional<TimeRange> rawTimeBounds(String variable);

    /**
     * 写入原始记录，(sensorId, timestamp, variable) 重复时覆盖。
     *
     * @return 写入条数
     */
    int insertRawSamples(List<RawSample> samples);

    /**
     * 以 (sensorId, timestamp, version) 为键upsert清洗结果，后写覆盖先写。
     *
     * @return 受影响行数
     */
    int upsertCleanRows(List<CleanRow> rows);

    /**
     * 查询某传感器在时间范围内的清洗结果。
     *
     * @return 清洗结果行，按时间升序
     */
    List<CleanRow> queryCleanRows(String sensorId, TimeRange range, int version);

    @Override
    void close();
}
