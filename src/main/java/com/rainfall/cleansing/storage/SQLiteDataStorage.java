package com.rainfall.cleansing.storage;

import com.rainfall.cleansing.core.DataStorage;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 基于SQLite的数据存储实现。
 *
 * 核心设计：
 * - 原始库 raw_measurements 与清洗库 clean_measurements 位于同一个数据库文件
 * - 时间戳以纪元毫秒存为INTEGER，(sensor_id, ts) 建B-tree索引
 * - 清洗结果以 (sensor_id, ts, version) 为键upsert，重复运行同一窗口结果不变
 * - WAL模式，读写互不阻塞
 */
public class SQLiteDataStorage implements DataStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDataStorage.class);

    private static final String RAW_COLUMNS = "rm.sensor_id, rm.ts, rm.value_mm, rm.quality, rm.variable, rm.source";

    /** 尚未以给定版本清洗过的原始记录 */
    private static final String UNCLEANED_JOIN = " FROM raw_measurements rm"
            + " LEFT JOIN clean_measurements cm"
            + " ON cm.sensor_id = rm.sensor_id AND cm.ts = rm.ts AND cm.version = ?"
            + " WHERE cm.sensor_id IS NULL AND rm.variable = ?";

    private final String databasePath;

    private final Connection connection;

    public SQLiteDataStorage(String databasePath) {
        this.databasePath = databasePath;

        // 确保存储目录存在
        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new StorageException("Failed to create storage directory: " + parent, null);
        }

        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
            connection.setAutoCommit(true);
            initSchema();
        } catch (SQLException e) {
            throw new StorageException("Failed to open database at " + databasePath, e);
        }
        log.info("SQLiteDataStorage initialized at: {}", databasePath);
    }

    // ==================== 原始库读取 ====================

    @Override
    public synchronized List<RawSample> fetchRawSamples(String variable, Instant since, int version) {
        String sql = "SELECT " + RAW_COLUMNS + UNCLEANED_JOIN
                + " AND rm.ts >= ? ORDER BY rm.sensor_id, rm.ts";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, version);
            stmt.setString(2, variable);
            stmt.setLong(3, since.toEpochMilli());
            return readRawSamples(stmt);
        } catch (SQLException e) {
            throw new StorageException("Failed to fetch raw samples since " + since, e);
        }
    }

    @Override
    public synchronized List<RawSample> fetchRawRange(String variable, TimeRange range, int version) {
        String sql = "SELECT " + RAW_COLUMNS + UNCLEANED_JOIN
                + " AND rm.ts >= ? AND rm.ts < ? ORDER BY rm.sensor_id, rm.ts";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, version);
            stmt.setString(2, variable);
            stmt.setLong(3, range.getStart().toEpochMilli());
            stmt.setLong(4, range.getEnd().toEpochMilli());
            return readRawSamples(stmt);
        } catch (SQLException e) {
            throw new StorageException("Failed to fetch raw samples in " + range, e);
        }
    }

    @Override
    public synchronized Optional<TimeRange> rawTimeBounds(String variable) {
        String sql = "SELECT MIN(ts), MAX(ts) FROM raw_measurements WHERE variable = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, variable);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long min = rs.getLong(1);
                if (rs.wasNull()) {
                    return Optional.empty();
                }
                long max = rs.getLong(2);
                return Optional.of(new TimeRange(Instant.ofEpochMilli(min), Instant.ofEpochMilli(max)));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read raw time bounds", e);
        }
    }

    // ==================== 写入 ====================

    @Override
    public synchronized int insertRawSamples(List<RawSample> samples) {
        if (samples.isEmpty()) return 0;
        String sql = "INSERT INTO raw_measurements (sensor_id, ts, value_mm, quality, variable, source) "
                + "VALUES (?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT(sensor_id, ts, variable) DO UPDATE SET "
                + "value_mm = excluded.value_mm, quality = excluded.quality, source = excluded.source";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (RawSample sample : samples) {
                if (sample.getSensorId() == null || sample.getTimestamp() == null || sample.getVariable() == null) {
                    throw new IllegalArgumentException("Raw sample requires sensor id, timestamp and variable: "
                            + sample);
                }
                stmt.setString(1, sample.getSensorId());
                stmt.setLong(2, sample.getTimestamp().toEpochMilli());
                setNullableDouble(stmt, 3, sample.getValue());
                setNullableDouble(stmt, 4, sample.getQuality());
                stmt.setString(5, sample.getVariable());
                stmt.setString(6, sample.getSource());
                stmt.addBatch();
            }
            return executeInTransaction(stmt);
        } catch (SQLException e) {
            throw new StorageException("Failed to insert " + samples.size() + " raw samples", e);
        }
    }

    @Override
    public synchronized int upsertCleanRows(List<CleanRow> rows) {
        if (rows.isEmpty()) return 0;
        String sql = "INSERT INTO clean_measurements "
                + "(sensor_id, ts, value_mm, qc_flags, imputation_method, version, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT(sensor_id, ts, version) DO UPDATE SET "
                + "value_mm = excluded.value_mm, qc_flags = excluded.qc_flags, "
                + "imputation_method = excluded.imputation_method, updated_at = excluded.updated_at";
        long now = System.currentTimeMillis();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (CleanRow row : rows) {
                stmt.setString(1, row.getSensorId());
                stmt.setLong(2, row.getTimestamp().toEpochMilli());
                stmt.setDouble(3, row.getValue());
                stmt.setInt(4, row.getQcFlags());
                stmt.setString(5, row.getImputationMethod());
                stmt.setInt(6, row.getVersion());
                stmt.setLong(7, now);
                stmt.addBatch();
            }
            int affected = executeInTransaction(stmt);
            log.debug("Upserted {} clean rows", affected);
            return affected;
        } catch (SQLException e) {
            throw new StorageException("Failed to upsert " + rows.size() + " clean rows", e);
        }
    }

    @Override
    public synchronized List<CleanRow> queryCleanRows(String sensorId, TimeRange range, int version) {
        String sql = "SELECT sensor_id, ts, value_mm, qc_flags, imputation_method, version "
                + "FROM clean_measurements WHERE sensor_id = ? AND version = ? AND ts >= ? AND ts < ? "
                + "ORDER BY ts ASC";
        List<CleanRow> result = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, sensorId);
            stmt.setInt(2, version);
            stmt.setLong(3, range.getStart().toEpochMilli());
            stmt.setLong(4, range.getEnd().toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new CleanRow(
                            rs.getString("sensor_id"),
                            Instant.ofEpochMilli(rs.getLong("ts")),
                            rs.getDouble("value_mm"),
                            rs.getInt("qc_flags"),
                            rs.getString("imputation_method"),
                            rs.getInt("version")));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageException("Failed to query clean rows of sensor '" + sensorId + "'", e);
        }
    }

    // ==================== 内部工具方法 ====================

    private void initSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            // 启用WAL模式
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");

            stmt.execute("CREATE TABLE IF NOT EXISTS raw_measurements ("
                    + "sensor_id TEXT NOT NULL, "
                    + "ts INTEGER NOT NULL, "
                    + "value_mm REAL, "
                    + "quality REAL, "
                    + "variable TEXT NOT NULL, "
                    + "source TEXT, "
                    + "PRIMARY KEY (sensor_id, ts, variable))");
            stmt.execute("CREATE INDEX IF NOT EXISTS raw_measurements_ts_idx ON raw_measurements (ts)");

            stmt.execute("CREATE TABLE IF NOT EXISTS clean_measurements ("
                    + "sensor_id TEXT NOT NULL, "
                    + "ts INTEGER NOT NULL, "
                    + "value_mm REAL NOT NULL, "
                    + "qc_flags INTEGER NOT NULL DEFAULT 0, "
                    + "imputation_method TEXT, "
                    + "version INTEGER NOT NULL DEFAULT 1, "
                    + "updated_at INTEGER NOT NULL, "
                    + "UNIQUE (sensor_id, ts, version))");
            stmt.execute("CREATE INDEX IF NOT EXISTS clean_measurements_ts_idx ON clean_measurements (ts)");
        }
    }

    private List<RawSample> readRawSamples(PreparedStatement stmt) throws SQLException {
        List<RawSample> samples = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                samples.add(new RawSample(
                        rs.getString("sensor_id"),
                        Instant.ofEpochMilli(rs.getLong("ts")),
                        getNullableDouble(rs, "value_mm"),
                        getNullableDouble(rs, "quality"),
                        rs.getString("variable"),
                        rs.getString("source")));
            }
        }
        return samples;
    }

    private int executeInTransaction(PreparedStatement stmt) throws SQLException {
        connection.setAutoCommit(false);
        try {
            int total = 0;
            for (int count : stmt.executeBatch()) {
                total += Math.max(count, 0);
            }
            connection.commit();
            return total;
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null || value.isNaN() || value.isInfinite()) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    /** 关闭连接 */
    @Override
    public synchronized void close() {
        try {
            connection.close();
            log.info("SQLiteDataStorage closed: {}", databasePath);
        } catch (SQLException e) {
            log.warn("Failed to close database {}: {}", databasePath, e.getMessage(), e);
        }
    }
}
