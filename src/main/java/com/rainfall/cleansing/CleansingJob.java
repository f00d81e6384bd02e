package com.rainfall.cleansing;

import com.rainfall.cleansing.core.DataStorage;
import com.rainfall.cleansing.core.TaskExecutor;
import com.rainfall.cleansing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 清洗作业：从原始库读取待清洗记录，执行级联，再upsert到清洗库。
 *
 * 两种运行方式：
 * - 增量：处理回看窗口内尚未清洗的原始记录
 * - 回填：从原始库最早的整点起按固定时长分块，逐块处理直到最晚记录
 *
 * 试运行模式只计算和记录预览，不写清洗库。
 */
public class CleansingJob {

    private static final Logger log = LoggerFactory.getLogger(CleansingJob.class);

    private static final int PREVIEW_ROWS = 5;

    private final CleansingConfig config;
    private final DataStorage dataStorage;
    private final TaskExecutor taskExecutor;

    public CleansingJob(CleansingConfig config, DataStorage dataStorage, TaskExecutor taskExecutor) {
        this.config = config;
        this.dataStorage = dataStorage;
        this.taskExecutor = taskExecutor;
    }

    /**
     * 增量清洗回看窗口 [now - lookback, ...) 内的原始记录
     */
    public RunReport runIncremental(Instant now) {
        Instant since = now.minus(config.getLookback());
        log.info("Starting cleaner (since={}, dryRun={}, forecast={}/{}, fallback={})",
                since, config.isDryRun(), config.isForecastEnabled(),
                config.getForecastModel().getConfigValue(), config.getFallbackPolicy().getConfigValue());

        List<RawSample> raw = dataStorage.fetchRawSamples(config.getVariable(), since, config.getVersion());
        if (raw.isEmpty()) {
            log.info("No raw measurements to process");
            return new RunReport();
        }
        RunReport report = cleanAndStore(raw);
        log.info("Cleaner finished: {}", report);
        return report;
    }

    /**
     * 按块回填原始库的全部时间范围
     */
    public RunReport backfill() {
        Duration chunk = Duration.ofHours(config.getBackfillChunkHours());
        log.info("Starting cleaning backfill (chunk={}h, dryRun={})", chunk.toHours(), config.isDryRun());

        RunReport total = new RunReport();
        Optional<TimeRange> bounds = dataStorage.rawTimeBounds(config.getVariable());
        if (!bounds.isPresent()) {
            log.info("No raw measurements found");
            return total;
        }
        Instant first = bounds.get().getStart();
        Instant last = bounds.get().getEnd();
        log.info("Raw bounds: {} to {}", first, last);

        Instant current = first.truncatedTo(ChronoUnit.HOURS);
        Instant limit = last.plus(Duration.ofHours(1));
        while (!current.isAfter(last)) {
            Instant windowEnd = current.plus(chunk).isBefore(limit) ? current.plus(chunk) : limit;
            TimeRange window = new TimeRange(current, windowEnd);

            List<RawSample> raw = dataStorage.fetchRawRange(config.getVariable(), window, config.getVersion());
            if (raw.isEmpty()) {
                log.debug("Window {} empty, skipping", window);
            } else {
                log.info("Processing window {} with {} raw rows", window, raw.size());
                total.merge(cleanAndStore(raw));
            }
            current = windowEnd;
        }

        log.info("Finished backfill: {}", total);
        return total;
    }

    private RunReport cleanAndStore(List<RawSample> raw) {
        RunReport report = taskExecutor.execute(raw);
        List<CleanRow> rows = report.getRows();
        if (!report.getFailedSensors().isEmpty()) {
            log.warn("{} sensors failed and were skipped: {}",
                    report.getFailedSensors().size(), report.getFailureReasons());
        }
        if (rows.isEmpty()) {
            log.info("Nothing to insert after cleaning");
            return report;
        }

        if (config.isDryRun()) {
            log.info("Dry-run enabled, skipping upsert of {} rows. preview={}",
                    rows.size(), rows.subList(0, Math.min(PREVIEW_ROWS, rows.size())));
            return report;
        }

        int upserted = dataStorage.upsertCleanRows(rows);
        report.setUpsertedRows(upserted);
        log.info("Upserted {} rows into clean_measurements", upserted);
        return report;
    }
}
