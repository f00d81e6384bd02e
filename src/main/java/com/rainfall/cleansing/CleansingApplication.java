package com.rainfall.cleansing;

import com.rainfall.cleansing.collector.KafkaRawSampleCollector;
import com.rainfall.cleansing.core.impl.DefaultFunctionManager;
import com.rainfall.cleansing.core.impl.DefaultTaskExecutor;
import com.rainfall.cleansing.model.RunReport;
import com.rainfall.cleansing.model.ValidationResult;
import com.rainfall.cleansing.storage.SQLiteDataStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：加载并校验配置、打开存储、注册清洗阶段、执行作业。
 *
 * 用法：java -jar precip-cleansing.jar [run|backfill|collect] [配置文件路径]
 */
public class CleansingApplication {

    private static final Logger log = LoggerFactory.getLogger(CleansingApplication.class);

    static final String DEFAULT_CONFIG_PATH = "config/application.properties";
    static final List<String> MODES = Arrays.asList("run", "backfill", "collect");

    private final CleansingConfig config;
    private SQLiteDataStorage dataStorage;
    private DefaultTaskExecutor taskExecutor;
    private KafkaRawSampleCollector collector;

    public CleansingApplication(CleansingConfig config) {
        this.config = config;
    }

    /**
     * 校验配置与各阶段参数，有错误时抛出IllegalArgumentException
     */
    static DefaultFunctionManager validatedPipeline(CleansingConfig config) {
        DefaultFunctionManager functionManager = DefaultFunctionManager.forConfig(config);
        ValidationResult result = config.validate()
                .merge(functionManager.validateAll(config.asParameterMap()));
        result.getWarnings().forEach(w -> log.warn("Config warning: {}", w));
        result.throwIfInvalid();
        return functionManager;
    }

    public RunReport start(String mode) throws InterruptedException {
        log.info("=== Precipitation Sensor Cleansing ({}) ===", mode);
        log.info("Starting with config: {}", config);

        DefaultFunctionManager functionManager = validatedPipeline(config);
        dataStorage = new SQLiteDataStorage(config.getStoragePath());

        if ("collect".equals(mode)) {
            collector = new KafkaRawSampleCollector(config.getKafkaBootstrapServers(),
                    config.getKafkaInputTopic(), config.getKafkaGroupId(), config.getVariable(), dataStorage);

            // 注册JVM关闭钩子
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown hook triggered, stopping collector...");
                collector.stop();
            }, "shutdown-hook"));

            collector.start();
            collector.awaitTermination();
            return new RunReport();
        }

        taskExecutor = new DefaultTaskExecutor(functionManager, config.getWorkerParallelism());
        CleansingJob job = new CleansingJob(config, dataStorage, taskExecutor);
        return "backfill".equals(mode) ? job.backfill() : job.runIncremental(Instant.now());
    }

    public void shutdown() {
        if (taskExecutor != null) {
            taskExecutor.shutdown();
        }
        if (dataStorage != null) {
            dataStorage.close();
        }
        log.info("=== Cleansing shut down ===");
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String mode = "run";
        String configPath = DEFAULT_CONFIG_PATH;
        if (args.length > 0 && MODES.contains(args[0])) {
            mode = args[0];
            if (args.length > 1) configPath = args[1];
        } else if (args.length > 0) {
            configPath = args[0];
        }

        CleansingApplication app = null;
        int exitCode = 0;
        try {
            app = new CleansingApplication(CleansingConfig.load(configPath));
            RunReport report = app.start(mode);
            if (!report.getFailedSensors().isEmpty()) {
                log.warn("Run completed with {} failed sensors", report.getFailedSensors().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Cleaner interrupted", e);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Cleaner failed", e);
            exitCode = 1;
        } finally {
            if (app != null) {
                app.shutdown();
            }
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
