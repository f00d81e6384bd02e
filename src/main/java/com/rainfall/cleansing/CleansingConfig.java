package com.rainfall.cleansing;

import com.rainfall.cleansing.model.FallbackPolicy;
import com.rainfall.cleansing.model.ForecastModelType;
import com.rainfall.cleansing.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 清洗服务配置。
 * 每次运行构造一次并显式传递给各组件，不使用全局状态。
 */
public class CleansingConfig {

    private static final Logger log = LoggerFactory.getLogger(CleansingConfig.class);

    public static final String MIN_VALUE_MM = "cleaner.min.value.mm";
    public static final String MAX_VALUE_MM = "cleaner.max.value.mm";
    public static final String MIN_QUALITY = "cleaner.min.quality";
    public static final String INTERPOLATION_LIMIT = "cleaner.interpolation.limit";
    public static final String FORECAST_ENABLED = "cleaner.forecast.enabled";
    public static final String FORECAST_MODEL = "cleaner.forecast.model";
    public static final String ARIMA_MIN_TRAIN = "cleaner.arima.min.train";
    public static final String ARIMA_MAX_ORDER = "cleaner.arima.max.order";
    public static final String ARIMA_SEASONAL = "cleaner.arima.seasonal";
    public static final String ARIMA_SEASONAL_PERIOD = "cleaner.arima.seasonal.period";
    public static final String ARIMA_MAX_STEPS = "cleaner.arima.max.steps";
    public static final String ARIMA_MAX_ITERATIONS = "cleaner.arima.max.iterations";
    public static final String GBM_MAX_DEPTH = "cleaner.gbm.max.depth";
    public static final String GBM_LEARNING_RATE = "cleaner.gbm.learning.rate";
    public static final String GBM_ESTIMATORS = "cleaner.gbm.estimators";
    public static final String GBM_MIN_SAMPLES_LEAF = "cleaner.gbm.min.samples.leaf";
    public static final String GBM_SUBSAMPLE = "cleaner.gbm.subsample";
    public static final String GBM_MIN_TRAIN = "cleaner.gbm.min.train";
    public static final String GBM_MAX_ITERATIONS = "cleaner.gbm.max.iterations";
    public static final String GBM_RANDOM_SEED = "cleaner.gbm.random.seed";
    public static final String FALLBACK_POLICY = "cleaner.fallback.policy";
    public static final String AGGREGATION_ENABLED = "cleaner.aggregation.enabled";
    public static final String AGGREGATION_BUCKET_MINUTES = "cleaner.aggregation.bucket.minutes";

    // ---- 运行 ----
    private String storagePath = "data/cleaner.db";
    private int lookbackHours = 72;
    private int backfillChunkHours = 24;
    private boolean dryRun = false;
    private String variable = "precipitacion";
    private int version = 1;
    private int workerParallelism = 1;

    // ---- 质控 ----
    private double minValueMm = 0.0;
    private double maxValueMm = 150.0;
    private Double minQuality = null;
    private int interpolationLimit = 6;

    // ---- 预测填补 ----
    private boolean forecastEnabled = true;
    private ForecastModelType forecastModel = ForecastModelType.ARIMA;
    private int arimaMinTrain = 48;
    private int arimaMaxOrder = 3;
    private boolean arimaSeasonal = true;
    private int arimaSeasonalPeriod = 24;
    private int arimaMaxSteps = 100;
    private int arimaMaxIterations = 3;
    private int gbmMaxDepth = 3;
    private double gbmLearningRate = 0.1;
    private int gbmEstimators = 100;
    private int gbmMinSamplesLeaf = 5;
    private double gbmSubsample = 1.0;
    private int gbmMinTrain = 24;
    private int gbmMaxIterations = 3;
    private long gbmRandomSeed = 42L;

    // ---- 兜底与聚合 ----
    private FallbackPolicy fallbackPolicy = FallbackPolicy.MEDIAN_OR_FLOOR;
    private boolean aggregationEnabled = false;
    private int aggregationBucketMinutes = 10;

    // ---- Kafka ----
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaInputTopic = "precip-raw-samples";
    private String kafkaGroupId = "precip-cleaner";

    public static CleansingConfig defaults() {
        return new CleansingConfig();
    }

    /**
     * 从properties文件加载配置；文件不可读时使用默认值。
     * 环境变量 CLEANER_DB_PATH / DRY_RUN 覆盖文件中的对应项。
     */
    public static CleansingConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        String dbPath = System.getenv("CLEANER_DB_PATH");
        if (dbPath != null && !dbPath.isBlank()) {
            props.setProperty("storage.path", dbPath);
        }
        String dryRun = System.getenv("DRY_RUN");
        if (dryRun != null && !dryRun.isBlank()) {
            props.setProperty("cleaner.dry.run", dryRun);
        }
        return fromProperties(props);
    }

    /**
     * 从Properties解析配置，格式错误时抛出IllegalArgumentException。
     */
    public static CleansingConfig fromProperties(Properties props) {
        CleansingConfig config = new CleansingConfig();

        config.storagePath = props.getProperty("storage.path", config.storagePath);
        config.lookbackHours = parseInt(props, "cleaner.lookback.hours", config.lookbackHours);
        config.backfillChunkHours = parseInt(props, "cleaner.backfill.chunk.hours", config.backfillChunkHours);
        config.dryRun = parseBool(props, "cleaner.dry.run", config.dryRun);
        config.variable = props.getProperty("cleaner.variable", config.variable);
        config.version = parseInt(props, "cleaner.version", config.version);
        config.workerParallelism = parseInt(props, "worker.parallelism", config.workerParallelism);

        config.minValueMm = parseDouble(props, MIN_VALUE_MM, config.minValueMm);
        config.maxValueMm = parseDouble(props, MAX_VALUE_MM, config.maxValueMm);
        config.minQuality = parseOptionalDouble(props, MIN_QUALITY);
        config.interpolationLimit = parseInt(props, INTERPOLATION_LIMIT, config.interpolationLimit);

        config.forecastEnabled = parseBool(props, FORECAST_ENABLED, config.forecastEnabled);
        String model = props.getProperty(FORECAST_MODEL);
        if (model != null && !model.isBlank()) {
            config.forecastModel = ForecastModelType.fromConfigValue(model);
        }
        config.arimaMinTrain = parseInt(props, ARIMA_MIN_TRAIN, config.arimaMinTrain);
        config.arimaMaxOrder = parseInt(props, ARIMA_MAX_ORDER, config.arimaMaxOrder);
        config.arimaSeasonal = parseBool(props, ARIMA_SEASONAL, config.arimaSeasonal);
        config.arimaSeasonalPeriod = parseInt(props, ARIMA_SEASONAL_PERIOD, config.arimaSeasonalPeriod);
        config.arimaMaxSteps = parseInt(props, ARIMA_MAX_STEPS, config.arimaMaxSteps);
        config.arimaMaxIterations = parseInt(props, ARIMA_MAX_ITERATIONS, config.arimaMaxIterations);
        config.gbmMaxDepth = parseInt(props, GBM_MAX_DEPTH, config.gbmMaxDepth);
        config.gbmLearningRate = parseDouble(props, GBM_LEARNING_RATE, config.gbmLearningRate);
        config.gbmEstimators = parseInt(props, GBM_ESTIMATORS, config.gbmEstimators);
        config.gbmMinSamplesLeaf = parseInt(props, GBM_MIN_SAMPLES_LEAF, config.gbmMinSamplesLeaf);
        config.gbmSubsample = parseDouble(props, GBM_SUBSAMPLE, config.gbmSubsample);
        config.gbmMinTrain = parseInt(props, GBM_MIN_TRAIN, config.gbmMinTrain);
        config.gbmMaxIterations = parseInt(props, GBM_MAX_ITERATIONS, config.gbmMaxIterations);
        config.gbmRandomSeed = parseLong(props, GBM_RANDOM_SEED, config.gbmRandomSeed);

        String policy = props.getProperty(FALLBACK_POLICY);
        if (policy != null && !policy.isBlank()) {
            config.fallbackPolicy = FallbackPolicy.fromConfigValue(policy);
        }
        config.aggregationEnabled = parseBool(props, AGGREGATION_ENABLED, config.aggregationEnabled);
        config.aggregationBucketMinutes = parseInt(props, AGGREGATION_BUCKET_MINUTES, config.aggregationBucketMinutes);

        config.kafkaBootstrapServers = props.getProperty("kafka.bootstrap.servers", config.kafkaBootstrapServers);
        config.kafkaInputTopic = props.getProperty("kafka.input.topic", config.kafkaInputTopic);
        config.kafkaGroupId = props.getProperty("kafka.group.id", config.kafkaGroupId);
        return config;
    }

    /**
     * 跨字段校验。单项取值范围由各阶段的参数定义校验。
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();
        if (!(minValueMm < maxValueMm)) {
            result.addError("min value " + minValueMm + " must be below max value " + maxValueMm);
        }
        if (lookbackHours <= 0) {
            result.addError("lookback hours must be positive, got " + lookbackHours);
        }
        if (backfillChunkHours <= 0) {
            result.addError("backfill chunk hours must be positive, got " + backfillChunkHours);
        }
        if (workerParallelism < 1) {
            result.addError("worker parallelism must be at least 1, got " + workerParallelism);
        }
        if (variable == null || variable.isBlank()) {
            result.addError("variable must not be blank");
        }
        if (forecastEnabled && forecastModel == ForecastModelType.GBM && gbmMinTrain < gbmMinSamplesLeaf * 2) {
            result.addWarning("gbm min train " + gbmMinTrain + " is smaller than two leaves of "
                    + gbmMinSamplesLeaf + " samples, trees will not split");
        }
        return result;
    }

    /**
     * 清洗阶段可见的参数视图，键为配置项名，供参数定义校验使用。
     */
    public Map<String, Object> asParameterMap() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(MIN_VALUE_MM, minValueMm);
        params.put(MAX_VALUE_MM, maxValueMm);
        if (minQuality != null) {
            params.put(MIN_QUALITY, minQuality);
        }
        params.put(INTERPOLATION_LIMIT, interpolationLimit);
        params.put(FORECAST_ENABLED, forecastEnabled);
        params.put(FORECAST_MODEL, forecastModel.getConfigValue());
        params.put(ARIMA_MIN_TRAIN, arimaMinTrain);
        params.put(ARIMA_MAX_ORDER, arimaMaxOrder);
        params.put(ARIMA_SEASONAL, arimaSeasonal);
        params.put(ARIMA_SEASONAL_PERIOD, arimaSeasonalPeriod);
        params.put(ARIMA_MAX_STEPS, arimaMaxSteps);
        params.put(ARIMA_MAX_ITERATIONS, arimaMaxIterations);
        params.put(GBM_MAX_DEPTH, gbmMaxDepth);
        params.put(GBM_LEARNING_RATE, gbmLearningRate);
        params.put(GBM_ESTIMATORS, gbmEstimators);
        params.put(GBM_MIN_SAMPLES_LEAF, gbmMinSamplesLeaf);
        params.put(GBM_SUBSAMPLE, gbmSubsample);
        params.put(GBM_MIN_TRAIN, gbmMinTrain);
        params.put(GBM_MAX_ITERATIONS, gbmMaxIterations);
        params.put(GBM_RANDOM_SEED, gbmRandomSeed);
        params.put(FALLBACK_POLICY, fallbackPolicy.getConfigValue());
        params.put(AGGREGATION_ENABLED, aggregationEnabled);
        params.put(AGGREGATION_BUCKET_MINUTES, aggregationBucketMinutes);
        return params;
    }

    // ---- 解析工具 ----

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        return (value == null || value.trim().isEmpty()) ? null : value.trim();
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = trimmed(props, key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' expects an integer, got: " + value, e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = trimmed(props, key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' expects an integer, got: " + value, e);
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        Double value = parseOptionalDouble(props, key);
        return value == null ? defaultValue : value;
    }

    private static Double parseOptionalDouble(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null) return null;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' expects a number, got: " + value, e);
        }
    }

    private static boolean parseBool(Properties props, String key, boolean defaultValue) {
        String value = trimmed(props, key);
        if (value == null) return defaultValue;
        String lower = value.toLowerCase();
        return lower.equals("1") || lower.equals("true") || lower.equals("yes");
    }

    // ---- 链式设置（用于测试及配置档） ----
    public CleansingConfig withStoragePath(String storagePath) { this.storagePath = storagePath; return this; }
    public CleansingConfig withLookbackHours(int lookbackHours) { this.lookbackHours = lookbackHours; return this; }
    public CleansingConfig withBackfillChunkHours(int hours) { this.backfillChunkHours = hours; return this; }
    public CleansingConfig withDryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
    public CleansingConfig withWorkerParallelism(int parallelism) { this.workerParallelism = parallelism; return this; }
    public CleansingConfig withValueRange(double min, double max) { this.minValueMm = min; this.maxValueMm = max; return this; }
    public CleansingConfig withMinQuality(Double minQuality) { this.minQuality = minQuality; return this; }
    public CleansingConfig withInterpolationLimit(int limit) { this.interpolationLimit = limit; return this; }
    public CleansingConfig withForecastEnabled(boolean enabled) { this.forecastEnabled = enabled; return this; }
    public CleansingConfig withForecastModel(ForecastModelType model) { this.forecastModel = model; return this; }
    public CleansingConfig withArimaMinTrain(int minTrain) { this.arimaMinTrain = minTrain; return this; }
    public CleansingConfig withArimaMaxOrder(int maxOrder) { this.arimaMaxOrder = maxOrder; return this; }
    public CleansingConfig withArimaSeasonal(boolean seasonal, int period) { this.arimaSeasonal = seasonal; this.arimaSeasonalPeriod = period; return this; }
    public CleansingConfig withArimaMaxSteps(int maxSteps) { this.arimaMaxSteps = maxSteps; return this; }
    public CleansingConfig withGbmMinTrain(int minTrain) { this.gbmMinTrain = minTrain; return this; }
    public CleansingConfig withGbmMaxIterations(int maxIterations) { this.gbmMaxIterations = maxIterations; return this; }
    public CleansingConfig withGbmEstimators(int estimators) { this.gbmEstimators = estimators; return this; }
    public CleansingConfig withGbmRandomSeed(long seed) { this.gbmRandomSeed = seed; return this; }
    public CleansingConfig withGbmSubsample(double subsample) { this.gbmSubsample = subsample; return this; }
    public CleansingConfig withFallbackPolicy(FallbackPolicy policy) { this.fallbackPolicy = policy; return this; }
    public CleansingConfig withAggregation(boolean enabled, int bucketMinutes) { this.aggregationEnabled = enabled; this.aggregationBucketMinutes = bucketMinutes; return this; }

    // ---- Getters ----
    public String getStoragePath() { return storagePath; }
    public int getLookbackHours() { return lookbackHours; }
    public Duration getLookback() { return Duration.ofHours(lookbackHours); }
    public int getBackfillChunkHours() { return backfillChunkHours; }
    public boolean isDryRun() { return dryRun; }
    public String getVariable() { return variable; }
    public int getVersion() { return version; }
    public int getWorkerParallelism() { return workerParallelism; }
    public double getMinValueMm() { return minValueMm; }
    public double getMaxValueMm() { return maxValueMm; }
    public Double getMinQuality() { return minQuality; }
    public int getInterpolationLimit() { return interpolationLimit; }
    public boolean isForecastEnabled() { return forecastEnabled; }
    public ForecastModelType getForecastModel() { return forecastModel; }
    public int getArimaMinTrain() { return arimaMinTrain; }
    public int getArimaMaxOrder() { return arimaMaxOrder; }
    public boolean isArimaSeasonal() { return arimaSeasonal; }
    public int getArimaSeasonalPeriod() { return arimaSeasonalPeriod; }
    public int getArimaMaxSteps() { return arimaMaxSteps; }
    public int getArimaMaxIterations() { return arimaMaxIterations; }
    public int getGbmMaxDepth() { return gbmMaxDepth; }
    public double getGbmLearningRate() { return gbmLearningRate; }
    public int getGbmEstimators() { return gbmEstimators; }
    public int getGbmMinSamplesLeaf() { return gbmMinSamplesLeaf; }
    public double getGbmSubsample() { return gbmSubsample; }
    public int getGbmMinTrain() { return gbmMinTrain; }
    public int getGbmMaxIterations() { return gbmMaxIterations; }
    public long getGbmRandomSeed() { return gbmRandomSeed; }
    public FallbackPolicy getFallbackPolicy() { return fallbackPolicy; }
    public boolean isAggregationEnabled() { return aggregationEnabled; }
    public int getAggregationBucketMinutes() { return aggregationBucketMinutes; }
    public Duration getAggregationBucket() { return Duration.ofMinutes(aggregationBucketMinutes); }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaInputTopic() { return kafkaInputTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "CleansingConfig{storage='" + storagePath + "'"
                + ", lookback=" + lookbackHours + "h"
                + ", range=[" + minValueMm + ", " + maxValueMm + "]"
                + ", minQuality=" + minQuality
                + ", interpLimit=" + interpolationLimit
                + ", forecast=" + (forecastEnabled ? forecastModel.getConfigValue() : "off")
                + ", fallback=" + fallbackPolicy.getConfigValue()
                + ", aggregation=" + (aggregationEnabled ? aggregationBucketMinutes + "min" : "off")
                + ", dryRun=" + dryRun + "}";
    }
}
