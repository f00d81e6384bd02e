package com.rainfall.cleansing.core.impl;

import static com.rainfall.cleansing.SeriesFixtures.hour;
import static com.rainfall.cleansing.SeriesFixtures.hourlySamples;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.SeriesFixtures;
import com.rainfall.cleansing.core.OperatorContext;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.CleanRow;
import com.rainfall.cleansing.model.FallbackPolicy;
import com.rainfall.cleansing.model.ForecastModelType;
import com.rainfall.cleansing.model.FunctionMetadata;
import com.rainfall.cleansing.model.ImputationMethod;
import com.rainfall.cleansing.model.QcFlags;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.RunReport;
import com.rainfall.cleansing.model.SensorTask;
import com.rainfall.cleansing.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.After;
import org.junit.Test;

public final class TestDefaultTaskExecutor {

    private DefaultTaskExecutor executor;

    @After
    public void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private DefaultTaskExecutor executorFor(CleansingConfig config) {
        executor = new DefaultTaskExecutor(DefaultFunctionManager.forConfig(config), 1);
        return executor;
    }

    private static CleansingConfig noForecast() {
        return CleansingConfig.defaults().withForecastEnabled(false);
    }

    @Test
    public void outlierReplacedByInterpolation() {
        RunReport report = executorFor(noForecast()).execute(hourlySamples("S1", 1.0, 200.0, 3.0));

        List<CleanRow> rows = report.getRows();
        assertEquals(3, rows.size());
        CleanRow fixed = rows.get(1);
        assertEquals(2.0, fixed.getValue(), 1e-9);
        assertEquals(QcFlags.OUTLIER | QcFlags.IMPUTED, fixed.getQcFlags());
        assertEquals("time_interp", fixed.getImputationMethod());
        assertNull(rows.get(0).getImputationMethod());
        assertEquals(0, rows.get(0).getQcFlags());
        assertEquals(1, (int) report.getImputationCounts().get(ImputationMethod.TIME_INTERP));
    }

    @Test
    public void allMissingWithFixedZero() {
        CleansingConfig config = CleansingConfig.defaults().withFallbackPolicy(FallbackPolicy.FIXED_ZERO);
        RunReport report = executorFor(config).execute(hourlySamples("S1", null, null, null));

        assertEquals(3, report.getRows().size());
        for (CleanRow row : report.getRows()) {
            assertEquals(0.0, row.getValue(), 0.0);
            assertEquals("zero_fallback", row.getImputationMethod());
            assertEquals(QcFlags.IMPUTED, row.getQcFlags());
        }
    }

    @Test
    public void allMissingWithMedianFallsBackToFloor() {
        RunReport report = executorFor(noForecast()).execute(hourlySamples("S1", null, -5.0));

        for (CleanRow row : report.getRows()) {
            assertEquals(0.0, row.getValue(), 0.0);
            assertEquals("global_median", row.getImputationMethod());
        }
        assertEquals(QcFlags.OUTLIER | QcFlags.IMPUTED, report.getRows().get(1).getQcFlags());
    }

    @Test
    public void forecastDisabledNeverLabelsForecast() {
        Double[] values = SeriesFixtures.append(SeriesFixtures.linear(60, 0.1), null, null);
        RunReport report = executorFor(noForecast()).execute(hourlySamples("S1", values));

        for (CleanRow row : report.getRows()) {
            assertFalse("arima_forecast".equals(row.getImputationMethod()));
            assertFalse("gbm_forecast".equals(row.getImputationMethod()));
        }
        assertEquals("time_interp", report.getRows().get(61).getImputationMethod());
    }

    @Test
    public void arimaExtendsTrend() {
        Double[] values = SeriesFixtures.append(SeriesFixtures.linear(48, 0.5), null, null);
        RunReport report = executorFor(CleansingConfig.defaults()).execute(hourlySamples("S1", values));

        CleanRow first = report.getRows().get(48);
        CleanRow second = report.getRows().get(49);
        assertEquals("arima_forecast", first.getImputationMethod());
        assertEquals(24.0, first.getValue(), 1e-6);
        assertEquals("arima_forecast", second.getImputationMethod());
        assertEquals(24.5, second.getValue(), 1e-6);
    }

    @Test
    public void interiorGapIsInterpolatedWithForecastEnabled() {
        Double[] ramp = SeriesFixtures.linear(50, 2.0 / 49);
        RunReport report = executorFor(CleansingConfig.defaults())
                .execute(hourlySamples("S1", SeriesFixtures.append(ramp, null, 6.0)));

        CleanRow gap = report.getRows().get(50);
        assertEquals(4.0, gap.getValue(), 1e-9);
        assertEquals("time_interp", gap.getImputationMethod());
    }

    @Test
    public void newerObservationsEndTheForecastHistory() {
        Double[] ramp = SeriesFixtures.linear(50, 2.0 / 49);
        RunReport report = executorFor(CleansingConfig.defaults())
                .execute(hourlySamples("S1", SeriesFixtures.append(ramp, null, 100.0, 100.0, 100.0, null)));

        CleanRow tail = report.getRows().get(54);
        assertEquals(100.0, tail.getValue(), 1e-9);
        assertEquals("time_interp", tail.getImputationMethod());
        assertEquals("time_interp", report.getRows().get(50).getImputationMethod());
    }

    private static Double[] dailyWithGap() {
        Double[] values = new Double[72];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i % 24) < 6 ? 4.0 : 0.5;
        }
        for (int i = 60; i <= 63; i++) {
            values[i] = null;
        }
        return values;
    }

    @Test
    public void gbmFillsOnePointPerRoundThenInterpolates() {
        CleansingConfig config = CleansingConfig.defaults().withForecastModel(ForecastModelType.GBM);
        RunReport report = executorFor(config).execute(hourlySamples("S1", dailyWithGap()));

        List<CleanRow> rows = report.getRows();
        assertEquals(72, rows.size());
        for (int i = 60; i <= 62; i++) {
            assertEquals("gbm_forecast", rows.get(i).getImputationMethod());
            assertTrue(rows.get(i).getValue() >= 0.0 && rows.get(i).getValue() <= 150.0);
        }
        assertEquals("time_interp", rows.get(63).getImputationMethod());
        assertEquals(3, (int) report.getImputationCounts().get(ImputationMethod.GBM_FORECAST));
    }

    @Test
    public void gbmRerunIsIdempotent() {
        CleansingConfig config = CleansingConfig.defaults()
                .withForecastModel(ForecastModelType.GBM)
                .withGbmSubsample(0.5);
        RunReport first = executorFor(config).execute(hourlySamples("S1", dailyWithGap()));
        RunReport second = executor.execute(hourlySamples("S1", dailyWithGap()));

        assertEquals(first.getRows(), second.getRows());
    }

    @Test
    public void failingSensorIsIsolated() {
        DefaultFunctionManager manager = DefaultFunctionManager.forConfig(noForecast());
        manager.registerFunction("explode", new UFunction() {
            @Override
            public void execute(OperatorContext context) {
                if ("bad".equals(context.getSensorId())) {
                    throw new IllegalStateException("boom");
                }
            }

            @Override
            public FunctionMetadata getMetadata() {
                return new FunctionMetadata("explode", "explode", "1.0.0", 25, "fails for one sensor");
            }
        });
        executor = new DefaultTaskExecutor(manager, 1);

        List<RawSample> samples = new ArrayList<>(hourlySamples("bad", 1.0, 2.0));
        samples.addAll(hourlySamples("good", 1.0, 2.0));
        RunReport report = executor.execute(samples);

        assertEquals(List.of("bad"), report.getFailedSensors());
        assertEquals("boom", report.getFailureReasons().get("bad"));
        assertEquals(2, report.getRows().size());
        for (CleanRow row : report.getRows()) {
            assertEquals("good", row.getSensorId());
        }
    }

    @Test
    public void executeTaskRecordsFailure() {
        SensorTask task = new SensorTask("S1", null);
        executorFor(noForecast()).executeTask(task);

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertNotNull(task.getLastErrorMessage());
        assertTrue(task.getRows().isEmpty());
    }

    @Test
    public void outputHonoursRangeAndLabels() {
        Random random = new Random(7);
        List<RawSample> samples = new ArrayList<>();
        for (String sensor : new String[] {"A", "B", "C"}) {
            Double[] values = new Double[120];
            for (int i = 0; i < values.length; i++) {
                double r = random.nextDouble();
                values[i] = r < 0.15 ? null : r < 0.25 ? 400.0 * random.nextDouble() - 50.0 : 5.0 * random.nextDouble();
            }
            samples.addAll(hourlySamples(sensor, values));
        }

        RunReport report = executorFor(CleansingConfig.defaults()).execute(samples);

        assertEquals(360, report.getRows().size());
        for (CleanRow row : report.getRows()) {
            assertTrue(row.getValue() >= 0.0 && row.getValue() <= 150.0);
            assertEquals(row.getImputationMethod() != null, row.isImputed());
            if (QcFlags.has(row.getQcFlags(), QcFlags.OUTLIER)) {
                assertTrue(row.isImputed());
            }
        }
    }

    @Test
    public void rerunIsIdempotent() {
        Double[] values = {0.2, null, 0.4, 500.0, 0.0, null, null, 1.2};
        RunReport first = executorFor(CleansingConfig.defaults()).execute(hourlySamples("S1", values));
        RunReport second = executor.execute(hourlySamples("S1", values));

        assertEquals(first.getRows(), second.getRows());
    }

    @Test
    public void parallelRunMatchesSequential() {
        List<RawSample> samples = new ArrayList<>();
        for (int s = 0; s < 6; s++) {
            samples.addAll(hourlySamples("S" + s, 1.0, null, 3.0 + s, 900.0, 0.5));
        }
        RunReport sequential = executorFor(noForecast()).execute(samples);
        executor.shutdown();

        executor = new DefaultTaskExecutor(DefaultFunctionManager.forConfig(noForecast()), 4);
        RunReport parallel = executor.execute(samples);

        assertEquals(sequential.getRows(), parallel.getRows());
        assertEquals(hour(0), parallel.getRows().get(0).getTimestamp());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroParallelismRejected() {
        new DefaultTaskExecutor(new DefaultFunctionManager(), 0);
    }
}
