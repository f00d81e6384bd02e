package com.rainfall.cleansing.forecast;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.rainfall.cleansing.SeriesFixtures;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Test;

public final class TestArimaForecastStrategy {

    private static ArimaForecastStrategy strategy(int minTrain, int maxSteps) {
        return new ArimaForecastStrategy(minTrain, 3, true, 24, maxSteps, 3);
    }

    @Test
    public void trainingRunEndsAtLastLabeledPoint() {
        WorkingSeries series = SeriesFixtures.hourlySeries(1.0, 1.0, null, 2.0, 2.0, null);
        assertArrayEquals(new int[] {3, 4}, ArimaForecastStrategy.trailingLabeledRun(series));

        WorkingSeries longerHead = SeriesFixtures.hourlySeries(1.0, 1.0, 1.0, null, 2.0, 2.0);
        assertArrayEquals(new int[] {4, 5}, ArimaForecastStrategy.trailingLabeledRun(longerHead));

        assertNull(ArimaForecastStrategy.trailingLabeledRun(SeriesFixtures.hourlySeries(null, null)));
    }

    @Test
    public void shortTrailingRunIsInsufficientDespiteLongHistory() throws ModelFailureException {
        Double[] values = SeriesFixtures.append(SeriesFixtures.linear(50, 0.1), null, 100.0, 100.0, 100.0, null);
        try {
            strategy(48, 100).fit(SeriesFixtures.hourlySeries(values));
            fail("Expected InsufficientDataException");
        } catch (InsufficientDataException e) {
            assertEquals(3, e.getAvailable());
            assertEquals(48, e.getRequired());
        }
    }

    @Test
    public void interiorGapsAreNeverTargets() throws Exception {
        Double[] recent = new Double[48];
        Arrays.fill(recent, 3.0);
        Double[] values = SeriesFixtures.append(SeriesFixtures.linear(48, 0.5), (Double) null);
        values = SeriesFixtures.append(SeriesFixtures.append(values, recent), null, null);
        WorkingSeries series = SeriesFixtures.hourlySeries(values);
        ArimaForecastStrategy arima = strategy(48, 100);

        ArimaModel model = arima.fit(series);
        assertEquals(49, model.getRunStart());
        assertEquals(96, model.getRunEnd());
        assertEquals(Arrays.asList(97, 98), arima.selectTargets(model, series));
        assertEquals(3.0, arima.predict(model, series, 97), 1e-9);
    }

    @Test
    public void shortHistoryIsInsufficient() throws ModelFailureException {
        WorkingSeries series = SeriesFixtures.hourlySeries(SeriesFixtures.append(
                SeriesFixtures.linear(10, 1.0), (Double) null));
        try {
            strategy(48, 100).fit(series);
            fail("Expected InsufficientDataException");
        } catch (InsufficientDataException e) {
            assertEquals(10, e.getAvailable());
            assertEquals(48, e.getRequired());
        }
    }

    @Test
    public void constantSeriesForecastsConstant() throws Exception {
        Double[] values = new Double[50];
        Arrays.fill(values, 2.0);
        WorkingSeries series = SeriesFixtures.hourlySeries(SeriesFixtures.append(values, null, null));
        ArimaForecastStrategy arima = strategy(48, 100);

        ArimaModel model = arima.fit(series);
        assertEquals(0, model.getDifferencing());
        assertEquals(2.0, arima.predict(model, series, 50), 1e-9);
        assertEquals(2.0, arima.predict(model, series, 51), 1e-9);
    }

    @Test
    public void trendIsDifferencedAndExtrapolated() throws Exception {
        WorkingSeries series = SeriesFixtures.hourlySeries(SeriesFixtures.append(
                SeriesFixtures.linear(48, 0.5), null, null, null));
        ArimaForecastStrategy arima = strategy(48, 100);

        ArimaModel model = arima.fit(series);
        assertEquals(1, model.getDifferencing());
        assertEquals(47, model.getRunEnd());
        assertEquals(Arrays.asList(48, 49, 50), arima.selectTargets(model, series));
        assertEquals(24.0, arima.predict(model, series, 48), 1e-9);
        assertEquals(25.0, arima.predict(model, series, 50), 1e-9);
    }

    @Test
    public void targetsLimitedToHorizonAfterRun() throws Exception {
        Double[] values = SeriesFixtures.append(
                new Double[] {null, null}, SeriesFixtures.append(SeriesFixtures.linear(48, 0.5), null, null, null));
        WorkingSeries series = SeriesFixtures.hourlySeries(values);
        ArimaForecastStrategy arima = strategy(48, 2);

        ArimaModel model = arima.fit(series);
        assertEquals(2, model.getRunStart());
        // points before the run are never targets, and only two steps ahead are allowed
        assertEquals(Arrays.asList(50, 51), arima.selectTargets(model, series));
        try {
            arima.predict(model, series, 52);
            fail("Expected ModelFailureException");
        } catch (ModelFailureException expected) {
            assertTrue(expected.getMessage().contains("horizon"));
        }
        try {
            arima.predict(model, series, 1);
            fail("Expected ModelFailureException");
        } catch (ModelFailureException expected) {
            assertTrue(expected.getMessage().contains("Backward"));
        }
    }

    @Test
    public void noisySeasonalSeriesProducesFiniteForecasts() throws Exception {
        Random random = new Random(7);
        Double[] values = new Double[96];
        for (int i = 0; i < values.length; i++) {
            values[i] = 5.0 + 3.0 * Math.sin(2 * Math.PI * i / 24.0) + random.nextGaussian();
        }
        WorkingSeries series = SeriesFixtures.hourlySeries(SeriesFixtures.append(values, null, null, null, null));
        ArimaForecastStrategy arima = strategy(48, 100);

        ArimaModel model = arima.fit(series);
        assertTrue(model.getArOrder() >= 1 && model.getArOrder() <= 3);
        assertEquals(24, model.getSeasonalLag());
        List<Integer> targets = arima.selectTargets(model, series);
        assertEquals(4, targets.size());
        for (int index : targets) {
            double value = arima.predict(model, series, index);
            assertFalse(Double.isNaN(value) || Double.isInfinite(value));
        }
    }

    @Test
    public void seasonalTermNeedsTwoPeriods() throws Exception {
        Random random = new Random(11);
        Double[] values = new Double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = 2.0 + random.nextGaussian();
        }
        WorkingSeries series = SeriesFixtures.hourlySeries(SeriesFixtures.append(values, (Double) null));

        ArimaModel model = new ArimaForecastStrategy(30, 3, true, 24, 100, 3).fit(series);
        assertEquals(0, model.getSeasonalLag());
    }
}
