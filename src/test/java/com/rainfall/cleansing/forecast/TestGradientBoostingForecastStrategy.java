package com.rainfall.cleansing.forecast;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import com.rainfall.cleansing.CleansingConfig;
import com.rainfall.cleansing.SeriesFixtures;
import com.rainfall.cleansing.model.ForecastModelType;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.Arrays;

import org.junit.Test;

public final class TestGradientBoostingForecastStrategy {

    private static Double[] daily(int count) {
        Double[] values = new Double[count];
        for (int i = 0; i < count; i++) {
            values[i] = (i % 24) < 6 ? 4.0 : 0.5;
        }
        return values;
    }

    private static GradientBoostingForecastStrategy strategy() {
        return new GradientBoostingForecastStrategy(CleansingConfig.defaults()
                .withForecastModel(ForecastModelType.GBM)
                .withGbmEstimators(20));
    }

    @Test
    public void featuresUseLagsAndCalendar() {
        // T0 is a Monday in May
        WorkingSeries series = SeriesFixtures.hourlySeries(1.0, 2.0, 3.0, 4.0);
        double[] row = GradientBoostingForecastStrategy.features(series, 3);

        assertArrayEquals(new double[] {3.0, 2.0, 1.0, 3.0, 0.0, 5.0}, row, 0.0);
    }

    @Test
    public void targetsNeedAllLags() {
        Double[] values = daily(48);
        values[1] = null;
        values[30] = null;
        values[31] = null;
        WorkingSeries series = SeriesFixtures.hourlySeries(values);

        assertEquals(Arrays.asList(30), strategy().selectTargets(null, series));
    }

    @Test
    public void tooFewTrainingRowsIsInsufficient() throws ModelFailureException {
        WorkingSeries series = SeriesFixtures.hourlySeries(daily(20));
        try {
            strategy().fit(series);
            fail("Expected InsufficientDataException");
        } catch (InsufficientDataException e) {
            assertEquals(17, e.getAvailable());
            assertEquals(24, e.getRequired());
        }
    }

    @Test
    public void identicalInputGivesIdenticalPrediction() throws Exception {
        Double[] values = daily(72);
        values[50] = null;
        GradientBoostingForecastStrategy gbm = strategy();

        WorkingSeries first = SeriesFixtures.hourlySeries(values);
        WorkingSeries second = SeriesFixtures.hourlySeries(values);
        double a = gbm.predict(gbm.fit(first), first, 50);
        double b = gbm.predict(gbm.fit(second), second, 50);

        assertEquals(a, b, 0.0);
        assertFalse(Double.isNaN(a));
        assertFalse(gbm.skipsFailedPoints());
    }
}
