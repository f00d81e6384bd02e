package com.rainfall.cleansing.model;

import static com.rainfall.cleansing.SeriesFixtures.hour;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.rainfall.cleansing.SeriesFixtures;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public final class TestWorkingSeries {

    @Test
    public void fromRawSamplesSortsByTimestamp() {
        List<RawSample> samples = Arrays.asList(
                new RawSample("S", hour(2), 3.0, null, "precipitacion", "t"),
                new RawSample("S", hour(0), 1.0, null, "precipitacion", "t"),
                new RawSample("S", hour(1), 2.0, null, "precipitacion", "t"));
        WorkingSeries series = WorkingSeries.fromRawSamples("S", samples);

        assertEquals(3, series.size());
        assertEquals(hour(0), series.getTimestamp(0));
        assertEquals(1.0, series.getValue(0), 0.0);
        assertEquals(3.0, series.getValue(2), 0.0);
    }

    @Test
    public void fromRawSamplesKeepsLastDuplicate() {
        List<RawSample> samples = Arrays.asList(
                new RawSample("S", hour(0), 1.0, null, "precipitacion", "t"),
                new RawSample("S", hour(0), 4.0, 0.5, "precipitacion", "t"));
        WorkingSeries series = WorkingSeries.fromRawSamples("S", samples);

        assertEquals(1, series.size());
        assertEquals(4.0, series.getValue(0), 0.0);
        assertEquals(0.5, series.getQuality(0), 0.0);
    }

    @Test
    public void nonFiniteValuesBecomeMissing() {
        WorkingSeries series = SeriesFixtures.hourlySeries(Double.NaN, Double.POSITIVE_INFINITY, null, 2.0);

        assertTrue(series.isMissing(0));
        assertTrue(series.isMissing(1));
        assertTrue(series.isMissing(2));
        assertFalse(series.isMissing(3));
        assertEquals(3, series.missingCount());
        assertEquals(3, series.firstLabeledIndex());
    }

    @Test(expected = IllegalArgumentException.class)
    public void addDataPointRejectsNonAscending() {
        WorkingSeries series = new WorkingSeries("S");
        series.addDataPoint(new DataPoint(hour(1), 1.0, null));
        series.addDataPoint(new DataPoint(hour(1), 2.0, null));
    }

    @Test
    public void copyIsIndependent() {
        WorkingSeries series = SeriesFixtures.hourlySeries(1.0, null);
        WorkingSeries copy = series.copy();
        copy.setValue(1, 5.0);

        assertNull(series.getValue(1));
        assertEquals(5.0, copy.getValue(1), 0.0);
    }

    @Test
    public void labeledValuesInTimeOrder() {
        WorkingSeries series = SeriesFixtures.hourlySeries(null, 2.0, null, 1.0);
        assertEquals(2, series.labeledCount());
        assertEquals(1, series.firstLabeledIndex());
        assertEquals(3, series.lastLabeledIndex());
        assertEquals(2.0, series.labeledValues()[0], 0.0);
        assertEquals(1.0, series.labeledValues()[1], 0.0);
    }
}
