package com.rainfall.cleansing.operators;

import static com.rainfall.cleansing.SeriesFixtures.hour;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.rainfall.cleansing.SeriesFixtures;
import com.rainfall.cleansing.core.impl.DefaultOperatorContext;
import com.rainfall.cleansing.model.QcFlags;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.WorkingSeries;

import java.util.Arrays;

import org.junit.Test;

public final class TestQualityControlOperator {

    @Test
    public void outOfRangeValuesAreNulledAndFlagged() {
        DefaultOperatorContext context = SeriesFixtures.context(1.0, 200.0, -0.5, 150.0);
        new QualityControlOperator(0.0, 150.0, null).execute(context);

        assertFalse(context.getSeries().isMissing(0));
        assertTrue(context.getSeries().isMissing(1));
        assertTrue(context.getSeries().isMissing(2));
        assertFalse(context.getSeries().isMissing(3));
        assertEquals(QcFlags.OUTLIER, context.getProvenance().getFlags(1));
        assertEquals(QcFlags.OUTLIER, context.getProvenance().getFlags(2));
        assertEquals(0, context.getProvenance().getFlags(3));
    }

    @Test
    public void missingPointsAreNotOutliers() {
        DefaultOperatorContext context = SeriesFixtures.context(1.0, null, 2.0);
        new QualityControlOperator(0.0, 150.0, null).execute(context);

        assertEquals(0, context.getProvenance().getFlags(1));
        assertEquals(1, context.getSeries().missingCount());
    }

    @Test
    public void poorQualityIsRejectedAndAbsentQualityPasses() {
        WorkingSeries series = WorkingSeries.fromRawSamples("S", Arrays.asList(
                new RawSample("S", hour(0), 1.0, 0.9, "precipitacion", "t"),
                new RawSample("S", hour(1), 2.0, 0.2, "precipitacion", "t"),
                new RawSample("S", hour(2), 3.0, null, "precipitacion", "t"),
                new RawSample("S", hour(3), 500.0, 0.1, "precipitacion", "t")));
        DefaultOperatorContext context = new DefaultOperatorContext(series);
        new QualityControlOperator(0.0, 150.0, 0.5).execute(context);

        assertFalse(series.isMissing(0));
        assertTrue(series.isMissing(1));
        assertEquals(QcFlags.POOR_QUALITY, context.getProvenance().getFlags(1));
        assertFalse(series.isMissing(2));
        assertEquals(QcFlags.OUTLIER | QcFlags.POOR_QUALITY, context.getProvenance().getFlags(3));
    }

    @Test
    public void qualityIgnoredWithoutFloor() {
        WorkingSeries series = WorkingSeries.fromRawSamples("S", Arrays.asList(
                new RawSample("S", hour(0), 1.0, 0.0, "precipitacion", "t")));
        DefaultOperatorContext context = new DefaultOperatorContext(series);
        new QualityControlOperator(0.0, 150.0, null).execute(context);

        assertFalse(series.isMissing(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsInvertedRange() {
        new QualityControlOperator(10.0, 5.0, null);
    }
}
