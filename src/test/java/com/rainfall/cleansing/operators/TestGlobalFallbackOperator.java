package com.rainfall.cleansing.operators;

import static org.junit.Assert.assertEquals;

import com.rainfall.cleansing.SeriesFixtures;
import com.rainfall.cleansing.core.impl.DefaultOperatorContext;
import com.rainfall.cleansing.model.FallbackPolicy;
import com.rainfall.cleansing.model.ImputationMethod;

import org.junit.Test;

public final class TestGlobalFallbackOperator {

    @Test
    public void medianOfLabeledPoints() {
        DefaultOperatorContext context = SeriesFixtures.context(4.0, null, 1.0, 3.0, 2.0, null);
        new GlobalFallbackOperator(FallbackPolicy.MEDIAN_OR_FLOOR, 0.0).execute(context);

        assertEquals(2.5, context.getSeries().getValue(1), 1e-12);
        assertEquals(2.5, context.getSeries().getValue(5), 1e-12);
        assertEquals(ImputationMethod.GLOBAL_MEDIAN, context.getProvenance().getMethod(1));
        assertEquals(0, context.getSeries().missingCount());
    }

    @Test
    public void floorWhenNothingLabeled() {
        DefaultOperatorContext context = SeriesFixtures.context(null, null);
        new GlobalFallbackOperator(FallbackPolicy.MEDIAN_OR_FLOOR, 0.2).execute(context);

        assertEquals(0.2, context.getSeries().getValue(0), 0.0);
        assertEquals(ImputationMethod.GLOBAL_MEDIAN, context.getProvenance().getMethod(1));
    }

    @Test
    public void fixedZeroIgnoresLabeledData() {
        DefaultOperatorContext context = SeriesFixtures.context(8.0, null, 9.0);
        new GlobalFallbackOperator(FallbackPolicy.FIXED_ZERO, 0.0).execute(context);

        assertEquals(0.0, context.getSeries().getValue(1), 0.0);
        assertEquals(ImputationMethod.ZERO_FALLBACK, context.getProvenance().getMethod(1));
        assertEquals(8.0, context.getSeries().getValue(0), 0.0);
    }
}
