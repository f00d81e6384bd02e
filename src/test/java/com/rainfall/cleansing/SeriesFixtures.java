package com.rainfall.cleansing;

import com.rainfall.cleansing.core.impl.DefaultOperatorContext;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.WorkingSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for hourly test series.
 */
public final class SeriesFixtures {

    /** A Monday, midnight UTC. */
    public static final Instant T0 = Instant.parse("2024-05-06T00:00:00Z");

    public static final String SENSOR = "S001";

    private SeriesFixtures() {
    }

    public static Instant hour(int i) {
        return T0.plus(Duration.ofHours(i));
    }

    public static List<RawSample> hourlySamples(String sensorId, Double... values) {
        List<RawSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(new RawSample(sensorId, hour(i), values[i], null, "precipitacion", "test"));
        }
        return samples;
    }

    public static WorkingSeries hourlySeries(Double... values) {
        return WorkingSeries.fromRawSamples(SENSOR, hourlySamples(SENSOR, values));
    }

    public static DefaultOperatorContext context(Double... values) {
        return new DefaultOperatorContext(hourlySeries(values));
    }

    /** Values 0, step, 2*step, ... */
    public static Double[] linear(int count, double step) {
        Double[] values = new Double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i * step;
        }
        return values;
    }

    public static Double[] append(Double[] head, Double... tail) {
        Double[] all = new Double[head.length + tail.length];
        System.arraycopy(head, 0, all, 0, head.length);
        System.arraycopy(tail, 0, all, head.length, tail.length);
        return all;
    }
}
