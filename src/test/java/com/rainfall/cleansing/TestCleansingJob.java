package com.rainfall.cleansing;

import static com.rainfall.cleansing.SeriesFixtures.T0;
import static com.rainfall.cleansing.SeriesFixtures.hour;
import static com.rainfall.cleansing.SeriesFixtures.hourlySamples;
import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rainfall.cleansing.core.DataStorage;
import com.rainfall.cleansing.core.impl.DefaultFunctionManager;
import com.rainfall.cleansing.core.impl.DefaultTaskExecutor;
import com.rainfall.cleansing.model.CleanRow;
import com.rainfall.cleansing.model.RunReport;
import com.rainfall.cleansing.model.TimeRange;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public final class TestCleansingJob {

    private DataStorage storage;
    private DefaultTaskExecutor executor;

    @Before
    public void setUp() {
        storage = mock(DataStorage.class);
    }

    @After
    public void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private CleansingJob job(CleansingConfig config) {
        executor = new DefaultTaskExecutor(DefaultFunctionManager.forConfig(config), 1);
        return new CleansingJob(config, storage, executor);
    }

    private static CleansingConfig config() {
        return CleansingConfig.defaults().withForecastEnabled(false);
    }

    @Test
    public void incrementalRunUpsertsCleanRows() {
        Instant now = hour(10);
        when(storage.fetchRawSamples("precipitacion", now.minus(Duration.ofHours(72)), 1))
                .thenReturn(hourlySamples("S1", 1.0, null, 3.0));
        when(storage.upsertCleanRows(anyList())).thenReturn(3);

        RunReport report = job(config()).runIncremental(now);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CleanRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(storage).upsertCleanRows(rows.capture());
        assertEquals(3, rows.getValue().size());
        assertEquals("time_interp", rows.getValue().get(1).getImputationMethod());
        assertEquals(3, report.getUpsertedRows());
    }

    @Test
    public void dryRunNeverWrites() {
        when(storage.fetchRawSamples(any(), any(), anyInt())).thenReturn(hourlySamples("S1", 1.0, 2.0));

        RunReport report = job(config().withDryRun(true)).runIncremental(hour(5));

        verify(storage, never()).upsertCleanRows(anyList());
        assertEquals(2, report.getCleanRowCount());
        assertEquals(0, report.getUpsertedRows());
    }

    @Test
    public void nothingFetchedMeansNothingWritten() {
        when(storage.fetchRawSamples(any(), any(), anyInt())).thenReturn(Collections.emptyList());

        RunReport report = job(config()).runIncremental(hour(5));

        verify(storage, never()).upsertCleanRows(anyList());
        assertEquals(0, report.getSensorsProcessed());
    }

    @Test
    public void backfillWalksChunksUntilLastTimestamp() {
        when(storage.rawTimeBounds("precipitacion")).thenReturn(Optional.of(
                new TimeRange(T0.plus(Duration.ofMinutes(30)), hour(50))));
        when(storage.fetchRawRange(eq("precipitacion"), any(TimeRange.class), eq(1)))
                .thenReturn(hourlySamples("S1", 1.0, 2.0))
                .thenReturn(Collections.emptyList())
                .thenReturn(hourlySamples("S2", 4.0));
        when(storage.upsertCleanRows(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        RunReport total = job(config().withBackfillChunkHours(24)).backfill();

        ArgumentCaptor<TimeRange> windows = ArgumentCaptor.forClass(TimeRange.class);
        verify(storage, times(3)).fetchRawRange(eq("precipitacion"), windows.capture(), eq(1));
        List<TimeRange> ranges = windows.getAllValues();
        assertEquals(T0, ranges.get(0).getStart());
        assertEquals(hour(24), ranges.get(0).getEnd());
        assertEquals(hour(48), ranges.get(2).getStart());
        assertEquals(hour(51), ranges.get(2).getEnd());
        verify(storage, times(2)).upsertCleanRows(anyList());
        assertEquals(3, total.getUpsertedRows());
        assertEquals(2, total.getSensorsProcessed());
    }

    @Test
    public void backfillOfEmptyStoreDoesNothing() {
        when(storage.rawTimeBounds("precipitacion")).thenReturn(Optional.empty());

        RunReport total = job(config()).backfill();

        verify(storage, never()).fetchRawRange(any(), any(), anyInt());
        assertEquals(0, total.getCleanRowCount());
    }
}
