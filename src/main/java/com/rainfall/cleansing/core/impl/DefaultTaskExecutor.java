package com.rainfall.cleansing.core.impl;

import com.rainfall.cleansing.core.FunctionManager;
import com.rainfall.cleansing.core.TaskExecutor;
import com.rainfall.cleansing.core.UFunction;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.model.RunReport;
import com.rainfall.cleansing.model.SensorTask;
import com.rainfall.cleansing.model.TaskStatus;
import com.rainfall.cleansing.model.WorkingSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * 任务执行器默认实现。
 * 每个传感器的级联在单线程内同步执行；并行度大于1时，
 * 不同传感器提交到工作窃取线程池并发执行。
 */
public class DefaultTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskExecutor.class);

    private final FunctionManager functionManager;

    /** 工作窃取线程池，并行度为1时不创建 */
    private final ForkJoinPool workerPool;

    public DefaultTaskExecutor(FunctionManager functionManager, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got: " + parallelism);
        }
        this.functionManager = functionManager;
        this.workerPool = parallelism == 1 ? null : new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in worker thread {}: {}",
                        t.getName(), e.getMessage(), e),
                true
        );
        log.info("TaskExecutor initialized. Parallelism: {}", parallelism);
    }

    @Override
    public void executeTask(SensorTask task) {
        String sensorId = task.getSensorId();
        task.setStatus(TaskStatus.RUNNING);
        try {
            WorkingSeries series = WorkingSeries.fromRawSamples(sensorId, task.getSamples());
            DefaultOperatorContext context = new DefaultOperatorContext(series);

            for (UFunction function : functionManager.getPipeline()) {
                function.execute(context);
                log.trace("Sensor '{}' stage '{}' done, {} points still missing",
                        sensorId, function.getMetadata().getFunctionId(), context.getSeries().missingCount());
            }

            task.setRows(new ArrayList<>(context.getOutput()));
            task.setImputationCounts(context.getProvenance().countByMethod());
            task.setStatus(TaskStatus.COMPLETED);
            log.debug("Sensor '{}' cleaned: {} raw -> {} rows, imputed {}",
                    sensorId, task.getSamples().size(), task.getRows().size(), task.getImputationCounts());
        } catch (RuntimeException e) {
            task.setStatus(TaskStatus.FAILED);
            task.setLastErrorMessage(String.valueOf(e.getMessage()));
            log.error("Sensor '{}' failed, discarding its rows for this run: {}", sensorId, e.getMessage(), e);
        }
    }

    @Override
    public RunReport execute(List<RawSample> samples) {
        List<SensorTask> tasks = new ArrayList<>();
        for (Map.Entry<String, List<RawSample>> entry : groupBySensor(samples).entrySet()) {
            tasks.add(new SensorTask(entry.getKey(), entry.getValue()));
        }

        if (workerPool == null) {
            tasks.forEach(this::executeTask);
        } else {
            List<Future<?>> futures = new ArrayList<>();
            for (SensorTask task : tasks) {
                futures.add(workerPool.submit(() -> executeTask(task)));
            }
            for (int i = 0; i < futures.size(); i++) {
                awaitTask(tasks.get(i), futures.get(i));
            }
        }

        RunReport report = new RunReport();
        tasks.forEach(report::addTask);
        return report;
    }

    private void awaitTask(SensorTask task, Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.setStatus(TaskStatus.FAILED);
            task.setLastErrorMessage("interrupted");
        } catch (ExecutionException e) {
            task.setStatus(TaskStatus.FAILED);
            task.setLastErrorMessage(String.valueOf(e.getCause()));
            log.error("Sensor '{}' failed in worker: {}", task.getSensorId(), e.getCause(), e);
        }
    }

    /** 按传感器分组，传感器按标识排序以保证输出顺序确定 */
    static Map<String, List<RawSample>> groupBySensor(List<RawSample> samples) {
        Map<String, List<RawSample>> grouped = new TreeMap<>();
        for (RawSample sample : samples) {
            if (sample.getSensorId() == null) {
                log.warn("Dropping raw sample without sensor id at {}", sample.getTimestamp());
                continue;
            }
            grouped.computeIfAbsent(sample.getSensorId(), k -> new ArrayList<>()).add(sample);
        }
        return grouped;
    }

    @Override
    public void shutdown() {
        if (workerPool != null) {
            workerPool.shutdown();
        }
    }
}
