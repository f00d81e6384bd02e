package com.rainfall.cleansing.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rainfall.cleansing.core.DataStorage;
import com.rainfall.cleansing.model.RawSample;
import com.rainfall.cleansing.storage.StorageException;
import org.apache.kafka.clients.consumer.*;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka原始样本采集消费者。
 * 从Kafka Topic消费遥测网关推送的降水样本，按批写入原始库，
 * 由定时的清洗任务再从原始库读取处理。
 *
 * 格式错误的消息记录告警后跳过，不影响同批其他消息。
 */
public class KafkaRawSampleCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KafkaRawSampleCollector.class);

    private final String bootstrapServers;
    private final String topic;
    private final String groupId;
    private final DataStorage dataStorage;
    private final RawSampleParser parser;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private KafkaConsumer<String, String> consumer;
    private Thread collectorThread;

    public KafkaRawSampleCollector(String bootstrapServers, String topic, String groupId,
                                   String defaultVariable, DataStorage dataStorage) {
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
        this.groupId = groupId;
        this.dataStorage = dataStorage;
        this.parser = new RawSampleParser(new ObjectMapper(), defaultVariable);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaRawSampleCollector is already running.");
            return;
        }

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "5000");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));

        collectorThread = new Thread(this, "kafka-raw-sample-collector");
        collectorThread.start();

        log.info("KafkaRawSampleCollector started. Topic: {}, Group: {}", topic, groupId);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
                if (records.isEmpty()) continue;

                List<RawSample> batch = parseBatch(records);
                if (!batch.isEmpty()) {
                    int written = dataStorage.insertRawSamples(batch);
                    log.debug("Stored {} raw samples from {} records", written, records.count());
                }
                // 写库成功后再提交位移，保证至少一次
                consumer.commitSync();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                log.error("KafkaRawSampleCollector woken up unexpectedly", e);
            }
        } catch (StorageException e) {
            log.error("KafkaRawSampleCollector stopping, raw store unavailable: {}", e.getMessage(), e);
        } finally {
            running.set(false);
            consumer.close();
            log.info("KafkaRawSampleCollector stopped.");
        }
    }

    List<RawSample> parseBatch(Iterable<ConsumerRecord<String, String>> records) {
        List<RawSample> batch = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            try {
                batch.add(parser.parse(record.value()));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed record at {}-{}@{}: {}",
                        record.topic(), record.partition(), record.offset(), e.getMessage());
            }
        }
        return batch;
    }

    public void stop() {
        if (running.compareAndSet(true, false) && consumer != null) {
            consumer.wakeup();
        }
    }

    /** 等待采集线程退出 */
    public void awaitTermination() throws InterruptedException {
        if (collectorThread != null) {
            collectorThread.join();
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
