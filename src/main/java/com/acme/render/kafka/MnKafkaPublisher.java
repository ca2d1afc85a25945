package com.acme.render.kafka;

import com.acme.render.spi.EventPublisher;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes synchronously so a broker failure reaches the relay, which reschedules the row.
 */
@Singleton
@Requires(beans = KafkaProducer.class)
public class MnKafkaPublisher implements EventPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(MnKafkaPublisher.class);
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaProducer<String, String> producer;

    public MnKafkaPublisher(KafkaProducer<String, String> p) {
        this.producer = p;
    }

    @Override
    public void publish(String topic, String key, String value, Map<String,String> headers) {
        var rec = new ProducerRecord<String, String>(topic, key, value);
        if (headers != null) {
            headers.forEach((k, v) -> rec.headers().add(k, v.getBytes(StandardCharsets.UTF_8)));
        }

        try {
            RecordMetadata metadata = producer.send(rec).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOG.debug("Published {} to topic {} partition {} offset {}",
                key, metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted publishing to Kafka topic: " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            LOG.error("Failed to publish message to topic {}, key {}: {}", topic, key, e.getMessage());
            throw new RuntimeException("Failed to publish to Kafka topic: " + topic, e);
        }
    }

    @PreDestroy
    void close() {
        producer.close();
    }
}
