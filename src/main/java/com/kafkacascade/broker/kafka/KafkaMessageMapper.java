package com.kafkacascade.broker.kafka;

import com.kafkacascade.model.CascadeMessage;
import com.kafkacascade.model.MessageHeader;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeaders;

/**
 * Converts between Kafka records and CascadeMessage.
 *
 * Header bytes pass through untouched, in record order and with duplicate
 * keys kept. Only "retries" is ever rewritten, by CascadeMessage itself.
 */
final class KafkaMessageMapper {

    private KafkaMessageMapper() {
    }

    static CascadeMessage fromRecord(ConsumerRecord<String, String> record) {
        CascadeMessage.CascadeMessageBuilder builder = CascadeMessage.builder()
                .topic(record.topic())
                .partition(record.partition())
                .offset(record.offset())
                .key(record.key())
                .payload(record.value());

        for (Header header : record.headers()) {
            builder.header(new MessageHeader(header.key(), header.value()));
        }
        return builder.build();
    }

    static ProducerRecord<String, String> toRecord(String topic, CascadeMessage message) {
        RecordHeaders headers = new RecordHeaders();
        for (MessageHeader header : message.getHeaders()) {
            headers.add(header.getKey(), header.getValue());
        }

        // Partition left to the partitioner; retry topics may have a different layout
        return new ProducerRecord<>(topic, null, message.getKey(), message.getPayload(), headers);
    }
}
