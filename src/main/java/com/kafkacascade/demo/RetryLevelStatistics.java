package com.kafkacascade.demo;

import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.model.CascadeMessage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Counts where demo messages end up.
 *
 * Slot k (0..levels) counts messages that succeeded after k retries,
 * the last slot counts dead-lettered messages.
 */
@Component
@ConditionalOnProperty(name = "cascade.demo.enabled", havingValue = "true")
public class RetryLevelStatistics {

    private final AtomicLongArray counts;

    public RetryLevelStatistics(CascadeProperties properties) {
        this.counts = new AtomicLongArray(Math.max(0, properties.getRetryLevels()) + 2);
    }

    public void recordSuccess(CascadeMessage message) {
        int slot = Math.min(message.getRetries(), deadLetterSlot() - 1);
        counts.incrementAndGet(slot);
    }

    public void recordDeadLetter() {
        counts.incrementAndGet(deadLetterSlot());
    }

    public long successCount(int retries) {
        return counts.get(retries);
    }

    public long deadLetterCount() {
        return counts.get(deadLetterSlot());
    }

    public List<Long> snapshot() {
        List<Long> values = new ArrayList<>(counts.length());
        for (int i = 0; i < counts.length(); i++) {
            values.add(counts.get(i));
        }
        return values;
    }

    private int deadLetterSlot() {
        return counts.length() - 1;
    }
}
