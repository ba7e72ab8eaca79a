package com.kafkacascade.demo;

import com.kafkacascade.config.CascadeProperties;
import com.kafkacascade.model.CascadeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryLevelStatisticsTest {

    private RetryLevelStatistics statistics(int levels) {
        CascadeProperties properties = new CascadeProperties();
        properties.setRetryLevels(levels);
        return new RetryLevelStatistics(properties);
    }

    private CascadeMessage atLevel(int retries) {
        return CascadeMessage.builder().topic("demo-topic").payload("{}").build().withRetries(retries);
    }

    @Test
    @DisplayName("Successes are counted per level, dead letters separately")
    void countsSuccessesPerLevelAndDeadLetters() {
        RetryLevelStatistics statistics = statistics(2);

        statistics.recordSuccess(CascadeMessage.builder().topic("demo-topic").build());
        statistics.recordSuccess(atLevel(2));
        statistics.recordSuccess(atLevel(2));
        statistics.recordDeadLetter();

        assertEquals(1, statistics.successCount(0));
        assertEquals(2, statistics.successCount(2));
        assertEquals(1, statistics.deadLetterCount());
        assertEquals(List.of(1L, 0L, 2L, 1L), statistics.snapshot());
    }

    @Test
    @DisplayName("Retries beyond the configured levels count in the last level")
    void retriesBeyondConfiguredLevels_countInLastLevel() {
        RetryLevelStatistics statistics = statistics(1);

        statistics.recordSuccess(atLevel(4));

        assertEquals(1, statistics.successCount(1));
        assertEquals(0, statistics.deadLetterCount());
    }
}
