package com.kafkacascade.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-level provisioning limits, one entry per retry level.
 *
 * Lists shorter than the level count leave the trailing levels at broker
 * defaults; null entries do the same for a single level.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RetryProvisioningOptions {

    @Builder.Default
    private List<Integer> timeoutLimit = new ArrayList<>();

    @Builder.Default
    private List<Integer> batchLimit = new ArrayList<>();

    public static RetryProvisioningOptions none() {
        return new RetryProvisioningOptions();
    }

    /** Limit for a 1-indexed level, or null when none was configured. */
    public Integer timeoutLimitFor(int level) {
        return valueAt(timeoutLimit, level);
    }

    public Integer batchLimitFor(int level) {
        return valueAt(batchLimit, level);
    }

    private static Integer valueAt(List<Integer> values, int level) {
        if (values == null || level < 1 || level > values.size()) {
            return null;
        }
        return values.get(level - 1);
    }
}
