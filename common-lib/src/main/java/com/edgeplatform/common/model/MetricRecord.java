package com.edgeplatform.common.model;

import java.util.List;

/**
 * Common view of a per-team, per-category metric bundle.
 *
 * <p>Confidence is in [0, 1] and never increases when a quality flag is added. A value that
 * fell back to a league default always carries a flag saying so.
 */
public interface MetricRecord {

    MetricCategory category();

    double confidence();

    /** Active quality flags, lowercase snake case (e.g. {@code low_sample}). Never null. */
    List<String> flags();

    default boolean hasFlag(String flag) {
        return flags().contains(flag);
    }
}
