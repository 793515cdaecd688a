package com.metabolite.classification.metrics;

import com.metabolite.classification.core.model.DataSource;
import com.metabolite.classification.core.model.LookupError;
import com.metabolite.classification.core.model.MetaboliteType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(DataSource source, LookupError error) {
    }

    @Override
    public void recordFetch(DataSource source, boolean success, Duration duration) {
    }

    @Override
    public void incrementClassified(MetaboliteType finalType) {
    }

    @Override
    public void recordRunSize(int size) {
    }
}
