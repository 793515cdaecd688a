package com.metabolite.classification.metrics;

import com.metabolite.classification.core.model.DataSource;
import com.metabolite.classification.core.model.LookupError;
import com.metabolite.classification.core.model.MetaboliteType;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    /**
     * @param error null when the name resolved to an id
     */
    void recordResolution(DataSource source, LookupError error);

    void recordFetch(DataSource source, boolean success, Duration duration);

    void incrementClassified(MetaboliteType finalType);

    void recordRunSize(int size);
}
