/* (C)2026 */
package com.ammann.cihealth.config;

import com.ammann.cihealth.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "report-aggregation-executor" bean used by the report service to run
 * independent aggregation steps of one report in parallel.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = ReportProperties.Aggregation.MAX_ASYNC,
            defaultValue = ReportProperties.Aggregation.MAX_ASYNC_DEFAULT)
    int maxAsync;

    /**
     * Produces a named ManagedExecutor for report aggregation steps.
     *
     * <p>Concurrency is configured via {@code report.aggregation.max-async}. The queue is
     * unbounded because a report submits a fixed, small number of tasks.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(ReportProperties.Aggregation.EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createAggregationExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(Math.max(1, maxAsync))
                .maxQueued(-1)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void closeAggregationExecutor(
            @Disposes @Named(ReportProperties.Aggregation.EXECUTOR) ManagedExecutor executor) {
        executor.shutdown();
    }
}
