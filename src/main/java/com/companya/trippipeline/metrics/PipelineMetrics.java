package com.companya.trippipeline.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class PipelineMetrics {

    private final Counter rowsPublished;
    private final Counter rowsFailed;
    private final Counter filesFailed;
    private final Counter recordsMerged;
    private final Counter recordsFailed;
    private final Counter kpisWritten;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.rowsPublished = meterRegistry.counter("pipeline.ingest.rows.published");
        this.rowsFailed = meterRegistry.counter("pipeline.ingest.rows.failed");
        this.filesFailed = meterRegistry.counter("pipeline.ingest.files.failed");
        this.recordsMerged = meterRegistry.counter("pipeline.merge.records.merged");
        this.recordsFailed = meterRegistry.counter("pipeline.merge.records.failed");
        this.kpisWritten = meterRegistry.counter("pipeline.aggregate.kpis.written");
    }

    public void rowPublished() {
        rowsPublished.increment();
    }

    public void rowFailed() {
        rowsFailed.increment();
    }

    public void fileFailed() {
        filesFailed.increment();
    }

    public void recordMerged() {
        recordsMerged.increment();
    }

    public void recordFailed() {
        recordsFailed.increment();
    }

    public void kpiWritten() {
        kpisWritten.increment();
    }
}
