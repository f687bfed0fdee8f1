package com.companya.trippipeline.jobs;

import com.companya.trippipeline.model.DailyKpi;
import com.companya.trippipeline.service.KpiAggregationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "pipeline.aggregator.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class DailyKpiJob {

    private static final Logger log = LoggerFactory.getLogger(DailyKpiJob.class);

    private final KpiAggregationService aggregationService;

    public DailyKpiJob(KpiAggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @Scheduled(cron = "${pipeline.aggregator.cron:0 0 * * * *}")
    public void run() {
        log.info("Running KPI aggregation job");
        try {
            List<DailyKpi> kpis = aggregationService.aggregate();
            log.info("KPI aggregation job completed, {} group(s) written", kpis.size());
        } catch (RuntimeException ex) {
            log.error("KPI aggregation job failed: {}", ex.getMessage(), ex);
            throw ex;
        }
    }
}
