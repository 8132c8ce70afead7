package com.casetrace.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the consistency repair on a fixed delay.
 */
@Component
public class ScheduledRepairRunner {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledRepairRunner.class);

    private final ConsistencyRepairService repairService;

    @Value("${casetrace.repair.enabled:true}")
    private boolean enabled = true;

    @Value("${casetrace.repair.dry-run:false}")
    private boolean dryRun;

    @Value("${casetrace.repair.lookback-days:0}")
    private int lookbackDays;

    public ScheduledRepairRunner(ConsistencyRepairService repairService) {
        this.repairService = repairService;
    }

    @Scheduled(fixedDelayString = "${casetrace.repair.interval-ms:300000}",
               initialDelayString = "${casetrace.repair.initial-delay-ms:60000}")
    public void scheduledRepair() {
        if (!enabled) {
            return;
        }
        try {
            RepairReport report = repairService.runRepair(options());
            logger.info("Scheduled repair finished: {} actions, {} applied",
                report.getActions().size(), report.appliedCount());
        } catch (RepairAbortedException e) {
            logger.warn("Scheduled repair aborted: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Scheduled repair failed", e);
        }
    }

    /**
     * Options for the scheduled pass. A lookback of zero days checks every
     * completed file for its index.
     */
    RepairOptions options() {
        RepairOptions options = RepairOptions.defaults().setDryRun(dryRun);
        if (lookbackDays > 0) {
            options.setLookback(Duration.ofDays(lookbackDays));
        }
        return options;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }
}
