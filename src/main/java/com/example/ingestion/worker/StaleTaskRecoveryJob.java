package com.example.ingestion.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时巡检崩溃遗留任务
 * 
 * <p>Worker启动时已经做过一次恢复，这里处理运行期间其他进程崩溃后留下的PROCESSING任务。
 * </p>
 */
@Component
public class StaleTaskRecoveryJob {

    private static final Logger logger = LoggerFactory.getLogger(StaleTaskRecoveryJob.class);

    private final QueueWorker queueWorker;

    public StaleTaskRecoveryJob(QueueWorker queueWorker) {
        this.queueWorker = queueWorker;
    }

    @Scheduled(fixedDelayString = "${ingestion.worker.recovery-interval-ms:300000}",
               initialDelayString = "${ingestion.worker.recovery-interval-ms:300000}")
    public void sweep() {
        try {
            int recovered = queueWorker.recoverStaleTasks();
            if (recovered > 0) {
                logger.info("Recovery sweep returned {} task(s) to the queue", recovered);
            }
        } catch (RuntimeException e) {
            logger.error("Stale task recovery sweep failed", e);
        }
    }
}
