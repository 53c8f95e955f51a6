package com.example.ingestion.worker;

import com.example.ingestion.service.TaskEnqueuedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 入队事务提交后唤醒本进程的Worker，不必等到下一个轮询周期
 */
@Component
public class WorkerWakeupListener {

    private static final Logger logger = LoggerFactory.getLogger(WorkerWakeupListener.class);

    private final QueueWorker queueWorker;

    public WorkerWakeupListener(QueueWorker queueWorker) {
        this.queueWorker = queueWorker;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTaskEnqueued(TaskEnqueuedEvent event) {
        logger.debug("Task {} enqueued, waking worker", event.taskId());
        queueWorker.wakeUp();
    }
}
