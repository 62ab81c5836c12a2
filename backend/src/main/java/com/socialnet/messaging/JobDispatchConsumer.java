package com.socialnet.messaging;

import com.socialnet.config.RabbitMQConfig;
import com.socialnet.jobs.JobOutcome;
import com.socialnet.worker.JobExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Worker pool entry point: consumes job ids from the dispatch queue.
 *
 * Each listener thread of the container is one worker and runs one job at a time
 * (prefetch 1). Handler failures are recorded on the job by JobExecutor and the
 * message is acknowledged. Infrastructure errors (database unreachable while
 * claiming or finishing) propagate, the message is rejected without requeue and
 * goes to the DLQ; the job row is re-dispatched later if it is still PENDING.
 *
 * Runs only in processes with the worker role.
 *
 * @see com.socialnet.worker.JobExecutor
 * @see com.socialnet.messaging.JobDispatchProducer
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobDispatchConsumer {

    private final JobExecutor jobExecutor;

    @RabbitListener(
            queues = "${app.rabbitmq.queue.jobs.dispatch:jobs.dispatch.queue}",
            containerFactory = RabbitMQConfig.JOB_LISTENER_CONTAINER_FACTORY
    )
    public void onJobDispatched(UUID jobId) {
        log.debug("Received job from queue: jobId={}", jobId);

        JobOutcome outcome = jobExecutor.execute(jobId);

        log.debug("Job message processed: jobId={}, outcome={}", jobId, outcome);
    }
}
