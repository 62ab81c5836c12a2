package com.socialnet.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Publishes ids of due jobs to the worker pool queue.
 *
 * Message Format:
 * - Payload: UUID (job id, JSON string)
 * - Exchange: jobs.exchange (direct)
 * - Routing Key: jobs.dispatch
 * - Queue: jobs.dispatch.queue
 *
 * Publishing failures propagate to DueJobDispatcher, which stops the batch and
 * leaves the remaining jobs undispatched for the next poll.
 *
 * @see com.socialnet.config.RabbitMQConfig
 * @see com.socialnet.messaging.JobDispatchConsumer
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobDispatchProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.jobs:jobs.exchange}")
    private String jobsExchange;

    @Value("${app.rabbitmq.routing-key.jobs:jobs.dispatch}")
    private String jobsRoutingKey;

    /**
     * Send a job id to the dispatch queue.
     *
     * @param jobId the id of a due job
     * @throws IllegalArgumentException if jobId is null
     */
    public void sendJob(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job id cannot be null");
        }

        log.debug("Dispatching job: jobId={}, exchange={}, routingKey={}", jobId, jobsExchange, jobsRoutingKey);

        try {
            rabbitTemplate.convertAndSend(jobsExchange, jobsRoutingKey, jobId);
        } catch (Exception e) {
            log.error("Failed to dispatch job: jobId={}, error={}", jobId, e.getMessage());
            throw e;
        }
    }
}
