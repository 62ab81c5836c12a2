package com.socialnet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for the job dispatch transport.
 *
 * The durable job queue is the scheduled_jobs table; RabbitMQ only carries the ids
 * of jobs that are already due from the dispatcher to the worker pool.
 *
 * Architecture:
 * - Exchange: jobs.exchange (direct)
 * - Main Queue: jobs.dispatch.queue (ids of due jobs)
 * - DLQ: jobs.dispatch.dlq (messages the consumer rejected)
 * - Routing Key: jobs.dispatch
 *
 * Each listener thread is one worker. Prefetch is 1, so a worker holds at most one
 * job id at a time and idle workers pick up the next one.
 *
 * @see com.socialnet.messaging.JobDispatchProducer
 * @see com.socialnet.messaging.JobDispatchConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    public static final String JOB_LISTENER_CONTAINER_FACTORY = "jobListenerContainerFactory";

    @Value("${app.rabbitmq.exchange.jobs:jobs.exchange}")
    private String jobsExchange;

    @Value("${app.rabbitmq.queue.jobs.dispatch:jobs.dispatch.queue}")
    private String jobsDispatchQueue;

    @Value("${app.rabbitmq.queue.jobs.dlq:jobs.dispatch.dlq}")
    private String jobsDispatchDLQ;

    @Value("${app.rabbitmq.routing-key.jobs:jobs.dispatch}")
    private String jobsRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:jobs.dispatch.dlq}")
    private String dlqRoutingKey;

    // Dispatched ids older than this are dropped by the broker; the dispatcher re-sends them
    @Value("${app.rabbitmq.queue.ttl:3600000}")
    private long queueTTL;

    @Value("${app.jobs.worker.concurrency:4}")
    private int workerConcurrency;

    @Value("${app.jobs.worker.max-concurrency:4}")
    private int workerMaxConcurrency;

    @Value("${app.rabbitmq.listener.auto-startup:true}")
    private boolean listenerAutoStartup;

    /**
     * JSON message converter sharing Spring's ObjectMapper (java.time support).
     *
     * @param objectMapper the application ObjectMapper
     * @return Jackson2JsonMessageConverter for JSON serialization
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    /**
     * RabbitTemplate with JSON converter, publisher confirms and returns logging.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @param jsonMessageConverter the JSON converter
     * @return configured RabbitTemplate
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setMandatory(true);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Job dispatch message confirmed by RabbitMQ");
            } else {
                log.error("Job dispatch message not confirmed by RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned -> log.error(
                "Job dispatch message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                returned.getExchange(),
                returned.getRoutingKey(),
                returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter and publisher confirms");
        return rabbitTemplate;
    }

    /**
     * Listener container factory for the worker pool.
     *
     * Rejected messages are not requeued; they go to the DLQ. The job row itself
     * stays PENDING, so the dispatcher re-sends it after the redispatch window.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @param jsonMessageConverter the JSON converter
     * @return the container factory used by JobDispatchConsumer
     */
    @Bean(name = JOB_LISTENER_CONTAINER_FACTORY)
    public SimpleRabbitListenerContainerFactory jobListenerContainerFactory(
            ConnectionFactory connectionFactory,
            MessageConverter jsonMessageConverter
    ) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(jsonMessageConverter);
        factory.setPrefetchCount(1);
        factory.setConcurrentConsumers(workerConcurrency);
        factory.setMaxConcurrentConsumers(Math.max(workerConcurrency, workerMaxConcurrency));
        factory.setDefaultRequeueRejected(false);
        factory.setAutoStartup(listenerAutoStartup);

        log.info("Worker pool listener factory configured: concurrency={}, maxConcurrency={}, prefetch=1",
                workerConcurrency, Math.max(workerConcurrency, workerMaxConcurrency));
        return factory;
    }

    @Bean
    public Queue jobsDispatchDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", jobsDispatchDLQ);
        return QueueBuilder.durable(jobsDispatchDLQ).build();
    }

    /**
     * Main dispatch queue. Expired or rejected messages are dead-lettered to the DLQ.
     */
    @Bean
    public Queue jobsDispatchQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={})", jobsDispatchQueue, queueTTL);

        return QueueBuilder.durable(jobsDispatchQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-dead-letter-exchange", jobsExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange jobsExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", jobsExchange);
        return new DirectExchange(jobsExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        return BindingBuilder
                .bind(jobsDispatchDLQ())
                .to(jobsExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding jobsDispatchBinding() {
        return BindingBuilder
                .bind(jobsDispatchQueue())
                .to(jobsExchange())
                .with(jobsRoutingKey);
    }

    /**
     * Declares the exchange, queues and bindings when the first connection opens.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @return RabbitAdmin for automatic declaration
     */
    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        log.info("Configuring AmqpAdmin for automatic queue/exchange declaration");
        return new RabbitAdmin(connectionFactory);
    }
}
