package com.socialnet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Social Network backend.
 *
 * This Spring Boot application provides a REST API for a small social network,
 * featuring:
 * - Email/password registration with JWT access and refresh tokens
 * - Profiles, posts and hashtags stored in PostgreSQL
 * - Deferred post publication through a durable job queue
 * - Periodic maintenance jobs (expired token cleanup) driven by persisted schedules
 * - A RabbitMQ-backed worker pool executing due jobs
 *
 * The same artifact runs the web, worker and scheduler roles; each background role
 * is switched by app.jobs.worker.enabled and app.jobs.scheduler.enabled.
 */
@SpringBootApplication
public class SocialNetworkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialNetworkApplication.class, args);
    }
}
