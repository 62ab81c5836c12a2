package com.socialnet.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the application context and exits the JVM with a non-zero code so a
 * process supervisor restarts the worker or scheduler.
 *
 * Shutdown runs on its own thread because the caller is usually a scheduler
 * thread that the context close will interrupt.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProcessTerminator {

    private final ApplicationContext applicationContext;
    private final AtomicBoolean terminating = new AtomicBoolean(false);

    @Value("${app.jobs.fatal-exit-code:1}")
    private int exitCode;

    public void terminate(String reason) {
        if (!terminating.compareAndSet(false, true)) {
            return;
        }
        log.error("Fatal condition, shutting down: reason={}, exitCode={}", reason, exitCode);

        Thread shutdown = new Thread(() -> {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }, "fatal-shutdown");
        shutdown.start();
    }
}
