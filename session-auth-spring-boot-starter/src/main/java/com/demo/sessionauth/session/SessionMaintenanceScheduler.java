package com.demo.sessionauth.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * 定时清理过期会话。
 * <p>
 * 使用独立的单线程调度器，与请求处理互不干扰；单次清理失败只记日志，下个周期照常执行。
 */
public class SessionMaintenanceScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionRepository sessionRepository;
    private final Duration interval;
    private final ThreadPoolTaskScheduler scheduler;

    private volatile ScheduledFuture<?> task;

    public SessionMaintenanceScheduler(SessionRepository sessionRepository, Duration interval) {
        this.sessionRepository = Objects.requireNonNull(sessionRepository, "sessionRepository must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("session-auth.session.cleanup-interval must be > 0");
        }

        this.scheduler = new ThreadPoolTaskScheduler();
        this.scheduler.setPoolSize(1);
        this.scheduler.setThreadNamePrefix("session-cleanup-");
        this.scheduler.setDaemon(true);
        this.scheduler.setWaitForTasksToCompleteOnShutdown(false);
    }

    /**
     * 执行一次清理。
     *
     * @return 清理数量；失败时为 0
     */
    public int runCleanup() {
        try {
            int cleaned = sessionRepository.cleanupExpiredSessions();
            if (cleaned > 0) {
                log.info("Expired sessions cleaned: {}", cleaned);
            }
            return cleaned;
        } catch (RuntimeException e) {
            log.error("Session cleanup failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    @Override
    public synchronized void start() {
        if (task != null) {
            return;
        }
        scheduler.initialize();
        task = scheduler.scheduleWithFixedDelay(this::runCleanup, interval);
        log.info("Session cleanup scheduled every {}", interval);
    }

    @Override
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        scheduler.shutdown();
    }

    @Override
    public boolean isRunning() {
        return task != null;
    }
}
