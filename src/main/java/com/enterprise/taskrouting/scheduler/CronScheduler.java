package com.enterprise.taskrouting.scheduler;

import com.enterprise.taskrouting.report.ReportService;
import com.enterprise.taskrouting.report.ReportWindow;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cron-based scheduler for periodic jobs such as the weekly briefing
 */
public class CronScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CronScheduler.class);

    private final ReportService reportService;
    private final Scheduler cronScheduler;
    private final Map<String, ScheduledJob> scheduledJobs = new ConcurrentHashMap<>();

    public CronScheduler(ReportService reportService, ZoneId zone) {
        this.reportService = reportService;
        this.cronScheduler = new Scheduler();
        this.cronScheduler.setTimeZone(TimeZone.getTimeZone(zone));
    }

    /**
     * Schedule a briefing for {@code window} using a cron expression
     *
     * @throws IllegalArgumentException if the expression is not a valid cron pattern
     */
    public String scheduleReport(String jobId, String cronExpression, ReportWindow window) {
        return scheduleCron(jobId, cronExpression, "report " + window.getName(),
            () -> reportService.generate(window));
    }

    /**
     * Schedule an arbitrary action. Failures are logged and the job stays scheduled.
     *
     * @throws IllegalArgumentException if the expression is not a valid cron pattern
     */
    public String scheduleCron(String jobId, String cronExpression, String description, Runnable action) {
        if (scheduledJobs.containsKey(jobId)) {
            throw new IllegalArgumentException("Job already scheduled: " + jobId);
        }
        String schedulerId;
        try {
            schedulerId = cronScheduler.schedule(cronExpression, () -> {
                try {
                    action.run();
                    logger.debug("Scheduled job {} ran", jobId);
                } catch (RuntimeException e) {
                    logger.error("Error executing scheduled job: {}", jobId, e);
                }
            });
        } catch (InvalidPatternException e) {
            logger.error("Invalid cron expression: {}", cronExpression, e);
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression, e);
        }

        ScheduledJob existing = scheduledJobs.putIfAbsent(jobId,
            new ScheduledJob(jobId, schedulerId, cronExpression, description));
        if (existing != null) {
            // lost a race with a concurrent registration of the same id
            cronScheduler.deschedule(schedulerId);
            throw new IllegalArgumentException("Job already scheduled: " + jobId);
        }
        logger.info("Scheduled cron job {} ({}) with expression: {}", jobId, description, cronExpression);
        return jobId;
    }

    /**
     * Cancel a scheduled job
     */
    public boolean cancelJob(String jobId) {
        ScheduledJob job = scheduledJobs.remove(jobId);
        if (job != null) {
            cronScheduler.deschedule(job.getSchedulerId());
            logger.info("Cancelled scheduled job: {}", jobId);
            return true;
        }
        return false;
    }

    public Map<String, ScheduledJob> getScheduledJobs() {
        return Map.copyOf(scheduledJobs);
    }

    public void start() {
        cronScheduler.start();
        logger.info("CronScheduler started");
    }

    public void stop() {
        if (cronScheduler.isStarted()) {
            cronScheduler.stop();
        }
        scheduledJobs.clear();
        logger.info("CronScheduler stopped");
    }

    public boolean isRunning() {
        return cronScheduler.isStarted();
    }

    /**
     * Represents a scheduled job
     */
    public static class ScheduledJob {
        private final String jobId;
        private final String schedulerId;
        private final String cronExpression;
        private final String description;
        private final Instant createdAt;

        public ScheduledJob(String jobId, String schedulerId, String cronExpression, String description) {
            this.jobId = jobId;
            this.schedulerId = schedulerId;
            this.cronExpression = cronExpression;
            this.description = description;
            this.createdAt = Instant.now();
        }

        public String getJobId() { return jobId; }
        public String getSchedulerId() { return schedulerId; }
        public String getCronExpression() { return cronExpression; }
        public String getDescription() { return description; }
        public Instant getCreatedAt() { return createdAt; }
    }
}
