/*
 * Copyright 2012 TouK
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package pl.touk.charon.quartz;

import org.quartz.CronScheduleBuilder;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.FailoverConfig;
import pl.touk.charon.Utils;
import pl.touk.charon.failover.FailoverCoordinator;
import pl.touk.charon.health.HealthCheckReport;
import pl.touk.charon.health.HealthCheckRunner;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

import static pl.touk.charon.Utils.indent;

/**
 * Runs health checks of the primary and the failover connection with Quartz according to a cron expression. Each
 * run checks both connections and then lets the coordinator apply the resulting decision, so that the active
 * connection changes even when no requests arrive.
 * <p>
 * Runs of one scheduler never overlap. Many application instances may run their own schedulers; they share
 * connection health through the status cache only.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public final class QuartzHealthCheckScheduler {

    static private final Logger logger = LoggerFactory.getLogger(QuartzHealthCheckScheduler.class);

    private final static Map<String, QuartzHealthCheckScheduler> healthCheckSchedulers = new HashMap<String, QuartzHealthCheckScheduler>();
    private final static String healthCheckSchedulerKey = "charonHealthCheckScheduler";
    private final static String charonQuartzGroupPrefix   = "CHARON_GROUP_";
    private final static String charonQuartzJobPrefix     = "CHARON_JOB_";
    private final static String charonQuartzTriggerPrefix = "CHARON_TRIGGER_";

    private final HealthCheckRunner runner;
    private final FailoverCoordinator coordinator;
    private final Scheduler scheduler;
    private final String cron;
    private final long startDelayMillis;
    private final String schedulerName;
    private final JobKey jobKey;
    private final TriggerKey triggerKey;

    private volatile HealthCheckReport lastReport;
    private volatile String lastActiveConnection;

    public QuartzHealthCheckScheduler(HealthCheckRunner runner,
                                      FailoverCoordinator coordinator,
                                      Scheduler scheduler,
                                      long startDelayMillis)
            throws SchedulerException {
        this(runner, coordinator, scheduler, runner.getConfig().getCron(), startDelayMillis);
    }

    public QuartzHealthCheckScheduler(HealthCheckRunner runner,
                                      FailoverCoordinator coordinator,
                                      Scheduler scheduler,
                                      String cron,
                                      long startDelayMillis)
            throws SchedulerException {
        Utils.assertNotNull(runner, "runner");
        Utils.assertNotNull(coordinator, "coordinator");
        Utils.assertNotNull(scheduler, "scheduler");
        Utils.assertNonEmpty(cron, "cron");
        Utils.assertNonNegative(startDelayMillis, "startDelayMillis");

        this.runner = runner;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.cron = cron;
        this.startDelayMillis = startDelayMillis;
        this.schedulerName = scheduler.getSchedulerName();
        Utils.assertNonEmpty(schedulerName, "scheduler.schedulerName");

        FailoverConfig config = runner.getConfig();
        String group = charonQuartzGroupPrefix + schedulerName;
        String suffix = config.getPrimary() + '_' + config.getFailover();
        this.jobKey = new JobKey(charonQuartzJobPrefix + suffix, group);
        this.triggerKey = new TriggerKey(charonQuartzTriggerPrefix + suffix, group);
    }

    public void init() {
        String s = jobKey + " with " + triggerKey + " on " + schedulerName + " with cron '" + cron + "'";
        try {
            scheduler.deleteJob(jobKey);
            JobDataMap map = new JobDataMap();
            map.put(healthCheckSchedulerKey, registryKey());
            JobDetail jobDetail = JobBuilder.newJob(HealthCheckJob.class)
                    .withIdentity(jobKey)
                    .usingJobData(map)
                    .build();
            Trigger trigger = TriggerBuilder.newTrigger()
                    .withIdentity(triggerKey)
                    .forJob(jobKey)
                    .startAt(new Date(System.currentTimeMillis() + startDelayMillis))
                    .withSchedule(CronScheduleBuilder.cronSchedule(cron).withMisfireHandlingInstructionDoNothing())
                    .build();
            store();
            Date firstFireTime = scheduler.scheduleJob(jobDetail, trigger);
            logger.info("scheduled with first fire time " + format(firstFireTime) + ": " + s);
        } catch (SchedulerException e) {
            logger.error("failed to schedule " + s, e);
            throw new RuntimeException(e);
        } catch (RuntimeException e) {
            logger.error("failed to schedule " + s, e);
            throw e;
        }
    }

    public void destroy() {
        try {
            if (!scheduler.isShutdown()) {
                scheduler.deleteJob(jobKey);
            }
            logger.info("unscheduled " + jobKey + " on " + schedulerName);
        } catch (SchedulerException e) {
            logger.error("failed to unschedule " + jobKey + " on " + schedulerName, e);
        } finally {
            synchronized (healthCheckSchedulers) {
                healthCheckSchedulers.remove(registryKey());
            }
        }
    }

    @DisallowConcurrentExecution
    public static class HealthCheckJob implements Job {
        public void execute(JobExecutionContext ctx) throws JobExecutionException {
            QuartzHealthCheckScheduler s = extract(ctx);
            String logPrefix = "[" + s.runner.getConfig() + ", fireTime=" + format(ctx.getFireTime()) + "] ";
            logger.info(logPrefix + "HealthCheckJob started");
            try {
                s.run(indent(logPrefix));
                logger.info(logPrefix + "HealthCheckJob ended");
            } catch (RuntimeException e) {
                logger.info(logPrefix + "HealthCheckJob ended with exception", e);
                throw new JobExecutionException(e);
            }
        }
    }

    void run(String logPrefix) {
        lastReport = runner.checkAll();
        lastActiveConnection = coordinator.determineAndSetConnection();
        logger.info(logPrefix + "health: " + lastReport.getRecords() + "; active connection: " + lastActiveConnection);
    }

    private static QuartzHealthCheckScheduler extract(JobExecutionContext ctx) throws JobExecutionException {
        String key = ctx.getMergedJobDataMap().getString(healthCheckSchedulerKey);
        QuartzHealthCheckScheduler s;
        synchronized (healthCheckSchedulers) {
            s = healthCheckSchedulers.get(key);
        }
        if (s == null) {
            throw new JobExecutionException("no health check scheduler registered under '" + key + "'; each scheduler "
                    + "of a quartz cluster should have identical charon configuration");
        }
        return s;
    }

    private void store() {
        synchronized (healthCheckSchedulers) {
            healthCheckSchedulers.put(registryKey(), this);
        }
        logger.info("stored health check scheduler under " + registryKey());
    }

    private String registryKey() {
        return jobKey.toString();
    }

    private static String format(Date d) {
        return d != null ? new SimpleDateFormat("yyyy.MM.dd HH:mm:ss,SSS").format(d) : "null";
    }

    public String getCron() {
        return cron;
    }

    public JobKey getJobKey() {
        return jobKey;
    }

    public TriggerKey getTriggerKey() {
        return triggerKey;
    }

    public HealthCheckReport getLastReport() {
        return lastReport;
    }

    public String getLastActiveConnection() {
        return lastActiveConnection;
    }
}
