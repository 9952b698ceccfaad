package com.multifish.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.multifish.action.ActionDispatcher;
import com.multifish.action.DryRunManagerOperations;
import com.multifish.action.ManagerOperations;
import com.multifish.logging.ExecutionLogger;
import com.multifish.logging.JsonFileExecutionLogger;
import com.multifish.machine.ConfiguredMachineDirectory;
import com.multifish.machine.MachineDirectory;
import com.multifish.observability.JobServiceMetrics;
import com.multifish.scheduler.ExecutionEngine;
import com.multifish.scheduler.JobRegistry;
import com.multifish.scheduler.JobScheduler;
import com.multifish.scheduler.JobValidator;
import com.multifish.scheduler.ScheduleCalculator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.time.Clock;

/**
 * Wires the job service. Device access and machine lookup are replaceable by
 * declaring another {@link ManagerOperations} or {@link MachineDirectory} bean.
 */
@Configuration
public class JobServiceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ScheduleCalculator scheduleCalculator(Clock clock) {
        return new ScheduleCalculator(clock.getZone());
    }

    @Bean
    @ConditionalOnMissingBean(MachineDirectory.class)
    public MachineDirectory machineDirectory(MultifishProperties properties) {
        return new ConfiguredMachineDirectory(properties.getMachines());
    }

    @Bean
    @ConditionalOnMissingBean(ManagerOperations.class)
    public ManagerOperations managerOperations() {
        return new DryRunManagerOperations();
    }

    @Bean
    public ExecutionLogger executionLogger(MultifishProperties properties,
                                           ObjectMapper objectMapper,
                                           Clock clock) throws IOException {
        return new JsonFileExecutionLogger(properties.getJobService().getLogsDir(), objectMapper, clock);
    }

    @Bean
    public ThreadPoolTaskExecutor machineExecutor() {
        return unboundedExecutor("machine-exec-");
    }

    @Bean
    public ThreadPoolTaskExecutor jobExecutor() {
        return unboundedExecutor("job-exec-");
    }

    @Bean
    public ThreadPoolTaskScheduler jobTickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("job-scheduler-tick-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    public ExecutionEngine executionEngine(MachineDirectory machineDirectory,
                                           ActionDispatcher actionDispatcher,
                                           ExecutionLogger executionLogger,
                                           JobServiceMetrics metrics,
                                           Clock clock,
                                           @Qualifier("machineExecutor") TaskExecutor machineExecutor) {
        return new ExecutionEngine(machineDirectory, actionDispatcher, executionLogger,
                metrics, clock, machineExecutor);
    }

    @Bean
    public JobRegistry jobRegistry(ScheduleCalculator scheduleCalculator, Clock clock) {
        return new JobRegistry(scheduleCalculator, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public JobScheduler jobScheduler(JobRegistry jobRegistry,
                                     JobValidator jobValidator,
                                     ExecutionEngine executionEngine,
                                     ScheduleCalculator scheduleCalculator,
                                     JobServiceMetrics metrics,
                                     Clock clock,
                                     MultifishProperties properties,
                                     @Qualifier("jobExecutor") TaskExecutor jobExecutor,
                                     @Qualifier("jobTickScheduler") TaskScheduler jobTickScheduler) {
        return new JobScheduler(jobRegistry, jobValidator, executionEngine, scheduleCalculator,
                metrics, clock, properties.getJobService(), jobExecutor, jobTickScheduler);
    }

    // Grows on demand: concurrency is bounded by the worker pool, not the executor.
    private static ThreadPoolTaskExecutor unboundedExecutor(String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setDaemon(true);
        return executor;
    }
}
