package com.obelisk.worker;

import com.obelisk.config.ObeliskConfig;
import com.obelisk.internal.tools.InternalTools;
import com.obelisk.registry.StaticModelCapabilityResolver;
import com.obelisk.registry.ToolExecutor;
import com.obelisk.registry.ToolRegistry;
import com.obelisk.session.SessionStateManager;
import com.obelisk.worker.activity.ToolActivitiesImpl;
import com.obelisk.worker.port.ToolStepRunner;
import com.obelisk.worker.workflow.ToolExecutionWorkflowImpl;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Obelisk Temporal worker entry point. Task queues come from OBELISK_TASK_QUEUE; with
 * OBELISK_IS_DEBUG_ENABLED=true the -debug variants are registered too.
 * <p>
 * WorkerFactory.start() returns immediately; the main thread is blocked so the JVM stays alive.
 */
public final class ObeliskWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(ObeliskWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private ObeliskWorkerApplication() {
    }

    public static void main(String[] args) {
        ObeliskConfig config = ObeliskConfig.fromEnvironment();
        List<String> taskQueues = config.getTaskQueues();

        ToolRegistry registry = new ToolRegistry(StaticModelCapabilityResolver.load(config));
        int count = InternalTools.registerAll(registry);
        if (count == 0) {
            log.warn("No tools registered; check built-in providers and community tool JARs on the classpath");
        }
        ToolExecutor executor = new ToolExecutor(registry);
        SessionStateManager sessions = new SessionStateManager(registry, config, Clock.systemUTC());
        ToolActivitiesImpl activities = new ToolActivitiesImpl(new ToolStepRunner(executor, sessions));

        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );
        WorkerFactory factory = WorkerFactory.newInstance(client);

        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(Math.max(10, config.getMaxConcurrentTools()))
                .setMaxConcurrentWorkflowTaskExecutionSize(10)
                .build();

        for (String taskQueue : taskQueues) {
            Worker worker = factory.newWorker(taskQueue, workerOptions);
            worker.registerWorkflowImplementationTypes(ToolExecutionWorkflowImpl.class);
            worker.registerActivitiesImplementations(activities);
            log.info("Registered worker for task queue: {}", taskQueue);
        }

        ScheduledExecutorService janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "obelisk-session-cleanup");
            t.setDaemon(true);
            return t;
        });
        janitor.scheduleAtFixedRate(() -> {
            try {
                int removed = sessions.cleanupExpired();
                if (removed > 0) log.info("Removed {} expired session(s)", removed);
            } catch (RuntimeException e) {
                log.error("Session cleanup failed: {}", e.getMessage(), e);
            }
        }, 1, 1, TimeUnit.HOURS);

        log.info("Starting worker | Temporal: {} | namespace: {} | tools: {} | queues: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), registry.listTools(true), taskQueues);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown(factory, janitor, executor);
        }));

        factory.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown(factory, janitor, executor);
        }
    }

    private static void shutdown(WorkerFactory factory, ScheduledExecutorService janitor, ToolExecutor executor) {
        janitor.shutdownNow();
        factory.shutdown();
        try {
            factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            log.error("Error during worker shutdown: {}", e.getMessage());
        }
        executor.close();
    }
}
