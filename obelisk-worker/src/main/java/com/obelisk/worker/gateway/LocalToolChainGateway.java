package com.obelisk.worker.gateway;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolChainOrchestrator;
import com.obelisk.worker.chain.ToolExecutionRequest;
import com.obelisk.worker.port.DurableExecutionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs chains in this process, one thread per running chain. Nothing survives a restart.
 * <p>
 * Finished executions stay queryable for the retention period, then the next submit or an
 * explicit {@link #cleanupFinished()} drops them.
 */
public final class LocalToolChainGateway implements ToolChainGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalToolChainGateway.class);
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final DurableExecutionPort port;
    private final Duration retention;
    private final Clock clock;
    private final ExecutorService pool;
    private final Map<String, Handle> executions = new ConcurrentHashMap<>();

    private record Handle(ToolChainOrchestrator orchestrator, CompletableFuture<ChainExecutionResult> future,
                          AtomicLong finishedAt) {

        boolean finishedBefore(long cutoff) {
            long at = finishedAt.get();
            return at >= 0 && at <= cutoff;
        }
    }

    public LocalToolChainGateway(DurableExecutionPort port) {
        this(port, DEFAULT_RETENTION, Clock.systemUTC());
    }

    public LocalToolChainGateway(DurableExecutionPort port, Duration retention, Clock clock) {
        this.port = port;
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
        this.retention = retention;
        this.clock = clock;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "obelisk-chain-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String submit(ToolExecutionRequest request) {
        cleanupFinished();
        String id = request.getExecutionId();
        ToolChainOrchestrator orchestrator = new ToolChainOrchestrator(port);
        CompletableFuture<ChainExecutionResult> future = new CompletableFuture<>();
        AtomicLong finishedAt = new AtomicLong(-1);
        if (executions.putIfAbsent(id, new Handle(orchestrator, future, finishedAt)) != null) {
            throw new IllegalArgumentException("Chain execution already exists: " + id);
        }
        pool.execute(() -> {
            try {
                ChainExecutionResult result = orchestrator.run(request);
                finishedAt.set(clock.millis());
                future.complete(result);
            } catch (RuntimeException e) {
                log.error("Chain {} crashed: {}", id, e.getMessage(), e);
                finishedAt.set(clock.millis());
                future.completeExceptionally(e);
            }
        });
        return id;
    }

    @Override
    public void cancel(String executionId) {
        handle(executionId).orchestrator().cancel();
    }

    @Override
    public void updateConfig(String executionId, Map<String, Object> config) {
        handle(executionId).orchestrator().updateConfig(config);
    }

    @Override
    public ChainStatusSnapshot status(String executionId) {
        return handle(executionId).orchestrator().getStatus();
    }

    @Override
    public List<ToolCallResult> results(String executionId) {
        return handle(executionId).orchestrator().getResults();
    }

    @Override
    public Optional<ChainExecutionResult> await(String executionId, Duration timeout) {
        CompletableFuture<ChainExecutionResult> future = handle(executionId).future();
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Chain " + executionId + " crashed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /** Drops a finished execution; returns false when it is unknown or still running. */
    public boolean evict(String executionId) {
        Handle h = executions.get(executionId);
        if (h == null || !h.future().isDone()) return false;
        return executions.remove(executionId, h);
    }

    /**
     * Drops executions that finished more than the retention period ago.
     *
     * @return number of executions removed
     */
    public int cleanupFinished() {
        long cutoff = clock.millis() - retention.toMillis();
        int removed = 0;
        for (Map.Entry<String, Handle> e : executions.entrySet()) {
            if (e.getValue().finishedBefore(cutoff) && executions.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Dropped {} finished chain execution(s)", removed);
        }
        return removed;
    }

    /** Number of executions still held, running or finished. */
    public int size() {
        return executions.size();
    }

    private Handle handle(String executionId) {
        Handle h = executions.get(executionId);
        if (h == null) throw new ChainNotFoundException(executionId);
        return h;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
