package hle.closerpool;

import hle.closerpool.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs a fixed number of workers that each acquire a connection from the pool,
 * run one simulated query with it and release it.
 */
public final class RequestRunner {

    private static final Logger logger = LoggerFactory.getLogger(RequestRunner.class);

    private final ResourcePool<SimulatedConnection> pool;
    private final SimulatedConnectionFactory factory;

    public RequestRunner(ResourcePool<SimulatedConnection> pool, SimulatedConnectionFactory factory) {
        this.pool = pool;
        this.factory = factory;
    }

    /**
     * Starts {@code workers} concurrent queries and waits for all of them.
     *
     * @param workers number of queries, each on its own thread
     * @param maxQueryMs upper bound of the simulated query latency
     * @return the run result with statistics
     * @throws InterruptedException if the run is interrupted
     */
    public RunResult run(int workers, int maxQueryMs) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(workers);
        LongAdder failures = new LongAdder();
        long[] durationsNanos = new long[workers];

        for (int i = 0; i < workers; i++) {
            int queryId = i;
            executor.execute(() -> {
                long startNanos = System.nanoTime();
                try {
                    start.await();
                    performQuery(queryId, maxQueryMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.increment();
                } catch (Exception e) {
                    logger.warn("Query {} failed: {}", queryId, e.getMessage());
                    failures.increment();
                } finally {
                    durationsNanos[queryId] = System.nanoTime() - startNanos;
                    done.countDown();
                }
            });
        }

        long startNanos = System.nanoTime();
        start.countDown();
        done.await();
        long totalTimeNanos = System.nanoTime() - startNanos;
        executor.shutdown();
        executor.awaitTermination(30, TimeUnit.SECONDS);

        Stats stats = Stats.from(durationsNanos, failures.intValue(), totalTimeNanos);
        return new RunResult(stats, pool.getIdleCount(), factory.getCreatedCount());
    }

    private void performQuery(int queryId, int maxQueryMs) throws Exception {
        SimulatedConnection connection = pool.acquire();
        try {
            long latency = connection.query("SELECT " + queryId, maxQueryMs);
            logger.info("Query: QID[{}] CID[{}] {}ms", queryId, connection.getId(), latency);
        } finally {
            pool.release(connection);
        }
    }
}
