package hle.closerpool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A simulated database connection. Queries sleep for a random time and
 * fail once the connection has been closed.
 */
public final class SimulatedConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedConnection.class);

    private final int id;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicInteger queryCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    SimulatedConnection(int id) {
        this.id = id;
    }

    /**
     * Runs a simulated query that blocks for up to {@code maxQueryMs} milliseconds.
     *
     * @param query the query text, used for logging only
     * @param maxQueryMs upper bound of the simulated latency
     * @return the simulated latency in milliseconds
     * @throws IllegalStateException if the connection has been closed
     * @throws InterruptedException if interrupted while waiting
     */
    public long query(String query, int maxQueryMs) throws InterruptedException {
        if (!open.get()) {
            throw new IllegalStateException("Connection " + id + " is closed");
        }
        long latency = maxQueryMs > 0 ? ThreadLocalRandom.current().nextInt(maxQueryMs + 1) : 0;
        if (latency > 0) {
            Thread.sleep(latency);
        }
        queryCount.incrementAndGet();
        logger.debug("Connection {} ran {} in {}ms", id, query, latency);
        return latency;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        if (open.compareAndSet(true, false)) {
            logger.info("Close: connection {} after {} queries", id, queryCount.get());
        }
    }

    public int getId() {
        return id;
    }

    public boolean isOpen() {
        return open.get();
    }

    public int getQueryCount() {
        return queryCount.get();
    }

    /**
     * Gets how many times {@link #close()} was invoked.
     */
    public int getCloseCount() {
        return closeCount.get();
    }

    @Override
    public String toString() {
        return "connection-" + id;
    }
}
