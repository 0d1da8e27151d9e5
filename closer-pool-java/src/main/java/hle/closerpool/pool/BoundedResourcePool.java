package hle.closerpool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link ResourcePool} that keeps idle resources in a bounded FIFO queue.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li>{@link #acquire()} never takes the lock. It polls the idle queue and falls back
 *   to the factory, so it never waits on other callers.</li>
 *   <li>{@link #release(AutoCloseable)} and {@link #close()} are serialized by a single lock,
 *   so nothing is added to the idle queue once the pool is closed.</li>
 * </ul>
 *
 * <p>Because acquire is not serialized against close, a caller may receive a freshly
 * created resource just after the pool has started closing. That resource is closed
 * when it is released, since release checks the state under the lock.
 *
 * @param <R> the type of resource managed by this pool
 */
public final class BoundedResourcePool<R extends AutoCloseable> implements ResourcePool<R> {

    private static final Logger logger = LoggerFactory.getLogger(BoundedResourcePool.class);

    private final ResourceFactory<R> factory;
    private final int capacity;
    private final BlockingQueue<R> idle;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile PoolState state = PoolState.OPEN;

    /**
     * Creates a new pool.
     *
     * @param factory creates a resource whenever acquire finds nothing idle
     * @param capacity maximum number of idle resources kept
     * @throws InvalidPoolConfigurationException if capacity is not positive or factory is null
     */
    public BoundedResourcePool(ResourceFactory<R> factory, int capacity) {
        if (factory == null) {
            throw new InvalidPoolConfigurationException("factory cannot be null");
        }
        if (capacity <= 0) {
            throw new InvalidPoolConfigurationException("capacity must be > 0, was " + capacity);
        }
        this.factory = factory;
        this.capacity = capacity;
        this.idle = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public R acquire() throws Exception {
        R resource = idle.poll();
        if (resource != null) {
            logger.debug("Acquire: shared resource {}", resource);
            return resource;
        }
        if (state == PoolState.CLOSED) {
            throw new PoolClosedException();
        }
        logger.debug("Acquire: new resource");
        return factory.create();
    }

    @Override
    public void release(R resource) {
        if (resource == null) {
            return;
        }
        lock.lock();
        try {
            if (state == PoolState.CLOSED) {
                logger.debug("Release: pool closed, closing {}", resource);
                closeQuietly(resource);
                return;
            }
            if (idle.offer(resource)) {
                logger.debug("Release: {} in queue", resource);
            } else {
                // idle queue full: discard
                logger.debug("Release: idle queue full, closing {}", resource);
                closeQuietly(resource);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (state == PoolState.CLOSED) {
                return;
            }
            state = PoolState.CLOSED;

            List<R> drained = new ArrayList<>(capacity);
            idle.drainTo(drained);
            for (R resource : drained) {
                closeQuietly(resource);
            }
            logger.info("Pool closed, {} idle resources closed", drained.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public int getIdleCount() {
        return idle.size();
    }

    @Override
    public boolean isClosed() {
        return state == PoolState.CLOSED;
    }

    /**
     * Gets the current lifecycle state.
     */
    public PoolState getState() {
        return state;
    }

    private void closeQuietly(R resource) {
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Failed to close resource {}: {}", resource, e.getMessage(), e);
        }
    }
}
