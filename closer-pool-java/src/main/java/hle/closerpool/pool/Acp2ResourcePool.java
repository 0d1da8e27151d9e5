package hle.closerpool.pool;

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link ResourcePool} implementation backed by Apache Commons Pool 2.
 *
 * <p>The underlying {@link GenericObjectPool} is configured so that only idle resources
 * are bounded: no limit on total resources, {@code maxIdle} equal to the capacity,
 * no blocking when the idle queue is empty, FIFO order and no evictor.
 * {@link GenericObjectPool#returnObject(Object)} checks {@code maxIdle} and adds to the idle
 * queue in two steps, so returns and close are serialized by a lock here to keep the idle
 * count within the capacity.
 *
 * <p>Unlike {@link BoundedResourcePool}, this pool only takes back resources it handed out.
 * Anything else passed to {@link #release(AutoCloseable)} is logged and left alone while the
 * pool is open, and closed once the pool is closed.
 *
 * @param <R> the type of resource managed by this pool
 */
public final class Acp2ResourcePool<R extends AutoCloseable> implements ResourcePool<R> {

    private static final Logger logger = LoggerFactory.getLogger(Acp2ResourcePool.class);

    private final GenericObjectPool<R> pool;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Creates a new pool.
     *
     * @param factory creates a resource whenever acquire finds nothing idle
     * @param capacity maximum number of idle resources kept
     * @throws InvalidPoolConfigurationException if capacity is not positive or factory is null
     */
    public Acp2ResourcePool(ResourceFactory<R> factory, int capacity) {
        if (factory == null) {
            throw new InvalidPoolConfigurationException("factory cannot be null");
        }
        if (capacity <= 0) {
            throw new InvalidPoolConfigurationException("capacity must be > 0, was " + capacity);
        }
        this.capacity = capacity;
        this.pool = new GenericObjectPool<>(new FactoryAdapter<>(factory), toPoolConfig(capacity));
        this.pool.setSwallowedExceptionListener(
                e -> logger.warn("Failed to close resource: {}", e.getMessage(), e));
    }

    private static <R> GenericObjectPoolConfig<R> toPoolConfig(int capacity) {
        GenericObjectPoolConfig<R> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(-1);
        poolConfig.setMaxIdle(capacity);
        poolConfig.setMinIdle(0);
        poolConfig.setBlockWhenExhausted(false);
        poolConfig.setLifo(false);
        poolConfig.setJmxEnabled(false);
        return poolConfig;
    }

    @Override
    public R acquire() throws Exception {
        try {
            R resource = pool.borrowObject();
            logger.debug("Acquire: {}", resource);
            return resource;
        } catch (IllegalStateException e) {
            if (pool.isClosed()) {
                throw new PoolClosedException(e);
            }
            throw e;
        }
    }

    @Override
    public void release(R resource) {
        if (resource == null) {
            return;
        }
        lock.lock();
        try {
            pool.returnObject(resource);
            logger.debug("Release: {}", resource);
        } catch (IllegalStateException e) {
            logger.warn("Release: {} not accepted by pool: {}", resource, e.getMessage());
            if (pool.isClosed()) {
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
            if (pool.isClosed()) {
                return;
            }
            int idleCount = pool.getNumIdle();
            pool.close();
            logger.info("Pool closed, {} idle resources closed", idleCount);
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
        return pool.getNumIdle();
    }

    @Override
    public boolean isClosed() {
        return pool.isClosed();
    }

    /**
     * Gets the number of resources currently checked out.
     */
    public int getActiveCount() {
        return pool.getNumActive();
    }

    private void closeQuietly(R resource) {
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Failed to close resource {}: {}", resource, e.getMessage(), e);
        }
    }

    /**
     * Adapts a {@link ResourceFactory} to Apache Commons Pool 2's {@link BasePooledObjectFactory}.
     */
    private static final class FactoryAdapter<R extends AutoCloseable> extends BasePooledObjectFactory<R> {
        private final ResourceFactory<R> factory;

        FactoryAdapter(ResourceFactory<R> factory) {
            this.factory = factory;
        }

        @Override
        public R create() throws Exception {
            return factory.create();
        }

        @Override
        public PooledObject<R> wrap(R resource) {
            return new DefaultPooledObject<>(resource);
        }

        @Override
        public void destroyObject(PooledObject<R> pooledObject) throws Exception {
            pooledObject.getObject().close();
        }
    }
}
