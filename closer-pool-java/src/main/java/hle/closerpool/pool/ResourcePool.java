package hle.closerpool.pool;

import java.util.Objects;

/**
 * A thread-safe pool of closable resources that keeps at most {@link #getCapacity()}
 * of them idle for reuse.
 *
 * <p>The pool does not limit how many resources are checked out at once. An acquire
 * that finds nothing idle manufactures a new resource, and a release that finds the
 * idle queue full closes the returned resource.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourcePool<Connection> pool = ResourcePools.newPool(Connection::open, 2);
 *
 * Connection connection = pool.acquire();
 * try {
 *     connection.query("SELECT 1");
 * } finally {
 *     pool.release(connection);
 * }
 *
 * pool.close();
 * }</pre>
 *
 * @param <R> the type of resource managed by this pool
 */
public interface ResourcePool<R extends AutoCloseable> extends AutoCloseable {

    /**
     * Takes an idle resource, or creates one through the factory when none is idle.
     * Never waits for another caller to release.
     *
     * @return a resource the caller must eventually {@link #release(AutoCloseable) release}
     * @throws PoolClosedException if the pool is closed and nothing is idle
     * @throws Exception whatever the factory throws, unchanged
     */
    R acquire() throws Exception;

    /**
     * Returns a resource to the pool. The resource is kept idle if there is room and
     * the pool is open, otherwise it is closed. Close failures are logged, never thrown.
     * A {@code null} resource is ignored.
     *
     * @param resource the resource to return
     */
    void release(R resource);

    /**
     * Closes the pool and every idle resource. Calling it again has no effect.
     * Resources checked out at this point are closed when they are released.
     */
    @Override
    void close();

    /**
     * Gets the maximum number of idle resources kept by the pool.
     */
    int getCapacity();

    /**
     * Gets the number of idle resources currently in the pool.
     */
    int getIdleCount();

    /**
     * Returns true once {@link #close()} has been called.
     */
    boolean isClosed();

    /**
     * Acquires a resource, applies the given operation to it and releases it.
     *
     * @param operation the operation to execute with the acquired resource
     * @param <T> the return type of the operation
     * @return the result of the operation
     * @throws ResourcePoolException if the resource cannot be acquired or the operation fails
     * @throws NullPointerException if operation is null
     */
    default <T> T execute(ResourceFunction<R, T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");

        R resource = null;
        try {
            resource = acquire();
            return operation.apply(resource);
        } catch (ResourcePoolException e) {
            throw e;
        } catch (Exception e) {
            throw new ResourcePoolException("Failed to execute operation with pooled resource", e);
        } finally {
            release(resource);
        }
    }

    /**
     * Returns pool statistics as a formatted string.
     */
    default String getStats() {
        return String.format("%s[idle=%d, capacity=%d, closed=%b]",
                getClass().getSimpleName(), getIdleCount(), getCapacity(), isClosed());
    }
}
