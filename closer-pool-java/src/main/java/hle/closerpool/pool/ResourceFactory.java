package hle.closerpool.pool;

/**
 * A factory for creating pooled resources.
 * Called by the pool whenever an acquire finds no idle resource, possibly
 * from several threads at once, so implementations must be thread-safe.
 *
 * @param <R> the type of resource created by this factory
 */
@FunctionalInterface
public interface ResourceFactory<R extends AutoCloseable> {

    /**
     * Creates a new resource instance.
     *
     * @return a new resource
     * @throws Exception if the resource cannot be created; the pool passes it to the caller unchanged
     */
    R create() throws Exception;
}
