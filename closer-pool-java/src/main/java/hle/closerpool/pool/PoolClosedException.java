package hle.closerpool.pool;

/**
 * Thrown when a resource is requested from a pool that has been closed
 * and has no idle resources left to hand out.
 */
public class PoolClosedException extends ResourcePoolException {

    public PoolClosedException() {
        super("Pool has been closed");
    }

    public PoolClosedException(Throwable cause) {
        super("Pool has been closed", cause);
    }
}
