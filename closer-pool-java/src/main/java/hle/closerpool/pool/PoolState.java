package hle.closerpool.pool;

/**
 * Lifecycle state of a pool. {@link #CLOSED} is terminal.
 */
public enum PoolState {
    OPEN,
    CLOSED
}
