package hle.closerpool.pool;

/**
 * Selects the implementation behind {@link ResourcePools#newPool(ResourceFactory, ResourcePoolConfig)}.
 */
public enum PoolBackend {

    /**
     * {@link BoundedResourcePool}: lock-guarded bounded idle queue, lock-free acquire.
     */
    BOUNDED,

    /**
     * {@link Acp2ResourcePool}: delegates to Apache Commons Pool 2.
     */
    COMMONS_POOL2
}
