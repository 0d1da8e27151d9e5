package hle.closerpool.pool;

/**
 * Factory methods for {@link ResourcePool} instances.
 */
public final class ResourcePools {

    private ResourcePools() {
    }

    /**
     * Creates a {@link BoundedResourcePool} keeping at most {@code capacity} idle resources.
     *
     * @throws InvalidPoolConfigurationException if capacity is not positive or factory is null
     */
    public static <R extends AutoCloseable> ResourcePool<R> newPool(ResourceFactory<R> factory, int capacity) {
        return new BoundedResourcePool<>(factory, capacity);
    }

    /**
     * Creates a pool with the backend and capacity named by the given configuration.
     *
     * @throws InvalidPoolConfigurationException if factory or config is null
     */
    public static <R extends AutoCloseable> ResourcePool<R> newPool(ResourceFactory<R> factory,
                                                                    ResourcePoolConfig config) {
        if (config == null) {
            throw new InvalidPoolConfigurationException("config cannot be null");
        }
        switch (config.getBackend()) {
            case COMMONS_POOL2:
                return new Acp2ResourcePool<>(factory, config.getCapacity());
            case BOUNDED:
            default:
                return new BoundedResourcePool<>(factory, config.getCapacity());
        }
    }
}
