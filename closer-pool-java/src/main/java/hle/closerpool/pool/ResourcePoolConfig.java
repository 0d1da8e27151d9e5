package hle.closerpool.pool;

import java.util.Objects;

/**
 * Configuration for a {@link ResourcePool}.
 * Use {@link #builder()} to create instances.
 */
public final class ResourcePoolConfig {

    private final int capacity;
    private final PoolBackend backend;

    private ResourcePoolConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.backend = builder.backend;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration: capacity 2, {@link PoolBackend#BOUNDED} backend.
     */
    public static ResourcePoolConfig defaultConfig() {
        return builder().build();
    }

    public int getCapacity() {
        return capacity;
    }

    public PoolBackend getBackend() {
        return backend;
    }

    @Override
    public String toString() {
        return "ResourcePoolConfig[capacity=" + capacity + ", backend=" + backend + "]";
    }

    public static final class Builder {
        private int capacity = 2;
        private PoolBackend backend = PoolBackend.BOUNDED;

        private Builder() {
        }

        /**
         * Sets the maximum number of idle resources the pool keeps.
         * It does not limit how many resources can be checked out.
         * Default: 2
         */
        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        /**
         * Sets the pool implementation.
         * Default: {@link PoolBackend#BOUNDED}
         */
        public Builder backend(PoolBackend backend) {
            this.backend = Objects.requireNonNull(backend, "backend cannot be null");
            return this;
        }

        public ResourcePoolConfig build() {
            if (capacity <= 0) {
                throw new InvalidPoolConfigurationException("capacity must be > 0, was " + capacity);
            }
            return new ResourcePoolConfig(this);
        }
    }
}
