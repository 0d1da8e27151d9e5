package hle.closerpool.pool;

/**
 * Thrown when a pool is constructed with invalid parameters.
 */
public class InvalidPoolConfigurationException extends ResourcePoolException {

    public InvalidPoolConfigurationException(String message) {
        super(message);
    }
}
