package hle.closerpool;

import hle.closerpool.pool.ResourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates {@link SimulatedConnection}s with increasing ids.
 */
public final class SimulatedConnectionFactory implements ResourceFactory<SimulatedConnection> {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedConnectionFactory.class);

    private final AtomicInteger idGenerator = new AtomicInteger();

    @Override
    public SimulatedConnection create() {
        SimulatedConnection connection = new SimulatedConnection(idGenerator.incrementAndGet());
        logger.info("Create: new connection {}", connection.getId());
        return connection;
    }

    /**
     * Gets the number of connections created so far.
     */
    public int getCreatedCount() {
        return idGenerator.get();
    }
}
