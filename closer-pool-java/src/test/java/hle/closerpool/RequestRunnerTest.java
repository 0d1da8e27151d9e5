package hle.closerpool;

import hle.closerpool.pool.PoolBackend;
import hle.closerpool.pool.PoolClosedException;
import hle.closerpool.pool.ResourcePool;
import hle.closerpool.pool.ResourcePoolConfig;
import hle.closerpool.pool.ResourcePools;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

class RequestRunnerTest {

    @Test
    @Timeout(10)
    void shouldRunAllQueriesWithBoundedPool() throws Exception {
        assertRun(PoolBackend.BOUNDED);
    }

    @Test
    @Timeout(10)
    void shouldRunAllQueriesWithCommonsPool() throws Exception {
        assertRun(PoolBackend.COMMONS_POOL2);
    }

    private void assertRun(PoolBackend backend) throws Exception {
        SimulatedConnectionFactory factory = new SimulatedConnectionFactory();
        ResourcePool<SimulatedConnection> pool = ResourcePools.newPool(factory,
                ResourcePoolConfig.builder().capacity(2).backend(backend).build());

        RunResult result = new RequestRunner(pool, factory).run(10, 5);

        assertEquals(10, result.getStats().getQueries());
        assertEquals(0, result.getStats().getFailures());
        assertTrue(result.getCreatedResources() >= 1);
        assertTrue(result.getIdleResources() <= 2);
        assertTrue(result.getIdleResources() >= 1);

        pool.close();
        assertEquals(0, pool.getIdleCount());
        assertThrows(PoolClosedException.class, pool::acquire);
    }
}
