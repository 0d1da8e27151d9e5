package hle.closerpool.pool;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Closable test resource that counts close calls.
 */
class TestResource implements AutoCloseable {
    private final int id;
    private final boolean failOnClose;
    private final AtomicInteger closeCount = new AtomicInteger();

    TestResource(int id) {
        this(id, false);
    }

    TestResource(int id, boolean failOnClose) {
        this.id = id;
        this.failOnClose = failOnClose;
    }

    @Override
    public void close() throws Exception {
        closeCount.incrementAndGet();
        if (failOnClose) {
            throw new Exception("close failed for test-" + id);
        }
    }

    int getId() {
        return id;
    }

    int getCloseCount() {
        return closeCount.get();
    }

    boolean isClosed() {
        return closeCount.get() > 0;
    }

    @Override
    public String toString() {
        return "test-" + id;
    }
}
