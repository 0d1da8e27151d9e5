package hle.closerpool;

import hle.closerpool.pool.PoolBackend;
import hle.closerpool.pool.ResourcePool;
import hle.closerpool.pool.ResourcePoolConfig;
import hle.closerpool.pool.ResourcePoolException;
import hle.closerpool.pool.ResourcePools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs concurrent simulated queries against a small connection pool, then shuts it down.
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final int DEFAULT_WORKERS = 25;
    private static final int DEFAULT_CAPACITY = 2;
    private static final int DEFAULT_MAX_QUERY_MS = 1_000;

    private App() {
    }

    public static void main(String[] args) {
        Map<String, String> options;
        PoolBackend backend;
        int workers;
        int capacity;
        int maxQueryMs;
        try {
            options = parseArgs(args);
            if (options.containsKey("help")) {
                printUsage();
                return;
            }
            workers = getIntOption(options, "workers", DEFAULT_WORKERS);
            capacity = getIntOption(options, "capacity", DEFAULT_CAPACITY);
            maxQueryMs = getIntOption(options, "max-query-ms", DEFAULT_MAX_QUERY_MS);
            backend = getBackendOption(options);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return;
        }

        if (workers <= 0) {
            System.err.println("workers must be > 0");
            return;
        }
        if (maxQueryMs < 0) {
            System.err.println("max-query-ms must be >= 0");
            return;
        }

        ResourcePoolConfig config;
        try {
            config = ResourcePoolConfig.builder()
                    .capacity(capacity)
                    .backend(backend)
                    .build();
        } catch (ResourcePoolException e) {
            System.err.println(e.getMessage());
            return;
        }

        SimulatedConnectionFactory factory = new SimulatedConnectionFactory();
        ResourcePool<SimulatedConnection> pool = ResourcePools.newPool(factory, config);
        try {
            RunResult result = new RequestRunner(pool, factory).run(workers, maxQueryMs);
            printSummary(workers, config, maxQueryMs, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Run interrupted");
        } finally {
            logger.info("Shutdown program");
            pool.close();
        }
    }

    private static void printSummary(int workers, ResourcePoolConfig config, int maxQueryMs, RunResult result) {
        Stats stats = result.getStats();
        double totalSeconds = stats.getTotalTimeNanos() / 1_000_000_000.0;

        System.out.println("=== Simulation Summary ===");
        System.out.printf("workers=%d, capacity=%d, backend=%s, maxQueryMs=%d%n",
                workers, config.getCapacity(), config.getBackend(), maxQueryMs);
        System.out.printf("totalTime=%.2fs, throughput=%.2f q/s, failures=%d%n",
                totalSeconds, stats.getThroughputPerSec(), stats.getFailures());
        System.out.printf("latencyMs: avg=%.2f, p50=%.2f, p95=%.2f, max=%.2f%n",
                stats.getAvgMillis(), stats.getP50Millis(), stats.getP95Millis(), stats.getMaxMillis());
        System.out.printf("pool: idle=%d, created=%d%n",
                result.getIdleResources(), result.getCreatedResources());
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                options.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
            String key = arg.substring(2);
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for --" + key);
            }
            options.put(key, args[++i]);
        }
        return options;
    }

    static int getIntOption(Map<String, String> options, String key, int defaultValue) {
        String raw = options.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for --" + key + ": " + raw);
        }
    }

    static PoolBackend getBackendOption(Map<String, String> options) {
        String raw = options.get("backend");
        if (raw == null) {
            return PoolBackend.BOUNDED;
        }
        try {
            return PoolBackend.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for --backend: " + raw);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -cp <classpath> hle.closerpool.App [options]");
        System.out.println("Options:");
        System.out.println("  --workers <int>        Concurrent queries to run (default: " + DEFAULT_WORKERS + ")");
        System.out.println("  --capacity <int>       Max idle connections kept (default: " + DEFAULT_CAPACITY + ")");
        System.out.println("  --backend <name>       bounded | commons-pool2 (default: bounded)");
        System.out.println("  --max-query-ms <int>   Upper bound of simulated query time (default: " + DEFAULT_MAX_QUERY_MS + ")");
        System.out.println("  --help                 Show this help");
    }
}
