package hle.closerpool;

public final class RunResult {
    private final Stats stats;
    private final int idleResources;
    private final int createdResources;

    RunResult(Stats stats, int idleResources, int createdResources) {
        this.stats = stats;
        this.idleResources = idleResources;
        this.createdResources = createdResources;
    }

    public Stats getStats() {
        return stats;
    }

    public int getIdleResources() {
        return idleResources;
    }

    public int getCreatedResources() {
        return createdResources;
    }
}
