package com.pointbreak.award.session;

public record PoolStats(int warming, int ready, int busy, int degraded, long retiredTotal, int waiting) {

    public boolean isHealthy() {
        return warming + ready + busy > 0;
    }
}
