package com.physio.search.api.dto;

public class CacheStatsResponse {
    private boolean success = true;
    private Stats stats;

    public CacheStatsResponse() {
    }

    public CacheStatsResponse(Stats stats) {
        this.stats = stats;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats;
    }

    public static class Stats {
        private int cacheSize;
        private int indexSize;
        private String lastIndexUpdate;

        public Stats() {
        }

        public Stats(int cacheSize, int indexSize, String lastIndexUpdate) {
            this.cacheSize = cacheSize;
            this.indexSize = indexSize;
            this.lastIndexUpdate = lastIndexUpdate;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }

        public int getIndexSize() {
            return indexSize;
        }

        public void setIndexSize(int indexSize) {
            this.indexSize = indexSize;
        }

        public String getLastIndexUpdate() {
            return lastIndexUpdate;
        }

        public void setLastIndexUpdate(String lastIndexUpdate) {
            this.lastIndexUpdate = lastIndexUpdate;
        }
    }
}
