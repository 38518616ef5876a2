package com.talent.sourcing.cache;

import java.util.List;

/**
 * Results of a batch resolution, in request order, with outcome counts.
 */
public record BatchResolution(List<ResolutionResult> results, int success, int notFound, int failed,
                              int rejected, int fromCache) {

    public BatchResolution {
        results = List.copyOf(results);
    }

    static BatchResolution of(List<ResolutionResult> results) {
        int success = 0;
        int notFound = 0;
        int failed = 0;
        int rejected = 0;
        int fromCache = 0;
        for (ResolutionResult result : results) {
            switch (result.status()) {
                case RESOLVED -> success++;
                case NOT_FOUND -> notFound++;
                case FAILED -> failed++;
                case REJECTED -> rejected++;
            }
            if (result.fromCache()) {
                fromCache++;
            }
        }
        return new BatchResolution(results, success, notFound, failed, rejected, fromCache);
    }

    public int total() {
        return results.size();
    }
}
