package com.talent.sourcing.discovery;

import com.talent.sourcing.core.model.Requirements;
import com.talent.sourcing.progress.CancellationToken;

/**
 * An independent way of finding candidate organizations.
 */
public interface DiscoveryStrategy {

    /**
     * Short identifier used in logs and failure reports.
     */
    String id();

    /**
     * Produces candidates for the requirements. Excluded organizations must not be expanded.
     *
     * @throws com.talent.sourcing.progress.PipelineCancelledException if the token was cancelled
     */
    StrategyResult discover(Requirements requirements, ExclusionFilter exclusions, CancellationToken token);
}
