package com.talent.sourcing.pipeline;

import com.talent.sourcing.discovery.DiscoveryResult;
import com.talent.sourcing.scoring.ScoredResultSet;

/**
 * Discovered, resolved and (when enabled) scored organizations of one run.
 */
public record DiscoveryOutcome(String runId, DiscoveryResult discovery, ScoredResultSet ranking) {
}
