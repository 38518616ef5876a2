package com.talent.sourcing.lookup;

import java.util.Optional;

/**
 * External resolver that maps an organization name to a stable identifier.
 *
 * <p>Implementations throw {@link com.talent.sourcing.external.ExternalTransientException}
 * for retryable failures and {@link com.talent.sourcing.external.ExternalPermanentException}
 * for rejected requests. An empty result means the tier definitively found nothing.</p>
 */
public interface CompanyLookupClient {

    Optional<LookupMatch> lookup(LookupRequest request, LookupTier tier);

    /**
     * Name used for logging, metrics and throttling.
     */
    String endpointName();
}
