package com.talent.sourcing.session;

import java.util.List;

/**
 * Records returned by one session call.
 *
 * @param sessionId       the session
 * @param records         records new to this session, never seen in an earlier call
 * @param hasMore         whether another call can return more records
 * @param totalEstimate   backend's total estimate, or -1 when unknown
 * @param cursor          last backend page fetched
 * @param cumulativeCount unique records returned by the session so far
 * @param failedPages     pages that failed transiently during this call
 */
public record SessionPage(String sessionId, List<PersonRecord> records, boolean hasMore, long totalEstimate,
                          int cursor, long cumulativeCount, int failedPages) {

    public SessionPage {
        records = List.copyOf(records);
    }

    public boolean isPartial() {
        return failedPages > 0;
    }
}
