package com.talent.sourcing.session;

import java.util.List;

/**
 * One page of backend results.
 *
 * @param records       records in backend order
 * @param totalEstimate backend's total hit estimate, or -1 when it did not report one
 * @param rawSize       items the backend sent, including ones that could not be read as records
 */
public record SearchPage(List<PersonRecord> records, long totalEstimate, int rawSize) {

    public static final long UNKNOWN_TOTAL = -1;

    public SearchPage {
        records = List.copyOf(records);
        if (totalEstimate < UNKNOWN_TOTAL) {
            throw new IllegalArgumentException("totalEstimate must be >= -1");
        }
        if (rawSize < records.size()) {
            throw new IllegalArgumentException("rawSize must be >= the number of records");
        }
    }

    public SearchPage(List<PersonRecord> records, long totalEstimate) {
        this(records, totalEstimate, records.size());
    }

    public boolean hasTotalEstimate() {
        return totalEstimate != UNKNOWN_TOTAL;
    }
}
