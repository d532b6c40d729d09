package com.techanalysis.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One trading day of one instrument as delivered by the data source.
 *
 * <p>Bars of one instrument are expected in strictly increasing date order with
 * no duplicate dates. The engine relies on that ordering and never re-sorts.
 */
@Value
@Builder
public class Bar {

    LocalDate date;
    double open;
    double high;
    double low;
    double close;
    double volume;

    /** Traded currency value for the day. */
    double amount;

    /** Signed percent move versus the prior close, supplied by the data source. */
    double percentChange;
}
