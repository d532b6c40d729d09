package com.techanalysis.domain.model;

import com.techanalysis.exception.ValidationException;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * The three windowing controls of a computation run.
 *
 * <p>Applied in a fixed order: {@code endDate} filter, then the {@code calcWindow}
 * trailing slice, then the full computation, then the {@code outputWindow}
 * trailing slice of the result. Every control is optional (null = not applied).
 */
@Value
public class WindowSpec {

    private static final WindowSpec NONE = new WindowSpec(null, null, null);

    /** Inclusive upper bound on bar dates. */
    LocalDate endDate;

    /** Number of trailing bars kept before computing. */
    Integer calcWindow;

    /** Number of trailing rows kept from the result. */
    Integer outputWindow;

    @Builder(toBuilder = true)
    private WindowSpec(LocalDate endDate, Integer calcWindow, Integer outputWindow) {
        requirePositive("calcWindow", calcWindow);
        requirePositive("outputWindow", outputWindow);
        this.endDate = endDate;
        this.calcWindow = calcWindow;
        this.outputWindow = outputWindow;
    }

    public static WindowSpec none() {
        return NONE;
    }

    public static WindowSpec of(LocalDate endDate, Integer calcWindow, Integer outputWindow) {
        return new WindowSpec(endDate, calcWindow, outputWindow);
    }

    /** Single-row window ending at {@code asOf}, computed over the last {@code lookback} bars. */
    public static WindowSpec snapshot(LocalDate asOf, Integer lookback) {
        return new WindowSpec(asOf, lookback, 1);
    }

    public WindowSpec withOutputWindow(Integer outputWindow) {
        return new WindowSpec(endDate, calcWindow, outputWindow);
    }

    private static void requirePositive(String name, Integer window) {
        if (window != null && window <= 0) {
            throw new ValidationException(name + " must be positive", Map.of(name, window));
        }
    }
}
