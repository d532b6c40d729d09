package com.techanalysis.window;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.DerivedFrame;
import com.techanalysis.domain.model.PatternResult;
import com.techanalysis.domain.model.WindowSpec;
import java.time.LocalDate;
import java.util.List;

/**
 * Applies the windowing controls of a {@link WindowSpec} around a computation.
 *
 * <p>{@link #slice} runs before computing (end-date filter, then calc window) and the
 * {@code truncate} methods after it (output window). None of them reorder rows or
 * drop rows inside the kept range, and an empty result is returned as-is: callers
 * treat it as insufficient history.
 */
public class WindowController {

    public List<Bar> slice(List<Bar> bars, WindowSpec windowSpec) {
        return slice(bars, windowSpec.getEndDate(), windowSpec.getCalcWindow());
    }

    public List<Bar> slice(List<Bar> bars, LocalDate endDate, Integer calcWindow) {
        // Bars are date-ordered, so the end-date filter is a prefix.
        int end = endDate == null ? bars.size() : availableUpTo(bars, endDate);
        int start = calcWindow == null ? 0 : Math.max(0, end - calcWindow);
        return List.copyOf(bars.subList(start, end));
    }

    public DerivedFrame truncate(DerivedFrame frame, Integer outputWindow) {
        return outputWindow == null ? frame : frame.tail(outputWindow);
    }

    public PatternResult truncate(PatternResult result, Integer outputWindow) {
        return outputWindow == null ? result : result.tail(outputWindow);
    }

    /** Number of leading bars dated on or before {@code asOf}. */
    public int availableUpTo(List<Bar> bars, LocalDate asOf) {
        int count = 0;
        while (count < bars.size() && !bars.get(count).getDate().isAfter(asOf)) {
            count++;
        }
        return count;
    }
}
