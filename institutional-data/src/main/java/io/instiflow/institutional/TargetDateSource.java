package io.instiflow.institutional;

import io.instiflow.core.Record;
import io.instiflow.core.Source;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Emits a fixed list of target dates as records, then completes.
 */
public class TargetDateSource implements Source<LocalDate> {
    private final List<LocalDate> dates;
    private int idx = 0;

    public TargetDateSource(List<LocalDate> dates) {
        this.dates = List.copyOf(dates);
    }

    /** {@code today} and the {@code days - 1} calendar days before it, newest first. */
    public static List<LocalDate> trailingDays(LocalDate today, int days) {
        if (days < 1) throw new IllegalArgumentException("days must be >= 1");
        List<LocalDate> out = new ArrayList<>(days);
        for (int i = 0; i < days; i++) out.add(today.minusDays(i));
        return out;
    }

    public List<LocalDate> dates() { return dates; }

    @Override
    public synchronized Optional<Record<LocalDate>> poll() {
        if (idx >= dates.size()) return Optional.empty();
        Record<LocalDate> r = new Record<>(idx, 0, dates.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public synchronized boolean isFinished() {
        return idx >= dates.size();
    }
}
