package io.instiflow.institutional;

import java.io.PrintStream;
import java.util.List;

/**
 * What a run changed: history rows per security before and after, and the flow counters.
 */
public record RunSummary(int dates,
                         List<SecurityCount> securities,
                         long snapshotsWritten,
                         long snapshotsSkipped,
                         long unavailableSources,
                         long persistFailures,
                         long failedDates) {

    public record SecurityCount(TrackedSecurity security, int before, int after) {
        public int added() { return Math.max(0, after - before); }
    }

    public RunSummary {
        securities = List.copyOf(securities);
    }

    public void print(PrintStream out) {
        out.println("Per-security summary:");
        for (SecurityCount c : securities) {
            out.println("  " + c.security().securityId() + " (" + c.security().market().label() + "): before="
                    + c.before() + " after=" + c.after() + " added=" + c.added());
        }
        out.println("Dates=" + dates + " snapshotsWritten=" + snapshotsWritten + " snapshotsSkipped=" + snapshotsSkipped
                + " unavailableSources=" + unavailableSources + " persistFailures=" + persistFailures
                + " failedDates=" + failedDates);
    }
}
