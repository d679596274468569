package org.Aayush.cpusim.io;

import lombok.experimental.UtilityClass;
import org.Aayush.cpusim.core.SimulationReport;
import org.Aayush.cpusim.scheduling.SchedulePlan;

import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link SimulationReport} as one line per algorithm:
 * {@code <label>: mean turnaround = <value>}.
 */
@UtilityClass
public final class ReportFormatter {

    public static String format(SimulationReport report) {
        Objects.requireNonNull(report, "report");
        StringBuilder out = new StringBuilder();
        for (SchedulePlan plan : report.getPlans().values()) {
            out.append(formatLine(plan)).append(System.lineSeparator());
        }
        return out.toString();
    }

    static String formatLine(SchedulePlan plan) {
        return String.format(
                Locale.ROOT,
                "%s: mean turnaround = %.2f",
                plan.getAlgorithm().label(),
                plan.getMeanTurnaround()
        );
    }
}
