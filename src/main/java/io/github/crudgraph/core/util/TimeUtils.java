package io.github.crudgraph.core.util;

public class TimeUtils {

    private TimeUtils() {}

    public static String formatExecutionTime(long milliseconds) {
        if (milliseconds < 1000) {
            return milliseconds + " ms";
        }
        if (milliseconds < 60000) {
            return String.format("%.2fs (%d ms)", milliseconds / 1000.0, milliseconds);
        }
        long minutes = milliseconds / 60000;
        long seconds = (milliseconds % 60000) / 1000;
        return String.format("%dm %ds (%d ms)", minutes, seconds, milliseconds);
    }
}
