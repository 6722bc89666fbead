package org.rescuenet.routing.vrp;

/**
 * Service start window in minutes after fleet departure.
 *
 * @param startMinute earliest service start.
 * @param endMinute latest service start.
 */
public record TimeWindow(double startMinute, double endMinute) {

    public TimeWindow {
        if (!Double.isFinite(startMinute) || !Double.isFinite(endMinute) || startMinute < 0.0d || endMinute < startMinute) {
            throw new IllegalArgumentException("time window must satisfy 0 <= start <= end, got [" + startMinute + ", " + endMinute + "]");
        }
    }

    public static TimeWindow of(double startMinute, double endMinute) {
        return new TimeWindow(startMinute, endMinute);
    }
}
