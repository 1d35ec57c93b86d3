package promptbatch.engine.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Daily run window: the key is the calendar date in the run zone, and the daily
 * trigger fires only between the start and end hour of that date.
 */
public final class RunWindow {

    private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ZoneId zone;
    private final int startHour;
    private final int endHour;

    public RunWindow(ZoneId zone, int startHour, int endHour) {
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new IllegalArgumentException("Invalid execution window: " + startHour + "-" + endHour);
        }
        this.zone = zone;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    /** yyyy-MM-dd of the instant in the run zone */
    public String runKey(Instant now) {
        return KEY_FORMAT.format(now.atZone(zone));
    }

    public boolean isOpen(Instant now) {
        int hour = ZonedDateTime.ofInstant(now, zone).getHour();
        return hour >= startHour && hour < endHour;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return String.format("%02d:00-%02d:00 %s", startHour, endHour, zone);
    }
}
