package tsproxy.server.cache;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Absolute time window, both ends inclusive.
 */
public class TimeRange {

    public static final String START_ABSOLUTE = "start_absolute";
    public static final String START_RELATIVE = "start_relative";
    public static final String END_ABSOLUTE = "end_absolute";
    public static final String END_RELATIVE = "end_relative";
    public static final String TIME_ZONE = "time_zone";

    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Start time " + start + " is after end time " + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Resolves the absolute or relative bounds of a request against now. The end defaults to now.
     *
     * @throws IllegalArgumentException
     *             if the start is missing or a bound cannot be parsed
     */
    public static TimeRange resolve(JsonNode fields, Instant now) {
        Instant start = resolveBound(fields, START_ABSOLUTE, START_RELATIVE, now);
        if (null == start) {
            throw new IllegalArgumentException("Query must specify " + START_ABSOLUTE + " or " + START_RELATIVE);
        }
        Instant end = resolveBound(fields, END_ABSOLUTE, END_RELATIVE, now);
        return new TimeRange(start, null == end ? now : end);
    }

    private static Instant resolveBound(JsonNode fields, String absolute, String relative, Instant now) {
        JsonNode abs = fields.get(absolute);
        if (null != abs && !abs.isNull()) {
            if (!abs.canConvertToLong() && !abs.isTextual()) {
                throw new IllegalArgumentException("Invalid " + absolute + ": " + abs);
            }
            try {
                return Instant.ofEpochMilli(abs.isTextual() ? Long.parseLong(abs.asText()) : abs.asLong());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + absolute + ": " + abs, e);
            }
        }
        JsonNode rel = fields.get(relative);
        if (null != rel && !rel.isNull()) {
            return minus(now, rel, relative);
        }
        return null;
    }

    private static Instant minus(Instant now, JsonNode relative, String field) {
        long value;
        try {
            value = Long.parseLong(relative.path("value").asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value in " + field + ": " + relative, e);
        }
        String unit = relative.path("unit").asText().toLowerCase(Locale.ROOT);
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        switch (unit) {
            case "milliseconds":
                return now.minus(value, ChronoUnit.MILLIS);
            case "seconds":
                return now.minusSeconds(value);
            case "minutes":
                return now.minus(value, ChronoUnit.MINUTES);
            case "hours":
                return now.minus(value, ChronoUnit.HOURS);
            case "days":
                return now.minus(value, ChronoUnit.DAYS);
            case "weeks":
                return utc.minusWeeks(value).toInstant();
            case "months":
                return utc.minusMonths(value).toInstant();
            case "years":
                return utc.minusYears(value).toInstant();
            default:
                throw new IllegalArgumentException("Unknown time unit in " + field + ": " + unit);
        }
    }

    /**
     * Splits the range into consecutive sub-ranges of at most size, newest first. Adjacent chunks share their boundary.
     */
    public List<TimeRange> chunk(Duration size) {
        if (size.isZero() || size.isNegative()) {
            throw new IllegalArgumentException("Chunk size must be positive: " + size);
        }
        List<TimeRange> chunks = new ArrayList<>();
        Instant chunkEnd = end;
        while (chunkEnd.isAfter(start)) {
            Instant chunkStart = chunkEnd.minus(size);
            if (chunkStart.isBefore(start)) {
                chunkStart = start;
            }
            chunks.add(new TimeRange(chunkStart, chunkEnd));
            chunkEnd = chunkStart;
        }
        if (chunks.isEmpty()) {
            chunks.add(this);
        }
        return chunks;
    }

    public boolean contains(long timestamp) {
        return timestamp >= start.toEpochMilli() && timestamp <= end.toEpochMilli();
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TimeRange)) {
            return false;
        }
        TimeRange other = (TimeRange) obj;
        EqualsBuilder eb = new EqualsBuilder();
        eb.append(start, other.start);
        eb.append(end, other.end);
        return eb.isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hcb = new HashCodeBuilder();
        hcb.append(start);
        hcb.append(end);
        return hcb.toHashCode();
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("start", start);
        tsb.append("end", end);
        return tsb.toString();
    }
}
