package skytiles.acquisition.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A discrete point in the source's publication cadence.
 * Identity key for task records, retry entries and published tiles.
 * <p>
 * Printed in the source's fixed {@code yyyyMMddHHmmss} UTC form.
 */
public final class ImageTimestamp implements Comparable<ImageTimestamp> {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
            .withZone(ZoneOffset.UTC)
            .withResolverStyle(ResolverStyle.STRICT);

    private final Instant instant;

    private ImageTimestamp(Instant instant) {
        this.instant = instant;
    }

    public static ImageTimestamp of(Instant instant) {
        Objects.requireNonNull(instant, "instant is required");
        return new ImageTimestamp(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static ImageTimestamp ofEpochSecond(long epochSecond) {
        return new ImageTimestamp(Instant.ofEpochSecond(epochSecond));
    }

    /**
     * Parse a 14-digit id such as {@code 20250301101500}.
     *
     * @throws IllegalArgumentException if the id is not exactly 14 digits or not a valid date
     */
    public static ImageTimestamp parse(String id) {
        if (id == null || id.length() != 14 || !id.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Timestamp must be 14 digits (yyyyMMddHHmmss): " + id);
        }
        try {
            return new ImageTimestamp(Instant.from(ID_FORMAT.parse(id)));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + id, e);
        }
    }

    public Instant instant() {
        return instant;
    }

    public long epochSecond() {
        return instant.getEpochSecond();
    }

    /** 14-digit id, e.g. {@code 20250301101500}. */
    public String id() {
        return ID_FORMAT.format(instant);
    }

    public boolean isBefore(ImageTimestamp other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(ImageTimestamp other) {
        return instant.compareTo(other.instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ImageTimestamp that))
            return false;
        return instant.equals(that.instant);
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    @Override
    public String toString() {
        return id();
    }
}
