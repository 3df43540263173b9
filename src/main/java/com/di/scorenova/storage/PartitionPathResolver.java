package com.di.scorenova.storage;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hive-style hourly partition layout:
 * {@code {basePath}/year=YYYY/month=MM/day=DD/hour=HH/batch_{batchId}.{format}}, UTC.
 */
public final class PartitionPathResolver {

    private static final Pattern PARTITION =
            Pattern.compile("year=(\\d{4})/month=(\\d{2})/day=(\\d{2})/hour=(\\d{2})/");

    private PartitionPathResolver() {
    }

    public static String objectPath(String basePath, Instant writtenAt, String batchId, SerializationFormat format) {
        return partitionPrefix(basePath, writtenAt) + "batch_" + batchId + "." + format.extension();
    }

    /** Directory part of {@link #objectPath}, ending in {@code /}. */
    public static String partitionPrefix(String basePath, Instant writtenAt) {
        ZonedDateTime t = writtenAt.atZone(ZoneOffset.UTC);
        return String.format("%s/year=%04d/month=%02d/day=%02d/hour=%02d/",
                basePath, t.getYear(), t.getMonthValue(), t.getDayOfMonth(), t.getHour());
    }

    /** Start of the UTC hour an object path is partitioned under. */
    public static Optional<Instant> partitionHour(String objectPath) {
        Matcher m = PARTITION.matcher(objectPath);
        if (!m.find()) {
            return Optional.empty();
        }
        LocalDateTime hour = LocalDateTime.of(
                Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)), 0);
        return Optional.of(hour.toInstant(ZoneOffset.UTC));
    }

    /** The {@code year=…/hour=HH} segment of an object path, or null. */
    static String partitionKey(String objectPath) {
        Matcher m = PARTITION.matcher(objectPath);
        return m.find() ? m.group().substring(0, m.group().length() - 1) : null;
    }
}
