package dev.devanks.solarprofile.pipeline.service;

import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.entity.ProductionPointEntity;
import dev.devanks.solarprofile.pipeline.entity.SiteEntity;
import dev.devanks.solarprofile.pipeline.exception.InsufficientDataException;
import dev.devanks.solarprofile.pipeline.exception.ProfileConfigurationException;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearPoint;
import dev.devanks.solarprofile.pipeline.model.ReferenceYearProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.summingDouble;

/**
 * Reduces a site's production history to a typical year: 365 days of 15-minute buckets,
 * each the mean production of every observation that falls into it, divided by the site's
 * installed capacity. Feb 29 is folded into Feb 28.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileNormalizer {

    public static final int BUCKET_MINUTES = 15;
    public static final int BUCKETS_PER_DAY = 24 * 60 / BUCKET_MINUTES;
    public static final int DAYS_PER_YEAR = 365;
    public static final int BUCKETS_PER_YEAR = DAYS_PER_YEAR * BUCKETS_PER_DAY;
    public static final String LEAP_DAY_POLICY = "fold-into-feb-28";

    // any non-leap year, only used to number the days
    private static final int LAYOUT_YEAR = 2001;

    private final PipelineProperties properties;

    /**
     * @param site    capacity and zone of the site
     * @param history every stored production point of the site, in any order
     * @return {@value #BUCKETS_PER_YEAR} points in bucket order
     * @throws ProfileConfigurationException when the site has no usable capacity
     * @throws InsufficientDataException     when the history does not cover every calendar month
     */
    public ReferenceYearProfile compute(SiteEntity site, List<ProductionPointEntity> history) {
        double capacityKw = site.getPeakPowerKw();
        if (!Double.isFinite(capacityKw) || capacityKw <= 0) {
            throw new ProfileConfigurationException(String.format(
                    "Site %d has no usable installed capacity (%s kW)", site.getSiteId(), capacityKw));
        }
        if (history == null || history.isEmpty()) {
            throw new InsufficientDataException("Site " + site.getSiteId() + " has no production history");
        }

        ZoneId zone = zoneOf(site);
        List<LocalObservation> observations = history.stream()
                .filter(point -> point.getTimestamp() != null && Double.isFinite(point.getProductionW()))
                .map(point -> new LocalObservation(LocalDateTime.ofInstant(point.getTimestamp(), zone), point.getProductionW()))
                .toList();

        if (properties.getProfile().isExcludeZeroProductionDays()) {
            observations = withoutZeroProductionDays(observations);
        }

        Set<Month> months = EnumSet.noneOf(Month.class);
        observations.forEach(observation -> months.add(observation.time.getMonth()));
        int requiredMonths = properties.getProfile().getMinimumMonths();
        if (months.size() < requiredMonths) {
            throw new InsufficientDataException(String.format(
                    "Site %d has data for %d of %d required months", site.getSiteId(), months.size(), requiredMonths));
        }

        double[] sums = new double[BUCKETS_PER_YEAR];
        int[] counts = new int[BUCKETS_PER_YEAR];
        Set<Integer> years = new TreeSet<>();
        for (LocalObservation observation : observations) {
            int bucket = bucketOf(observation.time);
            sums[bucket] += observation.productionW;
            counts[bucket]++;
            years.add(observation.time.getYear());
        }

        double[] means = interpolateGaps(sums, counts);
        List<ReferenceYearPoint> points = new ArrayList<>(BUCKETS_PER_YEAR);
        for (int bucket = 0; bucket < BUCKETS_PER_YEAR; bucket++) {
            points.add(new ReferenceYearPoint(site.getSiteId(), bucket, means[bucket] / capacityKw));
        }

        log.info("Site {}: reference year from {} observation(s) over years {} ({} of {} buckets observed).",
                site.getSiteId(), observations.size(), years, countObserved(counts), BUCKETS_PER_YEAR);
        return ReferenceYearProfile.builder()
                .siteId(site.getSiteId())
                .points(points)
                .observationCount(observations.size())
                .yearsObserved(List.copyOf(years))
                .build();
    }

    /**
     * 15-minute slot of the 365-day year the local time falls into.
     */
    static int bucketOf(LocalDateTime time) {
        int month = time.getMonthValue();
        int day = time.getDayOfMonth();
        if (month == 2 && day == 29) {
            day = 28;
        }
        int dayIndex = LocalDate.of(LAYOUT_YEAR, month, day).getDayOfYear() - 1;
        int minuteOfDay = time.getHour() * 60 + time.getMinute();
        return dayIndex * BUCKETS_PER_DAY + minuteOfDay / BUCKET_MINUTES;
    }

    /**
     * Means of the observed buckets; empty buckets are linear between their nearest observed
     * neighbours, wrapping from the last bucket to the first.
     */
    static double[] interpolateGaps(double[] sums, int[] counts) {
        int size = sums.length;
        double[] values = new double[size];
        List<Integer> observed = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (counts[i] > 0) {
                values[i] = sums[i] / counts[i];
                observed.add(i);
            }
        }
        if (observed.isEmpty() || observed.size() == size) {
            return values;
        }
        for (int k = 0; k < observed.size(); k++) {
            int from = observed.get(k);
            int to = observed.get((k + 1) % observed.size());
            int span = Math.floorMod(to - from, size);
            if (span == 0) {
                span = size; // single observed bucket
            }
            for (int step = 1; step < span; step++) {
                double fraction = (double) step / span;
                values[(from + step) % size] = values[from] + (values[to] - values[from]) * fraction;
            }
        }
        return values;
    }

    private List<LocalObservation> withoutZeroProductionDays(List<LocalObservation> observations) {
        Map<LocalDate, Double> dailyTotals = observations.stream()
                .collect(groupingBy(observation -> observation.time.toLocalDate(), HashMap::new,
                        summingDouble(observation -> observation.productionW)));
        List<LocalObservation> kept = observations.stream()
                .filter(observation -> dailyTotals.get(observation.time.toLocalDate()) > 0)
                .toList();
        if (kept.size() < observations.size()) {
            log.debug("Dropped {} observation(s) on days without production.", observations.size() - kept.size());
        }
        return kept;
    }

    private ZoneId zoneOf(SiteEntity site) {
        try {
            return properties.resolveZone(site.getTimeZone(), site.getCountry());
        } catch (DateTimeException e) {
            log.warn("Site {} declares an unknown time zone '{}', using its country zone.", site.getSiteId(), site.getTimeZone());
            return properties.resolveZone(null, site.getCountry());
        }
    }

    private static long countObserved(int[] counts) {
        long observed = 0;
        for (int count : counts) {
            if (count > 0) {
                observed++;
            }
        }
        return observed;
    }

    private static final class LocalObservation {
        private final LocalDateTime time;
        private final double productionW;

        private LocalObservation(LocalDateTime time, double productionW) {
            this.time = time;
            this.productionW = productionW;
        }
    }
}
