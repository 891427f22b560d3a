package com.elssolution.powermonitor.aggregation;

import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.store.FakeDisk;
import com.elssolution.powermonitor.store.StoreDataSource;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

import static com.elssolution.powermonitor.store.TestStores.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class EnergyDeltaCalculatorTest {

    static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir Path dir;

    StoreDataSource db;
    TimeSeriesStore store;
    EnergyDeltaCalculator calc;

    @BeforeEach
    void open() {
        db = dataSource(dir);
        store = new TimeSeriesStore(db, FakeDisk.roomy());
        store.saveDevice(device("m1"));
        calc = new EnergyDeltaCalculator(store, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void close() {
        db.close();
    }

    @Test
    void four_minute_marks_make_one_five_minute_bucket() {
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(1), 4, i -> i));

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofMinutes(3)), "A", "5min");

        assertThat(h.getBuckets()).hasSize(1);
        assertThat(h.getBuckets().get(0).deltaKwh()).isCloseTo(3.0, within(1e-9));
        assertThat(h.getBuckets().get(0).timestamp()).isEqualTo(T0);
        assertThat(h.getRawTotalKwh()).isCloseTo(3.0, within(1e-9));
        assertThat(h.getRawCount()).isEqualTo(4);
        assertThat(h.getResolutionApplied()).isEqualTo(Resolution.minutes(5));
    }

    @Test
    void minute_buckets_are_interpolated_and_newest_first() {
        store.appendEnergyReadings(samples("A", Duration.ofSeconds(90), 3, i -> 1.5 * i)); // 1 kWh per minute

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofMinutes(3)), "A", "1min");

        assertThat(h.getBuckets()).extracting(EnergyBucket::timestamp).containsExactly(
                T0.plus(Duration.ofMinutes(2)), T0.plus(Duration.ofMinutes(1)), T0);
        assertThat(h.getBuckets()).allSatisfy(b -> assertThat(b.deltaKwh()).isCloseTo(1.0, within(1e-9)));
    }

    @Test
    void counter_reset_drops_exactly_one_bucket() {
        Instant to = T0.plus(Duration.ofHours(6));
        store.saveDevice(device("m2"));
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(10), 36, i -> 0.5 * i));
        List<EnergyReading> withReset = new ArrayList<>();
        for (int i = 0; i < 36; i++) {
            double kwh = i < 20 ? 0.5 * i : 0.5 * (i - 20); // meter rebooted at 03:20
            withReset.add(energy("m2", "A", T0.plus(Duration.ofMinutes(10L * i)), kwh));
        }
        store.appendEnergyReadings(withReset);

        EnergyHistory clean = calc.historicalEnergy("m1", T0, to, "A", "1hour");
        EnergyHistory reset = calc.historicalEnergy("m2", T0, to, "A", "1hour");

        assertThat(clean.getBuckets()).hasSize(6);
        assertThat(reset.getBuckets()).hasSize(5);
        assertThat(reset.getBuckets()).allSatisfy(b -> assertThat(b.deltaKwh()).isGreaterThanOrEqualTo(0));
        assertThat(reset.getBuckets()).extracting(EnergyBucket::timestamp)
                .doesNotContain(T0.plus(Duration.ofHours(3)));
    }

    @Test
    void counter_reset_drops_exactly_one_interpolated_bucket() {
        Instant to = T0.plus(Duration.ofMinutes(29));
        store.saveDevice(device("m2"));
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(1), 30, i -> 0.1 * i));
        List<EnergyReading> withReset = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            double kwh = i < 15 ? 0.1 * i : 0.1 * (i - 15); // meter rebooted at 00:15
            withReset.add(energy("m2", "A", T0.plus(Duration.ofMinutes(i)), kwh));
        }
        store.appendEnergyReadings(withReset);

        EnergyHistory clean = calc.historicalEnergy("m1", T0, to, "A", "5min");
        EnergyHistory reset = calc.historicalEnergy("m2", T0, to, "A", "5min");

        assertThat(clean.getBuckets()).hasSize(6);
        assertThat(reset.getBuckets()).hasSize(5);
        assertThat(reset.getBuckets()).allSatisfy(b -> assertThat(b.deltaKwh()).isGreaterThanOrEqualTo(0));
        assertThat(reset.getBuckets()).extracting(EnergyBucket::timestamp)
                .doesNotContain(T0.plus(Duration.ofMinutes(10)));
    }

    @Test
    void raw_total_is_not_reset_filtered() {
        store.appendEnergyReadings(List.of(
                energy("m1", "A", T0, 1.0),
                energy("m1", "A", T0.plus(Duration.ofMinutes(30)), 5.0),
                energy("m1", "A", T0.plus(Duration.ofMinutes(60)), 0.5)));

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofHours(2)), "A", "1hour");

        assertThat(h.getRawTotalKwh()).isCloseTo(-0.5, within(1e-9));
        assertThat(h.getBuckets()).extracting(EnergyBucket::deltaKwh).containsExactly(4.0);
    }

    @Test
    void interpolation_and_first_last_agree_on_dense_series() {
        List<EnergyReading> dense = samples("A", Duration.ofSeconds(1), 3 * 3600, i -> 0.001 * i);
        EnergyDeltaCalculator.Series series = EnergyDeltaCalculator.Series.of(dense);
        Resolution hour = Resolution.hours(1);
        List<Instant> starts = calc.bucketStarts(T0, T0.plus(Duration.ofHours(3)), hour);

        double[] interpolated = calc.interpolated(series, starts, hour);
        double[] firstLast = calc.firstLast(series, starts, hour);

        assertThat(starts).hasSize(3);
        for (int i = 0; i < starts.size(); i++) {
            assertThat(interpolated[i]).as("bucket %d", i).isCloseTo(firstLast[i], withinPercentage(0.1));
        }
    }

    @Test
    void all_phases_are_summed_per_bucket() {
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(1), 4, i -> i));
        store.appendEnergyReadings(samples("B", Duration.ofMinutes(1), 4, i -> 2.0 * i));

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofMinutes(3)), "ALL", "5min");

        assertThat(h.getPhase()).isEqualTo("ALL");
        assertThat(h.getBuckets()).singleElement()
                .satisfies(b -> assertThat(b.deltaKwh()).isCloseTo(9.0, within(1e-9)));
        assertThat(h.getRawTotalKwh()).isCloseTo(9.0, within(1e-9));
        assertThat(h.getRawCount()).isEqualTo(8);
    }

    @Test
    void none_reports_only_raw_figures() {
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(1), 4, i -> i));

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofMinutes(3)), "A", "none");

        assertThat(h.getBuckets()).isEmpty();
        assertThat(h.getRawTotalKwh()).isCloseTo(3.0, within(1e-9));
        assertThat(h.getRawCount()).isEqualTo(4);
    }

    @Test
    void auto_with_few_samples_collapses_to_none() {
        store.appendEnergyReadings(samples("A", Duration.ofMinutes(1), 4, i -> i));

        EnergyHistory h = calc.historicalEnergy("m1", T0, T0.plus(Duration.ofDays(1)), "A", "auto");

        assertThat(h.getResolutionApplied()).isEqualTo(Resolution.NONE);
        assertThat(h.getPreAggregationCount()).isEqualTo(4L);
    }

    @Test
    void unknown_device_is_a_query_error() {
        AggregationEngineTest.assertReason(
                () -> calc.historicalEnergy("ghost", T0, T0.plusSeconds(60), "A", "1min"),
                QueryException.Reason.UNKNOWN_DEVICE);
    }

    private static List<EnergyReading> samples(String phase, Duration step, int n, IntToDoubleFunction kwh) {
        List<EnergyReading> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(energy("m1", phase, T0.plus(step.multipliedBy(i)), kwh.applyAsDouble(i)));
        }
        return out;
    }
}
