package com.axonops.ingestprep.limits;

import ch.qos.logback.classic.Level;
import com.axonops.ingestprep.config.IngestConfig;
import com.axonops.ingestprep.test.LogCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Admission limits, exact counters and throttled warnings of LabelLimitsValidator.
 */
class LabelLimitsValidatorTest {

    private final AtomicLong clock = new AtomicLong(0);
    private LabelLimitsValidator validator;
    private LogCapture logs;

    @BeforeEach
    void setUp() {
        validator = new LabelLimitsValidator(IngestConfig.DEFAULT, clock::get);
        logs = LogCapture.attach(LabelLimitsValidator.class);
    }

    @AfterEach
    void tearDown() {
        logs.close();
        validator.close();
    }

    private static List<Label> labels(int count) {
        List<Label> labels = new ArrayList<>();
        labels.add(new Label(Label.METRIC_NAME, "metric"));
        for (int i = 1; i < count; i++) {
            labels.add(new Label("label" + i, "value" + i));
        }
        return labels;
    }

    private static String repeat(char c, int n) {
        return String.valueOf(c).repeat(n);
    }

    // ========== Label Count ==========

    @Test
    void testCountAtLimitAdmitted() {
        assertThat(validator.exceeds(labels(40))).isFalse();
        assertThat(validator.getStatistics().total()).isZero();
        assertThat(logs.events()).isEmpty();
    }

    @Test
    void testCountOverLimitRejected() {
        assertThat(validator.exceeds(labels(41))).isTrue();

        assertThat(validator.getIgnoredCount(ViolationKind.TOO_MANY_LABELS)).isEqualTo(1);
        assertThat(logs.messages(Level.WARN)).singleElement().asString()
            .contains("41 labels")
            .contains("metric{label1=\"value1\"")
            .contains("maxLabelsPerTimeseries=40");
    }

    @Test
    void testEmptySetAdmitted() {
        assertThat(validator.exceeds(List.of())).isFalse();
    }

    // ========== Name And Value Length ==========

    @Test
    void testNameLengthBoundary() {
        assertThat(validator.exceeds(List.of(new Label(repeat('n', 256), "v")))).isFalse();
        assertThat(validator.exceeds(List.of(new Label(repeat('n', 257), "v")))).isTrue();

        assertThat(validator.getIgnoredCount(ViolationKind.TOO_LONG_LABEL_NAME)).isEqualTo(1);
        assertThat(logs.messages(Level.WARN)).singleElement().asString()
            .contains("label name length=257")
            .contains("exceeds max allowed 256");
    }

    @Test
    void testValueLengthBoundary() {
        assertThat(validator.exceeds(List.of(new Label("k", repeat('v', 4096))))).isFalse();
        assertThat(validator.exceeds(List.of(new Label("k", repeat('v', 4097))))).isTrue();

        assertThat(validator.getIgnoredCount(ViolationKind.TOO_LONG_LABEL_VALUE)).isEqualTo(1);
        assertThat(logs.messages(Level.WARN)).singleElement().asString()
            .contains("label value length=4097")
            .contains("maxLabelValueLen=4096");
    }

    @Test
    void testLengthsAreUtf8Bytes() {
        // 2048 two-byte chars is exactly 4096 bytes
        assertThat(validator.exceeds(List.of(new Label("k", repeat('é', 2048))))).isFalse();
        assertThat(validator.exceeds(List.of(new Label("k", repeat('é', 2049))))).isTrue();
        // 86 three-byte chars is 258 bytes
        assertThat(validator.exceeds(List.of(new Label(repeat('€', 86), "v")))).isTrue();

        assertThat(validator.getStatistics())
            .isEqualTo(new RejectionStatistics(0, 1, 1));
    }

    @Test
    void testCountCheckedBeforeLengths() {
        List<Label> labels = labels(41);
        labels.set(1, new Label(repeat('n', 300), "v"));

        assertThat(validator.firstViolation(labels))
            .get()
            .extracting(LimitViolation::kind)
            .isEqualTo(ViolationKind.TOO_MANY_LABELS);
    }

    @Test
    void testFirstOffendingLabelWins() {
        List<Label> labels = List.of(
            new Label("ok", "v"),
            new Label("k", repeat('v', 5000)),
            new Label(repeat('n', 300), "v"));

        LimitViolation violation = validator.firstViolation(labels).orElseThrow();

        assertThat(violation.kind()).isEqualTo(ViolationKind.TOO_LONG_LABEL_VALUE);
        assertThat(violation.label()).isEqualTo(labels.get(1));
        assertThat(violation.actual()).isEqualTo(5000);
        assertThat(violation.limit()).isEqualTo(4096);
    }

    @Test
    void testNameCheckedBeforeValueOfSameLabel() {
        Label label = new Label(repeat('n', 300), repeat('v', 5000));

        assertThat(validator.firstViolation(List.of(label)).orElseThrow().kind())
            .isEqualTo(ViolationKind.TOO_LONG_LABEL_NAME);
    }

    @Test
    void testFirstViolationHasNoSideEffects() {
        assertThat(validator.firstViolation(labels(50))).isPresent();

        assertThat(validator.getStatistics().total()).isZero();
        assertThat(logs.events()).isEmpty();
    }

    @Test
    void testCustomLimits() {
        IngestConfig config = IngestConfig.builder()
            .maxLabelsPerTimeseries(3)
            .maxLabelValueLen(10)
            .build();
        try (LabelLimitsValidator custom = new LabelLimitsValidator(config)) {
            assertThat(custom.getMaxLabelsPerTimeseries()).isEqualTo(3);
            assertThat(custom.getMaxLabelValueLen()).isEqualTo(10);
            assertThat(custom.exceeds(labels(3))).isFalse();
            assertThat(custom.exceeds(labels(4))).isTrue();
            assertThat(custom.exceeds(List.of(new Label("k", "0123456789x")))).isTrue();
        }
    }

    // ========== Counting And Throttling ==========

    @Test
    void testEveryRejectionCountedOneWarningPerInterval() {
        List<Label> tooMany = labels(41);
        for (int i = 0; i < 1000; i++) {
            assertThat(validator.exceeds(tooMany)).isTrue();
        }

        assertThat(validator.getIgnoredCount(ViolationKind.TOO_MANY_LABELS)).isEqualTo(1000);
        assertThat(logs.count(Level.WARN)).isEqualTo(1);
    }

    @Test
    void testWarningAgainAfterInterval() {
        List<Label> tooMany = labels(41);
        validator.exceeds(tooMany);

        clock.addAndGet(Duration.ofMillis(4_999).toNanos());
        validator.exceeds(tooMany);
        assertThat(logs.count(Level.WARN)).isEqualTo(1);

        clock.addAndGet(Duration.ofMillis(1).toNanos());
        validator.exceeds(tooMany);
        validator.exceeds(tooMany);
        assertThat(logs.count(Level.WARN)).isEqualTo(2);
        assertThat(validator.getIgnoredCount(ViolationKind.TOO_MANY_LABELS)).isEqualTo(4);
    }

    @Test
    void testKindsThrottledIndependently() {
        validator.exceeds(labels(41));
        validator.exceeds(List.of(new Label(repeat('n', 257), "v")));
        validator.exceeds(List.of(new Label("k", repeat('v', 4097))));
        validator.exceeds(labels(41));

        assertThat(logs.count(Level.WARN)).isEqualTo(3);
        assertThat(validator.getStatistics()).isEqualTo(new RejectionStatistics(2, 1, 1));
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testConcurrentRejectionsCountedExactly() throws InterruptedException {
        int threads = 8;
        int perThread = 5_000;
        List<Label> tooMany = labels(41);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        validator.exceeds(tooMany);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(20, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(validator.getIgnoredCount(ViolationKind.TOO_MANY_LABELS))
            .isEqualTo((long) threads * perThread);
        assertThat(logs.count(Level.WARN)).isEqualTo(1);
    }

    @Test
    void testViolationKindNames() {
        assertThat(ViolationKind.TOO_MANY_LABELS.reason()).isEqualTo("too_many_labels");
        assertThat(ViolationKind.TOO_LONG_LABEL_VALUE.metricName())
            .isEqualTo("rows.ignored.too_long_label_value.total.count");
    }

    @Test
    void testRejectsNullConfig() {
        assertThatThrownBy(() -> new LabelLimitsValidator(null))
            .isInstanceOf(NullPointerException.class);
    }
}
