package com.poc.upgrade.jobqueue;

import com.poc.upgrade.MutableClock;
import com.poc.upgrade.SqliteTestDatabase;
import com.poc.upgrade.UpgradeTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JdbcJobQueue")
class JdbcJobQueueTest {

    private static final List<String> WORK_TYPES = List.of(UpgradeTestFixture.WORK_TYPE);

    @TempDir
    Path tempDir;

    private SqliteTestDatabase database;
    private MutableClock clock;
    private JdbcJobQueue queue;

    @BeforeEach
    void setUp() {
        database = SqliteTestDatabase.create(tempDir).withVersion44Schema();
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        UpgradeTestFixture fixture = new UpgradeTestFixture(database, clock);
        fixture.properties.getBackfill().setMaxAttempts(3);
        fixture.properties.getBackfill().setRetryDelayMs(1000);
        fixture.properties.getBackfill().setLeaseTimeoutMs(60000);
        queue = fixture.jobQueue;
    }

    private long enqueue(long resourceId) {
        return queue.enqueue(JobPayload.builder()
            .workType(UpgradeTestFixture.WORK_TYPE)
            .workTable(UpgradeTestFixture.WORK_TABLE)
            .resourceId(resourceId)
            .build());
    }

    @Test
    @DisplayName("assigns distinct ids and stores the payload")
    void enqueuesJobs() {
        long first = enqueue(1);
        long second = enqueue(2);

        assertThat(second).isNotEqualTo(first);
        assertThat(queue.countOutstanding(UpgradeTestFixture.WORK_TYPE)).isEqualTo(2);

        Optional<QueuedJob> claimed = queue.claimNext(WORK_TYPES);
        assertThat(claimed).hasValueSatisfying(job -> {
            assertThat(job.getJobId()).isEqualTo(first);
            assertThat(job.getPayload().getResourceId()).isEqualTo(1L);
            assertThat(job.getPayload().getWorkTable()).isEqualTo(UpgradeTestFixture.WORK_TABLE);
            assertThat(job.getFailures()).isZero();
        });
    }

    @Test
    @DisplayName("hands each job to one claimant until its lease expires")
    void claimIsExclusiveUntilLeaseExpires() {
        long jobId = enqueue(1);

        assertThat(queue.claimNext(WORK_TYPES)).map(QueuedJob::getJobId).contains(jobId);
        assertThat(queue.claimNext(WORK_TYPES)).isEmpty();

        clock.advance(Duration.ofMinutes(2));

        assertThat(queue.claimNext(WORK_TYPES)).map(QueuedJob::getJobId).contains(jobId);
    }

    @Test
    @DisplayName("ignores work types nobody asked for")
    void filtersByWorkType() {
        enqueue(1);

        assertThat(queue.claimNext(List.of("other-work"))).isEmpty();
        assertThat(queue.claimNext(List.of())).isEmpty();
    }

    @Test
    @DisplayName("reschedules a failed job with a growing delay and parks it after the last attempt")
    void failureBackoffAndParking() {
        long jobId = enqueue(1);
        queue.claimNext(WORK_TYPES);

        assertThat(queue.fail(jobId, "boom")).isFalse();
        assertThat(queue.claimNext(WORK_TYPES)).isEmpty();

        clock.advance(Duration.ofMillis(1000));
        assertThat(queue.claimNext(WORK_TYPES)).hasValueSatisfying(job -> assertThat(job.getFailures()).isEqualTo(1));
        assertThat(queue.fail(jobId, "boom")).isFalse();

        clock.advance(Duration.ofMillis(1000));
        assertThat(queue.claimNext(WORK_TYPES)).isEmpty();
        clock.advance(Duration.ofMillis(1000));
        assertThat(queue.claimNext(WORK_TYPES)).isPresent();

        assertThat(queue.fail(jobId, "boom")).isTrue();
        clock.advance(Duration.ofHours(1));
        assertThat(queue.claimNext(WORK_TYPES)).isEmpty();
        assertThat(database.getJdbcTemplate().queryForObject(
            "select LAST_ERROR from JOB where JOB_ID = ?", String.class, jobId)).isEqualTo("boom");
    }

    @Test
    @DisplayName("ignores a failure reported for a job that no longer exists")
    void failureOfRemovedJob() {
        long jobId = enqueue(1);
        queue.complete(jobId);

        assertThat(queue.fail(jobId, "late failure")).isFalse();
        assertThat(queue.countOutstanding(UpgradeTestFixture.WORK_TYPE)).isZero();
    }

    @Test
    @DisplayName("removes a completed job")
    void completesJob() {
        long jobId = enqueue(1);

        queue.complete(jobId);

        assertThat(queue.countOutstanding(UpgradeTestFixture.WORK_TYPE)).isZero();
    }
}
