package com.poc.upgrade.jobqueue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.BackfillException;
import com.poc.upgrade.infrastructure.database.DialectResolver;
import com.poc.upgrade.infrastructure.database.RowInserter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job queue stored in the {@code JOB} table.
 * A job is claimed by stamping ASSIGNED with a conditional update, so only one
 * worker wins a job; a claim older than the lease timeout may be taken over.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcJobQueue implements JobQueue {
    
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int CLAIM_CANDIDATES = 20;
    
    private final JdbcTemplate jdbcTemplate;
    private final RowInserter rowInserter;
    private final DialectResolver dialectResolver;
    private final ObjectMapper objectMapper;
    private final UpgradeProperties properties;
    private final Clock clock;
    
    @Override
    public long enqueue(JobPayload payload) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("WORK_TYPE", payload.getWorkType());
        columns.put("PAYLOAD", toJson(payload));
        columns.put("NOT_BEFORE", Timestamp.from(clock.instant()));
        columns.put("FAILED", 0);
        columns.put("PAUSE", 0);
        
        long jobId = rowInserter.insert(dialectResolver.current(), "JOB", "JOB_ID", "JOB_SEQ", columns);
        log.debug("[Job-{}] Enqueued {} for resource {}", jobId, payload.getWorkType(), payload.getResourceId());
        return jobId;
    }
    
    @Override
    public Optional<QueuedJob> claimNext(Collection<String> workTypes) {
        if (workTypes.isEmpty()) {
            return Optional.empty();
        }
        
        Instant now = clock.instant();
        Timestamp leaseCutoff = Timestamp.from(now.minusMillis(properties.getBackfill().getLeaseTimeoutMs()));
        
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(now));
        args.add(leaseCutoff);
        args.addAll(workTypes);
        
        String sql = "select JOB_ID, WORK_TYPE, PAYLOAD, FAILED from JOB"
            + " where PAUSE = 0 and NOT_BEFORE <= ?"
            + " and (ASSIGNED is null or ASSIGNED < ?)"
            + " and WORK_TYPE in (" + String.join(", ", Collections.nCopies(workTypes.size(), "?")) + ")"
            + " order by NOT_BEFORE, JOB_ID";
        
        List<QueuedJob> candidates = jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setMaxRows(CLAIM_CANDIDATES);
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            return ps;
        }, (rs, rowNum) -> new QueuedJob(
            rs.getLong("JOB_ID"),
            rs.getString("WORK_TYPE"),
            fromJson(rs.getString("PAYLOAD")),
            rs.getInt("FAILED")
        ));
        
        for (QueuedJob candidate : candidates) {
            int claimed = jdbcTemplate.update(
                "update JOB set ASSIGNED = ? where JOB_ID = ? and (ASSIGNED is null or ASSIGNED < ?)",
                Timestamp.from(now), candidate.getJobId(), leaseCutoff
            );
            if (claimed == 1) {
                log.debug("[Job-{}] Claimed {}", candidate.getJobId(), candidate.getWorkType());
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
    
    @Override
    public void complete(long jobId) {
        jdbcTemplate.update("delete from JOB where JOB_ID = ?", jobId);
        log.debug("[Job-{}] Completed", jobId);
    }
    
    @Override
    public boolean fail(long jobId, String error) {
        List<Integer> failures = jdbcTemplate.queryForList(
            "select FAILED from JOB where JOB_ID = ?", Integer.class, jobId);
        if (failures.isEmpty()) {
            log.warn("[Job-{}] Failure not recorded, the job no longer exists: {}", jobId, error);
            return false;
        }
        int attempts = (failures.get(0) == null ? 0 : failures.get(0)) + 1;
        
        UpgradeProperties.BackfillConfig config = properties.getBackfill();
        boolean park = attempts >= config.getMaxAttempts();
        Instant notBefore = clock.instant().plusMillis(config.getRetryDelayMs() * attempts);
        
        jdbcTemplate.update(
            "update JOB set ASSIGNED = null, FAILED = ?, PAUSE = ?, NOT_BEFORE = ?, LAST_ERROR = ? where JOB_ID = ?",
            attempts, park ? 1 : 0, Timestamp.from(notBefore),
            StringUtils.abbreviate(error, MAX_ERROR_LENGTH), jobId
        );
        
        if (park) {
            log.error("[Job-{}] Parked after {} failed attempts: {}", jobId, attempts, error);
        } else {
            log.warn("[Job-{}] Attempt {}/{} failed: {}. Retrying after {}",
                jobId, attempts, config.getMaxAttempts(), error, notBefore);
        }
        return park;
    }
    
    @Override
    public long countOutstanding(String workType) {
        Long count = jdbcTemplate.queryForObject(
            "select count(*) from JOB where WORK_TYPE = ?", Long.class, workType);
        return count == null ? 0 : count;
    }
    
    private String toJson(JobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackfillException("Failed to serialise job payload", e);
        }
    }
    
    private JobPayload fromJson(String json) {
        try {
            return objectMapper.readValue(json, JobPayload.class);
        } catch (JsonProcessingException e) {
            throw new BackfillException("Failed to read job payload: " + json, e);
        }
    }
}
