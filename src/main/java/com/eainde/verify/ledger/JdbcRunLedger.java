package com.eainde.verify.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ledger sink backed by the {@code verification_run_ledger} table (see {@code schema.sql}).
 * The snapshot is stored whole as JSON; run id, iteration, status and artifact hash are
 * duplicated into columns for querying.
 */
@Log4j2
public class JdbcRunLedger implements RunLedger {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcRunLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(IterationSnapshot snapshot) {
        Integer last = jdbcTemplate.queryForObject(
                "SELECT MAX(iteration) FROM verification_run_ledger WHERE run_id = ?",
                Integer.class,
                snapshot.runId());
        if (last != null && snapshot.iteration() <= last) {
            throw new IllegalStateException("Run %s already has iteration %d, cannot append %d"
                    .formatted(snapshot.runId(), last, snapshot.iteration()));
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize iteration snapshot", e);
        }

        jdbcTemplate.update("""
                INSERT INTO verification_run_ledger
                    (run_id, iteration, status, artifact_version_hash, snapshot_data, recorded_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                snapshot.runId(),
                snapshot.iteration(),
                snapshot.status() == null ? null : snapshot.status().name(),
                snapshot.artifactVersionHash(),
                json,
                Timestamp.from(snapshot.timestamp()));
        log.debug("Ledger row written run={} iteration={}", snapshot.runId(), snapshot.iteration());
    }

    @Override
    public List<IterationSnapshot> replay(String runId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT snapshot_data FROM verification_run_ledger WHERE run_id = ? ORDER BY iteration",
                (rs, rowNum) -> rs.getString("snapshot_data"),
                runId);
        return rows.stream().map(this::deserialize).toList();
    }

    @Override
    public Set<String> runIds() {
        return new LinkedHashSet<>(jdbcTemplate.query(
                "SELECT DISTINCT run_id FROM verification_run_ledger",
                (rs, rowNum) -> rs.getString("run_id")));
    }

    private IterationSnapshot deserialize(String json) {
        try {
            return objectMapper.readValue(json, IterationSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize iteration snapshot", e);
        }
    }
}
