package com.eainde.verify.ledger;

import com.eainde.verify.model.RunStatus;
import com.eainde.verify.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.eainde.verify.ledger.LedgerFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRunLedgerTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcRunLedger ledger;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        ledger = new JdbcRunLedger(jdbcTemplate, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("a snapshot survives the round trip through the table")
    void roundTrip() {
        Map<String, Verdict> verdicts = new LinkedHashMap<>();
        verdicts.put("A", Verdict.VERIFIED);
        verdicts.put("B", Verdict.PARTIAL);
        IterationSnapshot written = snapshot("run-1", 1, verdicts);

        ledger.append(written);

        List<IterationSnapshot> replayed = ledger.replay("run-1");
        assertThat(replayed).containsExactly(written);
        assertThat(replayed.get(0).remediationPlan().targetClaimIds()).containsExactly("B");
    }

    @Test
    @DisplayName("indexes run id, iteration, status and artifact hash in columns")
    void columns() {
        ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.FALSIFIED)));

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT status, artifact_version_hash FROM verification_run_ledger WHERE run_id = ? AND iteration = ?",
                "run-1", 1);
        assertThat(row.get("STATUS")).isEqualTo(RunStatus.REMEDIATING.name());
        assertThat(row.get("ARTIFACT_VERSION_HASH")).isEqualTo("hash-1");
    }

    @Test
    @DisplayName("replays in iteration order and lists run ids")
    void ordering() {
        ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.FALSIFIED)));
        ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.FALSIFIED)));
        ledger.append(snapshot("run-1", 3, Map.of("A", Verdict.VERIFIED)));
        ledger.append(snapshot("run-2", 1, Map.of("A", Verdict.VERIFIED)));

        assertThat(ledger.replay("run-1")).extracting(IterationSnapshot::iteration).containsExactly(1, 2, 3);
        assertThat(ledger.runIds()).containsExactlyInAnyOrder("run-1", "run-2");
    }

    @Test
    @DisplayName("rejects an iteration that is not after the last one")
    void appendOnly() {
        ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.VERIFIED)));

        assertThatThrownBy(() -> ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.VERIFIED))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.VERIFIED))))
                .isInstanceOf(IllegalStateException.class);
    }
}
