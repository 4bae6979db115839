package com.eainde.verify.ledger;

import com.eainde.verify.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.eainde.verify.ledger.LedgerFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRunLedgerTest {

    private final InMemoryRunLedger ledger = new InMemoryRunLedger();

    @Test
    @DisplayName("replays snapshots of a run in iteration order")
    void replay() {
        ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.FALSIFIED)));
        ledger.append(snapshot("run-2", 1, Map.of("A", Verdict.VERIFIED)));
        ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.VERIFIED)));

        assertThat(ledger.replay("run-1")).extracting(IterationSnapshot::iteration).containsExactly(1, 2);
        assertThat(ledger.runIds()).containsExactlyInAnyOrder("run-1", "run-2");
    }

    @Test
    @DisplayName("an unknown run replays as empty")
    void unknownRun() {
        assertThat(ledger.replay("nope")).isEmpty();
    }

    @Test
    @DisplayName("is append-only: an iteration cannot be written twice or out of order")
    void appendOnly() {
        ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.VERIFIED)));

        assertThatThrownBy(() -> ledger.append(snapshot("run-1", 2, Map.of("A", Verdict.VERIFIED))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.VERIFIED))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(ledger.replay("run-1")).hasSize(1);
    }

    @Test
    @DisplayName("a replayed history cannot be modified")
    void immutableReplay() {
        ledger.append(snapshot("run-1", 1, Map.of("A", Verdict.VERIFIED)));

        assertThatThrownBy(() -> ledger.replay("run-1").clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
