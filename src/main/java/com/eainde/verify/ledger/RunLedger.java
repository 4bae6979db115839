package com.eainde.verify.ledger;

import java.util.List;
import java.util.Set;

/**
 * Append-only history of iteration snapshots, keyed by run id.
 */
public interface RunLedger {

    /**
     * @throws IllegalStateException if the snapshot's iteration is not greater than the last
     *                               iteration recorded for the same run
     */
    void append(IterationSnapshot snapshot);

    /**
     * Snapshots of a run in iteration order; empty for an unknown run.
     */
    List<IterationSnapshot> replay(String runId);

    Set<String> runIds();
}
