package com.eainde.verify.ledger;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default ledger. Each run's history is an immutable list replaced on every append.
 */
@Log4j2
public class InMemoryRunLedger implements RunLedger {

    private final Map<String, List<IterationSnapshot>> storage = new ConcurrentHashMap<>();

    @Override
    public void append(IterationSnapshot snapshot) {
        storage.compute(snapshot.runId(), (runId, snapshots) -> {
            List<IterationSnapshot> next = snapshots == null ? new ArrayList<>() : new ArrayList<>(snapshots);
            if (!next.isEmpty()) {
                int last = next.get(next.size() - 1).iteration();
                if (snapshot.iteration() <= last) {
                    throw new IllegalStateException("Run %s already has iteration %d, cannot append %d"
                            .formatted(runId, last, snapshot.iteration()));
                }
            }
            next.add(snapshot);
            return List.copyOf(next);
        });
        log.debug("Ledger append run={} iteration={} status={}",
                snapshot.runId(), snapshot.iteration(), snapshot.status());
    }

    @Override
    public List<IterationSnapshot> replay(String runId) {
        return storage.getOrDefault(runId, List.of());
    }

    @Override
    public Set<String> runIds() {
        return Set.copyOf(storage.keySet());
    }
}
