package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.AnalysisRun;
import org.carball.compadvisor.model.RunStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryAnalysisRunRepository implements AnalysisRunRepository {

    private final Map<Long, AnalysisRun> runs = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized AnalysisRun create(AnalysisRun run) {
        AnalysisRun stored = run.toBuilder().runId(nextId++).build();
        runs.put(stored.getRunId(), stored);
        return stored;
    }

    @Override
    public synchronized AnalysisRun finish(AnalysisRun run) {
        AnalysisRun existing = runs.get(run.getRunId());
        if (existing == null) {
            throw new IllegalStateException("Unknown analysis run: " + run.getRunId());
        }
        if (existing.getStatus() != RunStatus.RUNNING) {
            throw new IllegalStateException("Analysis run " + run.getRunId() + " is already " + existing.getStatus());
        }
        runs.put(run.getRunId(), run);
        return run;
    }

    @Override
    public synchronized Optional<AnalysisRun> findById(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<AnalysisRun> findAll() {
        return new ArrayList<>(runs.values());
    }

    @Override
    public synchronized Optional<AnalysisRun> latestCompleted(int strategyId) {
        return runs.values().stream()
                .filter(r -> r.getStrategyId() == strategyId && r.getStatus() == RunStatus.COMPLETED)
                .max(Comparator.comparingLong(AnalysisRun::getRunId));
    }

    @Override
    public synchronized void restore(Collection<AnalysisRun> restored) {
        for (AnalysisRun run : restored) {
            runs.put(run.getRunId(), run);
            nextId = Math.max(nextId, run.getRunId() + 1);
        }
    }
}
