package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.AnalysisRun;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AnalysisRunRepository {

    /**
     * Stores a new run and assigns its id.
     */
    AnalysisRun create(AnalysisRun run);

    /**
     * Replaces a RUNNING run with its finalized state.
     *
     * @throws IllegalStateException if the run is unknown or already finalized
     */
    AnalysisRun finish(AnalysisRun run);

    Optional<AnalysisRun> findById(long runId);

    List<AnalysisRun> findAll();

    Optional<AnalysisRun> latestCompleted(int strategyId);

    void restore(Collection<AnalysisRun> runs);
}
