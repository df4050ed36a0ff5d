package colormix.coordinator.repository;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;

import java.util.List;
import java.util.Optional;

/**
 * Persisted experiment results.
 */
public interface ResultRepository {

    /**
     * Save a terminal result. Saving the same token twice keeps the first.
     */
    void save(ExperimentResult result);

    Optional<ExperimentResult> findByToken(SessionToken token);

    /**
     * Results of one submitter, most recent first.
     */
    List<ExperimentResult> findBySession(String sessionId, int limit);

    /**
     * Most recent results of all submitters.
     */
    List<ExperimentResult> findRecent(int limit);
}
