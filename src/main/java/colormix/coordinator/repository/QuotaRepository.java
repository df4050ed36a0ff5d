package colormix.coordinator.repository;

/**
 * Per-submitter experiment allowance.
 */
public interface QuotaRepository {

    /**
     * Remaining experiments for a submitter. Unknown submitters are registered
     * with the default quota.
     */
    int getRemainingQuota(String submitterId);

    /**
     * Atomically consume one experiment.
     *
     * @return true if quota was available and has been decremented
     */
    boolean decrement(String submitterId);

    /**
     * Set the allowance of a submitter, creating it if needed.
     */
    void setQuota(String submitterId, int quota);
}
