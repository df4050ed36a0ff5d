package colormix.coordinator.model;

/**
 * Result of depositing an experiment result for a waiting caller.
 */
public enum DepositResult {
    /** First result for the token; the waiter is released */
    DELIVERED,

    /** A result was already deposited for the token - ignored */
    ALREADY_DELIVERED
}
