package colormix.coordinator.model;

/**
 * Experiment task status.
 */
public enum TaskStatus {
    /** Admitted and waiting in the FIFO queue */
    QUEUED,
    /** Owns the device; commands are in flight */
    PROCESSING,
    /** Measurement cycle finished and the sensor reading was collected */
    COMPLETED,
    /** Device did not finish within the timeout budget */
    TIMED_OUT,
    /** Could not be driven, e.g. the command could not be published */
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == ERRORED;
    }
}
