package colormix.coordinator.model;

/**
 * Why a submission was turned away before a task was created.
 */
public enum RejectionReason {
    VOLUME("Volumes out of range"),
    QUOTA("No experiments left in quota"),
    NO_WELLS("No unused wells left on the plate"),
    UNAVAILABLE("Coordinator storage unavailable, try again later");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
