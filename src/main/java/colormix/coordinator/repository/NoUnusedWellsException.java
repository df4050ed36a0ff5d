package colormix.coordinator.repository;

/**
 * The plate has no well left with status "empty".
 */
public class NoUnusedWellsException extends RuntimeException {

    public NoUnusedWellsException() {
        super("No empty wells found");
    }
}
