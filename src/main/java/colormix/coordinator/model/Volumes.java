package colormix.coordinator.model;

/**
 * Red, yellow and blue dye volumes for one well, in pipette units.
 */
public record Volumes(int red, int yellow, int blue) {

    public int total() {
        return red + yellow + blue;
    }

    /**
     * Check the per-component bound and the total cap.
     *
     * @return true if every component is in [0, maxComponent] and the sum is at
     *         most maxTotal
     */
    public boolean isWithin(int maxComponent, int maxTotal) {
        return inRange(red, maxComponent)
                && inRange(yellow, maxComponent)
                && inRange(blue, maxComponent)
                && total() <= maxTotal;
    }

    private static boolean inRange(int v, int max) {
        return v >= 0 && v <= max;
    }
}
