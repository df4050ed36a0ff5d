package colormix.coordinator.repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository of physical wells on the plate.
 * Wells are consumed by experiments and never recycled.
 */
public interface WellPool {

    /**
     * List unused wells in plate order (A1, A2 .. A12, B1 ..).
     *
     * @return non-empty list of well tokens
     * @throws NoUnusedWellsException if every well is used
     */
    List<String> findUnusedWells();

    /**
     * Atomically mark wells as used. Wells already used (e.g. claimed by a
     * concurrent process) are skipped.
     *
     * @param wells well tokens
     * @return the wells that this call actually transitioned from unused to used
     */
    List<String> markUsed(Collection<String> wells);

    /**
     * Create every well of the plate layout as unused, resetting wells that
     * already exist.
     *
     * @return number of wells on the plate
     */
    int resetPlate();

    /**
     * @return number of unused wells
     */
    int countUnused();
}
