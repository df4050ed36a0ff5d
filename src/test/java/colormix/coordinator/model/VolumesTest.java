package colormix.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VolumesTest {

    @Test
    void acceptsSumAtTheCap() {
        assertTrue(new Volumes(100, 100, 100).isWithin(300, 300));
        assertTrue(new Volumes(300, 0, 0).isWithin(300, 300));
        assertTrue(new Volumes(0, 0, 0).isWithin(300, 300));
    }

    @Test
    void rejectsSumOverTheCap() {
        Volumes volumes = new Volumes(200, 150, 0);
        assertEquals(350, volumes.total());
        assertFalse(volumes.isWithin(300, 300));
    }

    @Test
    void rejectsComponentOutOfRange() {
        assertFalse(new Volumes(-1, 0, 0).isWithin(300, 300));
        assertFalse(new Volumes(0, 301, 0).isWithin(300, 600));
        assertFalse(new Volumes(0, 0, 120).isWithin(100, 300));
    }
}
