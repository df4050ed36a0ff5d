package colormix.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubmitExperimentRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "submitterId": "student-7",
                  "R": 120,
                  "Y": 30,
                  "B": 0
                }
                """;

        SubmitExperimentRequest req = mapper.readValue(json, SubmitExperimentRequest.class);

        assertEquals("student-7", req.submitterId());
        assertEquals(120, req.red());
        assertEquals(30, req.yellow());
        assertEquals(0, req.blue());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void missingFieldsFailValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitExperimentRequest(null, 1, 1, 1).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitExperimentRequest("s1", 1, null, 1).validate());
    }

    @Test
    void outOfRangeVolumesAreLeftToAdmission() {
        assertDoesNotThrow(() -> new SubmitExperimentRequest("s1", 500, -3, 0).validate());
    }
}
