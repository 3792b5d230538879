package com.golfleague.common.model;

import com.golfleague.common.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreTypeTest {

    @Test
    @DisplayName("missing or blank sortBy → NET")
    void defaultsToNet() {
        assertEquals(ScoreType.NET, ScoreType.fromParam(null));
        assertEquals(ScoreType.NET, ScoreType.fromParam("  "));
    }

    @Test
    @DisplayName("case-insensitive parse")
    void caseInsensitive() {
        assertEquals(ScoreType.GROSS, ScoreType.fromParam("gross"));
        assertEquals(ScoreType.NET, ScoreType.fromParam(" Net "));
    }

    @Test
    @DisplayName("misspelt sortBy is rejected, not silently replaced")
    void unknownValueRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> ScoreType.fromParam("grss"));
        assertTrue(e.getMessage().contains("grss"));
    }
}
