package com.bazaarvoice.feedgate.shape.api;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

public class RelativeDurationTest {

    @DataProvider (name = "valid")
    public static Object[][] valid() {
        return new Object[][] {
                {"30s", Duration.ofSeconds(30)},
                {"15m", Duration.ofMinutes(15)},
                {"2h", Duration.ofHours(2)},
                {"2hr", Duration.ofHours(2)},
                {"3d", Duration.ofDays(3)},
                {"1w", Duration.ofDays(7)},
                {"1w2d3hr4m5s", Duration.ofDays(9).plusHours(3).plusMinutes(4).plusSeconds(5)},
                {"30s2h1d", Duration.ofDays(1).plusHours(2).plusSeconds(30)},
                {"0s", Duration.ZERO},
                {"100d", Duration.ofDays(100)},
        };
    }

    @Test (dataProvider = "valid")
    public void testValid(String value, Duration expected) {
        assertEquals(RelativeDuration.parse(value), Optional.of(expected));
    }

    @DataProvider (name = "invalid")
    public static Object[][] invalid() {
        return new Object[][] {{""}, {"invalid"}, {"-1h"}, {"1x"}, {"1h2x"}, {"1.5h"}, {"h"}, {"24 h"}};
    }

    @Test (dataProvider = "invalid")
    public void testInvalid(String value) {
        assertFalse(RelativeDuration.parse(value).isPresent());
    }

    @Test
    public void testNull() {
        assertFalse(RelativeDuration.isValid(null));
    }
}
