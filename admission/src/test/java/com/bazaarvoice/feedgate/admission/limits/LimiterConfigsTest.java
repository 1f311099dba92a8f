package com.bazaarvoice.feedgate.admission.limits;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;

public class LimiterConfigsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final LimiterConfig DEFAULT = new TokenBucketLimiter(250, "10s", 750);

    private static JsonNode json(String value) throws Exception {
        return MAPPER.readTree(value);
    }

    @Test
    public void testAbsentOverrideUsesDefault() {
        assertSame(LimiterConfigs.resolve(null, DEFAULT), DEFAULT);
        assertSame(LimiterConfigs.resolve(NullNode.getInstance(), DEFAULT), DEFAULT);
    }

    @Test
    public void testFixedWindow() throws Exception {
        assertEquals(LimiterConfigs.resolve(json("{\"type\":\"fixedWindow\",\"window\":\"1m\",\"tokens\":100}"), DEFAULT),
                new FixedWindowLimiter("1m", 100));
    }

    @Test
    public void testSlidingWindow() throws Exception {
        assertEquals(LimiterConfigs.resolve(json("{\"type\":\"slidingWindow\",\"window\":\"30s\",\"tokens\":20}"), DEFAULT),
                new SlidingWindowLimiter("30s", 20));
    }

    @Test
    public void testTokenBucket() throws Exception {
        assertEquals(LimiterConfigs.resolve(json("{\"type\":\"tokenBucket\",\"refillRate\":10,\"interval\":\"1s\",\"maxTokens\":50}"), DEFAULT),
                new TokenBucketLimiter(10, "1s", 50));
    }

    @Test
    public void testUnknownTypeFallsBack() throws Exception {
        assertSame(LimiterConfigs.resolve(json("{\"type\":\"leakyBucket\",\"rate\":10}"), DEFAULT), DEFAULT);
    }

    @Test
    public void testMissingTypeFallsBack() throws Exception {
        assertSame(LimiterConfigs.resolve(json("{\"window\":\"1m\",\"tokens\":100}"), DEFAULT), DEFAULT);
    }

    @Test
    public void testMissingFieldFallsBack() throws Exception {
        assertSame(LimiterConfigs.resolve(json("{\"type\":\"fixedWindow\",\"window\":\"1m\"}"), DEFAULT), DEFAULT);
    }

    @Test
    public void testInvalidDurationFallsBack() throws Exception {
        assertSame(LimiterConfigs.resolve(json("{\"type\":\"slidingWindow\",\"window\":\"1 minute\",\"tokens\":5}"), DEFAULT), DEFAULT);
    }

    @Test
    public void testNonObjectFallsBack() throws Exception {
        assertSame(LimiterConfigs.resolve(json("\"tokenBucket\""), DEFAULT), DEFAULT);
    }

    @Test
    public void testSerializesWithType() throws Exception {
        JsonNode node = MAPPER.valueToTree(new SlidingWindowLimiter("1m", 10));
        assertEquals(node, json("{\"type\":\"slidingWindow\",\"window\":\"1m\",\"tokens\":10}"));
    }
}
