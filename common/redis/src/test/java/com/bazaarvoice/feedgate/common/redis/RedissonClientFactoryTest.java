package com.bazaarvoice.feedgate.common.redis;

import io.dropwizard.util.Duration;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class RedissonClientFactoryTest {

    @Test
    public void testSingleServerSettings() {
        RedisConfiguration configuration = new RedisConfiguration()
                .setAddress("redis://cache.internal:6380")
                .setDatabase(3)
                .setConnectionPoolSize(16)
                .setConnectionMinimumIdleSize(2)
                .setTimeout(Duration.milliseconds(750))
                .setPassword("secret");

        SingleServerConfig server = new RedissonClientFactory(configuration).configureServer(new Config().useSingleServer());

        assertEquals(server.getAddress(), "redis://cache.internal:6380");
        assertEquals(server.getDatabase(), 3);
        assertEquals(server.getConnectionPoolSize(), 16);
        assertEquals(server.getConnectionMinimumIdleSize(), 2);
        assertEquals(server.getTimeout(), 750);
        assertEquals(server.getPassword(), "secret");
        assertNull(server.getUsername());
    }
}
