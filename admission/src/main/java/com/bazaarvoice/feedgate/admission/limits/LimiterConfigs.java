package com.bazaarvoice.feedgate.admission.limits;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Resolves loosely-typed limiter overrides into a validated {@link LimiterConfig}.
 */
public final class LimiterConfigs {

    private static final Logger _log = LoggerFactory.getLogger(LimiterConfigs.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LimiterConfigs() {
        // empty
    }

    /**
     * Returns {@code override} as a validated limiter, or {@code defaultConfig} if the override is absent,
     * unparseable or invalid.
     */
    public static LimiterConfig resolve(@Nullable JsonNode override, LimiterConfig defaultConfig) {
        requireNonNull(defaultConfig, "defaultConfig");
        if (override == null || override.isNull() || override.isMissingNode()) {
            return defaultConfig;
        }
        try {
            LimiterConfig config = MAPPER.treeToValue(override, LimiterConfig.class);
            if (config == null) {
                return defaultConfig;
            }
            config.validate();
            return config;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            _log.warn("Ignoring invalid rate limiter override {}: {}", override, e.getMessage());
            return defaultConfig;
        }
    }
}
