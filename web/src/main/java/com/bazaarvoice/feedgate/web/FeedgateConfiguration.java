package com.bazaarvoice.feedgate.web;

import com.bazaarvoice.feedgate.admission.AdmissionConfiguration;
import com.bazaarvoice.feedgate.checkpoint.CheckpointConfiguration;
import com.bazaarvoice.feedgate.common.redis.RedisConfiguration;
import com.bazaarvoice.feedgate.common.redis.SharedStorage;
import com.bazaarvoice.feedgate.shape.ShapeConfiguration;
import com.bazaarvoice.feedgate.web.auth.TenantAuthConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.Configuration;
import io.dropwizard.client.JerseyClientConfiguration;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;

public class FeedgateConfiguration extends Configuration {

    @Valid
    @NotNull
    @JsonProperty ("shape")
    private ShapeConfiguration _shapeConfiguration = new ShapeConfiguration();

    @Valid
    @NotNull
    @JsonProperty ("admission")
    private AdmissionConfiguration _admissionConfiguration = new AdmissionConfiguration();

    @Valid
    @NotNull
    @JsonProperty ("checkpoint")
    private CheckpointConfiguration _checkpointConfiguration = new CheckpointConfiguration();

    /** Where admission slots and checkpoints are shared between instances.  {@code memory} is for local use only. */
    @NotNull
    @JsonProperty ("storage")
    private SharedStorage _storage = SharedStorage.REDIS;

    @Valid
    @NotNull
    @JsonProperty ("redis")
    private RedisConfiguration _redisConfiguration = new RedisConfiguration();

    @Valid
    @NotNull
    @JsonProperty ("httpClient")
    private JerseyClientConfiguration _httpClientConfiguration = new JerseyClientConfiguration();

    @Valid
    @NotNull
    @JsonProperty ("auth")
    private TenantAuthConfiguration _authConfiguration = new TenantAuthConfiguration();

    public ShapeConfiguration getShapeConfiguration() {
        return _shapeConfiguration;
    }

    public FeedgateConfiguration setShapeConfiguration(ShapeConfiguration shapeConfiguration) {
        _shapeConfiguration = shapeConfiguration;
        return this;
    }

    public AdmissionConfiguration getAdmissionConfiguration() {
        return _admissionConfiguration;
    }

    public FeedgateConfiguration setAdmissionConfiguration(AdmissionConfiguration admissionConfiguration) {
        _admissionConfiguration = admissionConfiguration;
        return this;
    }

    public CheckpointConfiguration getCheckpointConfiguration() {
        return _checkpointConfiguration;
    }

    public FeedgateConfiguration setCheckpointConfiguration(CheckpointConfiguration checkpointConfiguration) {
        _checkpointConfiguration = checkpointConfiguration;
        return this;
    }

    public SharedStorage getStorage() {
        return _storage;
    }

    public FeedgateConfiguration setStorage(SharedStorage storage) {
        _storage = storage;
        return this;
    }

    public RedisConfiguration getRedisConfiguration() {
        return _redisConfiguration;
    }

    public FeedgateConfiguration setRedisConfiguration(RedisConfiguration redisConfiguration) {
        _redisConfiguration = redisConfiguration;
        return this;
    }

    public JerseyClientConfiguration getHttpClientConfiguration() {
        return _httpClientConfiguration;
    }

    public FeedgateConfiguration setHttpClientConfiguration(JerseyClientConfiguration httpClientConfiguration) {
        _httpClientConfiguration = httpClientConfiguration;
        return this;
    }

    public TenantAuthConfiguration getAuthConfiguration() {
        return _authConfiguration;
    }

    public FeedgateConfiguration setAuthConfiguration(TenantAuthConfiguration authConfiguration) {
        _authConfiguration = authConfiguration;
        return this;
    }
}
