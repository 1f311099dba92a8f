package com.bazaarvoice.feedgate.common.redis;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.util.Optional;

/**
 * Connection settings for the Redis instance shared by every gateway node.  It holds both the admission counters and
 * the durable checkpoint tier.
 */
public class RedisConfiguration {

    @NotNull
    @JsonProperty("address")
    private String _address = "redis://localhost:6379";

    @NotNull
    @JsonProperty("username")
    private Optional<String> _username = Optional.empty();

    @NotNull
    @JsonProperty("password")
    private Optional<String> _password = Optional.empty();

    @Min(0)
    @JsonProperty("database")
    private int _database = 0;

    @Min(1)
    @JsonProperty("connectionPoolSize")
    private int _connectionPoolSize = 64;

    @Min(1)
    @JsonProperty("connectionMinimumIdleSize")
    private int _connectionMinimumIdleSize = 8;

    @NotNull
    @JsonProperty("timeout")
    private Duration _timeout = Duration.seconds(3);

    @NotNull
    @JsonProperty("connectTimeout")
    private Duration _connectTimeout = Duration.seconds(10);

    @Min(0)
    @JsonProperty("retryAttempts")
    private int _retryAttempts = 1;

    public String getAddress() {
        return _address;
    }

    public RedisConfiguration setAddress(String address) {
        _address = address;
        return this;
    }

    public Optional<String> getUsername() {
        return _username;
    }

    public RedisConfiguration setUsername(String username) {
        _username = Optional.ofNullable(username);
        return this;
    }

    public Optional<String> getPassword() {
        return _password;
    }

    public RedisConfiguration setPassword(String password) {
        _password = Optional.ofNullable(password);
        return this;
    }

    public int getDatabase() {
        return _database;
    }

    public RedisConfiguration setDatabase(int database) {
        _database = database;
        return this;
    }

    public int getConnectionPoolSize() {
        return _connectionPoolSize;
    }

    public RedisConfiguration setConnectionPoolSize(int connectionPoolSize) {
        _connectionPoolSize = connectionPoolSize;
        return this;
    }

    public int getConnectionMinimumIdleSize() {
        return _connectionMinimumIdleSize;
    }

    public RedisConfiguration setConnectionMinimumIdleSize(int connectionMinimumIdleSize) {
        _connectionMinimumIdleSize = connectionMinimumIdleSize;
        return this;
    }

    public Duration getTimeout() {
        return _timeout;
    }

    public RedisConfiguration setTimeout(Duration timeout) {
        _timeout = timeout;
        return this;
    }

    public Duration getConnectTimeout() {
        return _connectTimeout;
    }

    public RedisConfiguration setConnectTimeout(Duration connectTimeout) {
        _connectTimeout = connectTimeout;
        return this;
    }

    public int getRetryAttempts() {
        return _retryAttempts;
    }

    public RedisConfiguration setRetryAttempts(int retryAttempts) {
        _retryAttempts = retryAttempts;
        return this;
    }
}
