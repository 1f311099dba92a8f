package com.bazaarvoice.feedgate.shape.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The authenticated subscriber: an environment and the organization that owns it.  The environment id is the
 * partition key for admission control and the routing key for origin selection.
 */
public final class TenantEnvironment {

    private final String _environmentId;
    private final String _organizationId;

    @JsonCreator
    public TenantEnvironment(@JsonProperty("environmentId") String environmentId,
                             @JsonProperty("organizationId") String organizationId) {
        checkArgument(!Strings.isNullOrEmpty(environmentId), "environmentId is required");
        checkArgument(!Strings.isNullOrEmpty(organizationId), "organizationId is required");
        _environmentId = environmentId;
        _organizationId = organizationId;
    }

    @JsonProperty("environmentId")
    public String getEnvironmentId() {
        return _environmentId;
    }

    @JsonProperty("organizationId")
    public String getOrganizationId() {
        return _organizationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TenantEnvironment)) {
            return false;
        }
        TenantEnvironment that = (TenantEnvironment) o;
        return _environmentId.equals(that._environmentId) && _organizationId.equals(that._organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_environmentId, _organizationId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("environmentId", _environmentId)
                .add("organizationId", _organizationId)
                .toString();
    }
}
