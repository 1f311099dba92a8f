package com.bazaarvoice.feedgate.shape.routing;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pins each tenant to one change-feed origin.  A continuation handle is only meaningful to the origin that minted
 * it, so every poll for a tenant must land on the same origin.
 * <p>
 * Tenants are hashed with a stable hash function and mapped with Guava's jump consistent hash.  The mapping does
 * not depend on process state, and appending an origin to the end of the list only moves the tenants that now
 * belong to the new origin.
 */
public class OriginRouter {

    private static final HashFunction HASH = Hashing.murmur3_128();

    private final List<URI> _origins;

    public OriginRouter(List<URI> origins) {
        checkArgument(!origins.isEmpty(), "At least one origin is required");
        _origins = ImmutableList.copyOf(origins);
    }

    public URI route(String environmentId) {
        if (_origins.size() == 1) {
            return _origins.get(0);
        }
        int bucket = Hashing.consistentHash(HASH.hashString(environmentId, StandardCharsets.UTF_8), _origins.size());
        return _origins.get(bucket);
    }

    public List<URI> getOrigins() {
        return _origins;
    }
}
