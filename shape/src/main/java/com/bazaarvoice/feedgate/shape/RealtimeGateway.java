package com.bazaarvoice.feedgate.shape;

import com.bazaarvoice.feedgate.admission.AdmissionSlot;
import com.bazaarvoice.feedgate.admission.ConcurrencyAdmissionController;
import com.bazaarvoice.feedgate.admission.limits.ConcurrencyLimitProvider;
import com.bazaarvoice.feedgate.checkpoint.CheckpointCache;
import com.bazaarvoice.feedgate.shape.api.ShapeQuery;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.bazaarvoice.feedgate.shape.api.TooManyConcurrentRequestsException;
import com.bazaarvoice.feedgate.shape.poll.LongPollExecutor;
import com.bazaarvoice.feedgate.shape.poll.OriginResponse;
import com.bazaarvoice.feedgate.shape.query.ShapeQueryBuilder;
import com.bazaarvoice.feedgate.shape.routing.OriginRouter;
import com.bazaarvoice.feedgate.shape.time.DurationResolver;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Serves one poll of a shape: resolves the time window, pinning it to the subscription's continuation handle,
 * builds the upstream query, picks the tenant's origin, admits live requests against the tenant's concurrency limit
 * and hands the call to the {@link LongPollExecutor}.
 */
public class RealtimeGateway {

    private static final Logger _log = LoggerFactory.getLogger(RealtimeGateway.class);

    private final OriginRouter _originRouter;
    private final DurationResolver _durationResolver;
    private final ShapeQueryBuilder _queryBuilder;
    private final CheckpointCache _checkpointCache;
    private final ConcurrencyAdmissionController _admissionController;
    private final ConcurrencyLimitProvider _limitProvider;
    private final LongPollExecutor _executor;
    private final Clock _clock;

    @Inject
    public RealtimeGateway(OriginRouter originRouter, DurationResolver durationResolver,
                           ShapeQueryBuilder queryBuilder, CheckpointCache checkpointCache,
                           ConcurrencyAdmissionController admissionController, ConcurrencyLimitProvider limitProvider,
                           LongPollExecutor executor, Clock clock) {
        _originRouter = requireNonNull(originRouter, "originRouter");
        _durationResolver = requireNonNull(durationResolver, "durationResolver");
        _queryBuilder = requireNonNull(queryBuilder, "queryBuilder");
        _checkpointCache = requireNonNull(checkpointCache, "checkpointCache");
        _admissionController = requireNonNull(admissionController, "admissionController");
        _limitProvider = requireNonNull(limitProvider, "limitProvider");
        _executor = requireNonNull(executor, "executor");
        _clock = requireNonNull(clock, "clock");
    }

    /**
     * Starts the poll.  Cancelling the returned future aborts the upstream call and releases any admission slot.
     *
     * @throws TooManyConcurrentRequestsException if the request is live and the tenant is at its concurrency limit
     */
    public ListenableFuture<OriginResponse> poll(TenantEnvironment tenant, ShapeRequest request) {
        requireNonNull(tenant, "tenant");
        requireNonNull(request, "request");

        Optional<Instant> cutoff = resolveCutoff(request);
        String handle = request.getHandle().orElse(null);
        ShapeQuery query = _queryBuilder.build(tenant, request.getTarget(), cutoff, request.getSkipColumns(), handle);
        URI origin = _originRouter.route(tenant.getEnvironmentId());

        // Only a fresh subscription pins its cutoff; a resumed one already has one or has lost it
        Optional<Instant> pinCutoff = query.isResume() ? Optional.empty() : cutoff;

        AdmissionSlot slot = null;
        if (request.isLive()) {
            int limit = _limitProvider.getConcurrencyLimit(tenant);
            slot = _admissionController.tryAcquire(tenant, limit)
                    .orElseThrow(() -> new TooManyConcurrentRequestsException(tenant.getEnvironmentId(), limit));
        }

        try {
            return _executor.execute(tenant, origin, query, request, pinCutoff, slot);
        } catch (RuntimeException e) {
            if (slot != null) {
                slot.release();
            }
            throw e;
        }
    }

    private Optional<Instant> resolveCutoff(ShapeRequest request) {
        if (!request.getCreatedAt().isPresent()) {
            return Optional.empty();
        }
        if (request.getHandle().isPresent()) {
            Optional<Instant> pinned = _checkpointCache.get(request.getHandle().get());
            if (pinned.isPresent()) {
                return pinned;
            }
            // A lost checkpoint is re-resolved against the current time and not pinned again
            _log.debug("No checkpoint for handle {}, resolving {} from now", request.getHandle().get(),
                    request.getCreatedAt().get());
        }
        return _durationResolver.resolveCutoff(request.getCreatedAt().get(), _clock.instant());
    }
}
