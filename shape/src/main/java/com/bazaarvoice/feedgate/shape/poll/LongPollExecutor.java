package com.bazaarvoice.feedgate.shape.poll;

import com.bazaarvoice.feedgate.admission.AdmissionSlot;
import com.bazaarvoice.feedgate.checkpoint.CheckpointCache;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.shape.ShapeRequest;
import com.bazaarvoice.feedgate.shape.api.OriginRequestFailedException;
import com.bazaarvoice.feedgate.shape.api.ShapeQuery;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.bazaarvoice.feedgate.shape.protocol.ClientProtocol;
import com.bazaarvoice.feedgate.shape.query.ShapeQueryBuilder;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static java.util.Objects.requireNonNull;

/**
 * Performs the upstream call for one poll.  Cancelling the returned future aborts the call in flight.  However the
 * call ends, successfully, with an error or by cancellation, the admission slot held for it is released exactly once.
 * <p>
 * Origins are not retried; the caller controls the long-poll cadence and retries on its own schedule.
 */
public class LongPollExecutor {

    private static final Logger _log = LoggerFactory.getLogger(LongPollExecutor.class);

    // Hop-by-hop headers and headers describing the origin's encoding of the body, which is re-encoded on the way out
    private static final Set<String> UNFORWARDED_HEADERS = ImmutableSet.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "te", "trailer",
            "transfer-encoding", "upgrade", "content-length", "content-encoding");

    private final OriginClient _originClient;
    private final CheckpointCache _checkpointCache;
    private final RateLimitedLog _rateLimitedLog;
    private final Timer _originCalls;
    private final Meter _originFailures;

    @Inject
    public LongPollExecutor(OriginClient originClient, CheckpointCache checkpointCache,
                            MetricRegistry metricRegistry, RateLimitedLogFactory logFactory) {
        _originClient = requireNonNull(originClient, "originClient");
        _checkpointCache = requireNonNull(checkpointCache, "checkpointCache");
        _rateLimitedLog = logFactory.from(_log);
        _originCalls = metricRegistry.timer(MetricRegistry.name("bv.feedgate.shape", "LongPollExecutor", "origin-calls"));
        _originFailures = metricRegistry.meter(MetricRegistry.name("bv.feedgate.shape", "LongPollExecutor", "origin-failures"));
    }

    /**
     * @param pinCutoff the cutoff to pin to the handle the origin mints, for fresh subscriptions with a time window
     * @param slot      the admission slot held for a live request, or null for snapshot requests
     */
    public ListenableFuture<OriginResponse> execute(final TenantEnvironment tenant, final URI origin,
                                                    final ShapeQuery query, final ShapeRequest request,
                                                    final Optional<Instant> pinCutoff,
                                                    @Nullable final AdmissionSlot slot) {
        ListMultimap<String, String> params = originParams(query, request);

        final Timer.Context timer = _originCalls.time();
        ListenableFuture<OriginResponse> call;
        try {
            call = _originClient.getShape(origin, params);
        } catch (RuntimeException e) {
            timer.stop();
            if (slot != null) {
                slot.release();
            }
            throw e;
        }

        call.addListener(() -> {
            timer.stop();
            if (slot != null) {
                slot.release();
            }
        }, MoreExecutors.directExecutor());

        ListenableFuture<OriginResponse> result = Futures.transform(call,
                response -> complete(origin, query, request.getProtocol(), pinCutoff, response),
                MoreExecutors.directExecutor());

        Futures.addCallback(result, new FutureCallback<OriginResponse>() {
            @Override
            public void onSuccess(OriginResponse response) {
                // Nothing to record
            }

            @Override
            public void onFailure(Throwable t) {
                if (t instanceof CancellationException) {
                    _log.debug("Shape request for tenant {} cancelled by the caller", tenant.getEnvironmentId());
                    return;
                }
                _originFailures.mark();
                _rateLimitedLog.warn(t, "Shape request failed for tenant {} on origin {} with handle {}",
                        tenant.getEnvironmentId(), origin, query.getHandle().orElse("<none>"));
            }
        }, MoreExecutors.directExecutor());

        return result;
    }

    @VisibleForTesting
    static ListMultimap<String, String> originParams(ShapeQuery query, ShapeRequest request) {
        ListMultimap<String, String> params = LinkedListMultimap.create();
        params.put("table", query.getTable());
        params.put("where", query.getWhere());
        params.put("columns", ShapeQueryBuilder.columnList(query.getColumns()));
        query.getHandle().ifPresent(handle -> params.put(request.getProtocol().getHandleParam(), handle));
        for (Map.Entry<String, String> entry : request.getPassthrough().entrySet()) {
            params.put(entry.getKey(), entry.getValue());
        }
        if (request.isLive()) {
            params.put(ClientProtocol.LIVE_PARAM, "true");
        }
        return params;
    }

    private OriginResponse complete(URI origin, ShapeQuery query, ClientProtocol protocol, Optional<Instant> pinCutoff,
                                    OriginResponse response) {
        if (!response.isSuccessful()) {
            throw new OriginRequestFailedException(origin, response.getStatus(),
                    new String(response.getBody(), StandardCharsets.UTF_8), firstHeader(response, "content-type"));
        }

        if (!query.isResume() && pinCutoff.isPresent()) {
            Optional<String> handle = ClientProtocol.readOriginHandle(response.getHeaders());
            if (handle.isPresent()) {
                _checkpointCache.set(handle.get(), pinCutoff.get());
            } else {
                _log.debug("Origin {} returned no continuation handle, cutoff not pinned", origin);
            }
        }

        ListMultimap<String, String> forwarded = LinkedListMultimap.create();
        for (Map.Entry<String, String> header : response.getHeaders().entries()) {
            if (!UNFORWARDED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                forwarded.put(header.getKey(), header.getValue());
            }
        }
        return new OriginResponse(response.getStatus(), protocol.translateResponseHeaders(forwarded), response.getBody());
    }

    @Nullable
    private static String firstHeader(OriginResponse response, String name) {
        for (Map.Entry<String, String> header : response.getHeaders().entries()) {
            if (header.getKey().equalsIgnoreCase(name)) {
                return header.getValue();
            }
        }
        return null;
    }
}
