package com.bazaarvoice.feedgate.web.resources.realtime;

import com.bazaarvoice.feedgate.shape.RealtimeGateway;
import com.bazaarvoice.feedgate.shape.ShapeRequest;
import com.bazaarvoice.feedgate.shape.api.ShapeTarget;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.bazaarvoice.feedgate.shape.poll.OriginResponse;
import com.bazaarvoice.feedgate.shape.protocol.ClientProtocol;
import com.bazaarvoice.feedgate.web.auth.TenantAuthenticator;
import com.bazaarvoice.feedgate.web.jersey.params.CsvParam;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.ws.rs.GET;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.container.AsyncResponse;
import javax.ws.rs.container.ConnectionCallback;
import javax.ws.rs.container.Suspended;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Shape endpoints for task runs.  Each request is suspended while the origin is polled; the response is the origin's
 * status, headers and body, with the continuation headers renamed for legacy callers.
 */
@Path ("/realtime/v1")
@Produces (MediaType.APPLICATION_JSON)
public class RealtimeResource1 {

    private static final Logger _log = LoggerFactory.getLogger(RealtimeResource1.class);

    private final RealtimeGateway _gateway;
    private final TenantAuthenticator _authenticator;
    private final Duration _longPollTimeout;

    public RealtimeResource1(RealtimeGateway gateway, TenantAuthenticator authenticator, Duration longPollTimeout) {
        _gateway = requireNonNull(gateway, "gateway");
        _authenticator = requireNonNull(authenticator, "authenticator");
        _longPollTimeout = requireNonNull(longPollTimeout, "longPollTimeout");
    }

    @GET
    @Path ("runs/{runId}")
    public void getRun(@PathParam ("runId") String runId,
                       @QueryParam ("live") String live,
                       @QueryParam ("handle") String handle,
                       @QueryParam ("shape_id") String shapeId,
                       @QueryParam ("offset") String offset,
                       @QueryParam ("cursor") String cursor,
                       @QueryParam ("skipColumns") CsvParam skipColumns,
                       @HeaderParam (ClientProtocol.CLIENT_VERSION_HEADER) String clientVersion,
                       @HeaderParam (HttpHeaders.AUTHORIZATION) String authorization,
                       @Suspended AsyncResponse asyncResponse) {
        ShapeRequest.Builder request = ShapeRequest.builder(ShapeTarget.forRun(runId));
        poll(request, null, live, handle, shapeId, offset, cursor, skipColumns, clientVersion, authorization, asyncResponse);
    }

    @GET
    @Path ("runs")
    public void getRuns(@QueryParam ("tags") CsvParam tags,
                        @QueryParam ("createdAt") String createdAt,
                        @QueryParam ("live") String live,
                        @QueryParam ("handle") String handle,
                        @QueryParam ("shape_id") String shapeId,
                        @QueryParam ("offset") String offset,
                        @QueryParam ("cursor") String cursor,
                        @QueryParam ("skipColumns") CsvParam skipColumns,
                        @HeaderParam (ClientProtocol.CLIENT_VERSION_HEADER) String clientVersion,
                        @HeaderParam (HttpHeaders.AUTHORIZATION) String authorization,
                        @Suspended AsyncResponse asyncResponse) {
        ShapeRequest.Builder request = ShapeRequest.builder(ShapeTarget.forTags(valuesOf(tags)));
        poll(request, createdAt, live, handle, shapeId, offset, cursor, skipColumns, clientVersion, authorization, asyncResponse);
    }

    @GET
    @Path ("batches/{batchId}")
    public void getBatch(@PathParam ("batchId") String batchId,
                         @QueryParam ("createdAt") String createdAt,
                         @QueryParam ("live") String live,
                         @QueryParam ("handle") String handle,
                         @QueryParam ("shape_id") String shapeId,
                         @QueryParam ("offset") String offset,
                         @QueryParam ("cursor") String cursor,
                         @QueryParam ("skipColumns") CsvParam skipColumns,
                         @HeaderParam (ClientProtocol.CLIENT_VERSION_HEADER) String clientVersion,
                         @HeaderParam (HttpHeaders.AUTHORIZATION) String authorization,
                         @Suspended AsyncResponse asyncResponse) {
        ShapeRequest.Builder request = ShapeRequest.builder(ShapeTarget.forBatch(batchId));
        poll(request, createdAt, live, handle, shapeId, offset, cursor, skipColumns, clientVersion, authorization, asyncResponse);
    }

    private void poll(ShapeRequest.Builder builder, @Nullable String createdAt, @Nullable String live,
                      @Nullable String handle, @Nullable String shapeId, @Nullable String offset,
                      @Nullable String cursor, @Nullable CsvParam skipColumns, @Nullable String clientVersion,
                      @Nullable String authorization, AsyncResponse asyncResponse) {
        final ListenableFuture<OriginResponse> future;
        try {
            TenantEnvironment tenant = _authenticator.authenticate(authorization);
            ClientProtocol protocol = ClientProtocol.forVersion(clientVersion);
            ShapeRequest request = builder
                    .protocol(protocol)
                    .live("true".equals(live))
                    .handle(protocol.selectHandle(handle, shapeId).orElse(null))
                    .createdAt(createdAt)
                    .skipColumns(valuesOf(skipColumns))
                    .passthrough("offset", offset)
                    .passthrough("cursor", cursor)
                    .build();
            future = _gateway.poll(tenant, request);
        } catch (RuntimeException e) {
            asyncResponse.resume(e);
            return;
        }

        asyncResponse.setTimeout(_longPollTimeout.toMillis(), TimeUnit.MILLISECONDS);
        asyncResponse.setTimeoutHandler(response -> {
            _log.debug("Shape request timed out after {}", _longPollTimeout);
            future.cancel(true);
            response.resume(Response.status(Response.Status.GATEWAY_TIMEOUT).build());
        });
        asyncResponse.register((ConnectionCallback) disconnected -> future.cancel(true));

        Futures.addCallback(future, new FutureCallback<OriginResponse>() {
            @Override
            public void onSuccess(OriginResponse response) {
                asyncResponse.resume(toResponse(response));
            }

            @Override
            public void onFailure(Throwable t) {
                if (!(t instanceof CancellationException)) {
                    asyncResponse.resume(t);
                }
            }
        }, MoreExecutors.directExecutor());
    }

    private static Response toResponse(OriginResponse originResponse) {
        Response.ResponseBuilder response = Response.status(originResponse.getStatus());
        for (Map.Entry<String, String> header : originResponse.getHeaders().entries()) {
            response.header(header.getKey(), header.getValue());
        }
        return response.entity(originResponse.getBody()).build();
    }

    private static List<String> valuesOf(@Nullable CsvParam param) {
        return param != null ? param.get() : ImmutableList.of();
    }
}
