package com.qcache.api;

import com.qcache.core.Cache;
import com.qcache.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dış istemcilerin HTTP üzerinden önbelleği okuması ve güncellemesi için
 * sağlanan REST kaynağı. Okumalar isabet/ıskalama sayaçlarını günceller.
 */
@Path("/cache")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CacheResource {

    private final Cache<String, String> cache;
    private final MetricsRegistry metrics;

    @Inject
    public CacheResource(Cache<String, String> cache, MetricsRegistry metrics) {
        this.cache = cache;
        this.metrics = metrics;
    }

    @GET
    public CacheListing list() {
        List<String> keys = cache.keys();
        return new CacheListing(keys.size(), keys);
    }

    @DELETE
    public Response purge() {
        cache.purge();
        return Response.noContent().build();
    }

    @GET
    @Path("stats")
    public Map<String, Long> stats() {
        return metrics.snapshot();
    }

    @GET
    @Path("{key}")
    public Response get(@PathParam("key") String key) {
        return lookup(key, cache.get(key));
    }

    @GET
    @Path("{key}/peek")
    public Response peek(@PathParam("key") String key) {
        return lookup(key, cache.peek(key));
    }

    @PUT
    @Path("{key}")
    public Response put(@PathParam("key") String key, CacheWriteRequest request) {
        if (request == null || request.value() == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("value must be provided"))
                    .build();
        }
        cache.add(key, request.value());
        return Response.noContent().build();
    }

    @DELETE
    @Path("{key}")
    public Response delete(@PathParam("key") String key) {
        if (!cache.remove(key)) {
            return notFound();
        }
        return Response.noContent().build();
    }

    private Response lookup(String key, Optional<String> value) {
        if (value.isEmpty()) {
            metrics.counter(MetricsRegistry.MISSES).inc();
            return notFound();
        }
        metrics.counter(MetricsRegistry.HITS).inc();
        return Response.ok(new CacheEntry(key, value.get())).build();
    }

    private static Response notFound() {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse("Key not found"))
                .build();
    }

    public record CacheEntry(String key, String value) {}

    public record CacheListing(int size, List<String> keys) {}

    public record ErrorResponse(String message) {}

    public record CacheWriteRequest(String value) {}
}
