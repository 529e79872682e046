package dev.seriescache.client;

import dev.seriescache.series.ResponseEnvelope;

/**
 * @param mode     how the query was served
 * @param response the assembled response
 */
public record QueryOutcome(CacheMode mode, ResponseEnvelope response) {
}
