package kinet.newsfeed.profile;

import java.time.Instant;

public record CachedProfile(String domain, String baseUrl, boolean requiresJs, String strategy, Instant cachedAt) {}
