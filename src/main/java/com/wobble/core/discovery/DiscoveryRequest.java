package com.wobble.core.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * Where and what to discover.
 *
 * @param searchRoots directories to walk
 * @param pattern     file-name glob for test sources
 * @param filter      selection applied after discovery
 */
public record DiscoveryRequest(List<Path> searchRoots, String pattern, DiscoveryFilter filter) {

    public DiscoveryRequest {
        if (searchRoots == null || searchRoots.isEmpty()) {
            throw new IllegalArgumentException("At least one search root is required");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("A file pattern is required");
        }
        searchRoots = List.copyOf(searchRoots);
        filter = filter == null ? DiscoveryFilter.all() : filter;
    }
}
