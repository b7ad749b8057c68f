package com.riskengine.config;

import java.util.List;

/**
 * A region inside a {@link MapDefinition}.
 *
 * @param continent name of the group the region belongs to
 * @param neighbors names of the regions it borders
 */
public record RegionDefinition(
        String continent,
        List<String> neighbors
) {}
