package com.riskengine.config;

import java.util.Map;

/**
 * Root definition of a playable map, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "classic"; the file name is used when absent
 * @param name        human-readable name
 * @param territories regions keyed by name
 * @param continents  region groups keyed by name
 */
public record MapDefinition(
        String id,
        String name,
        Map<String, RegionDefinition> territories,
        Map<String, GroupDefinition> continents
) {

    MapDefinition withId(String newId) {
        return new MapDefinition(newId, name != null ? name : newId, territories, continents);
    }
}
