package com.riskengine.config;

import com.riskengine.exception.MapLoadException;
import com.riskengine.model.Region;
import com.riskengine.model.WorldMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link MapDefinition} into a live {@link WorldMap}. Every name in the document must
 * resolve; all problems are collected and reported together in one {@link MapLoadException}.
 */
@Component
@Slf4j
public class WorldMapFactory {

    public WorldMap build(MapDefinition definition) {
        Map<String, RegionDefinition> territories = definition.territories();
        Map<String, GroupDefinition> continents = definition.continents();
        List<String> errors = new ArrayList<>();

        territories.forEach((name, region) -> {
            if (region.continent() == null || !continents.containsKey(region.continent())) {
                errors.add("Region '" + name + "' names unknown group '" + region.continent() + "'");
            }
            for (String neighbor : neighborsOf(region)) {
                if (!territories.containsKey(neighbor)) {
                    errors.add("Region '" + name + "' names unknown neighbor '" + neighbor + "'");
                }
            }
        });

        continents.forEach((name, group) -> {
            for (String member : membersOf(group)) {
                RegionDefinition region = territories.get(member);
                if (region == null) {
                    errors.add("Group '" + name + "' names unknown region '" + member + "'");
                } else if (!name.equals(region.continent())) {
                    errors.add("Group '" + name + "' lists '" + member + "', which belongs to '"
                            + region.continent() + "'");
                }
            }
        });

        if (!errors.isEmpty()) {
            throw new MapLoadException("Map '" + definition.id() + "' has " + errors.size()
                    + " unresolved reference(s): " + String.join("; ", errors));
        }

        WorldMap.Builder builder = WorldMap.builder();
        territories.forEach((name, region) -> builder.region(name, region.continent()));
        territories.forEach((name, region) -> neighborsOf(region).forEach(n -> builder.connect(name, n)));
        continents.forEach((name, group) -> builder.group(name, group.bonus(), membersOf(group)));
        WorldMap map = builder.build();

        warnAboutOneWayBorders(definition.id(), map);
        log.info("Built map '{}': {} regions, {} groups", definition.id(),
                map.getRegions().size(), map.getGroups().size());
        return map;
    }

    private void warnAboutOneWayBorders(String mapId, WorldMap map) {
        for (Region region : map.getRegions()) {
            for (Region neighbor : region.getNeighbors()) {
                if (!neighbor.isNeighborOf(region)) {
                    log.warn("Map '{}': {} borders {} but not the other way round",
                            mapId, region.getName(), neighbor.getName());
                }
            }
        }
    }

    private static List<String> neighborsOf(RegionDefinition region) {
        return region.neighbors() != null ? region.neighbors() : List.of();
    }

    private static List<String> membersOf(GroupDefinition group) {
        return group.territories() != null ? group.territories() : List.of();
    }
}
