package com.riskengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskengine.exception.MapLoadException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available map definitions at startup.
 * <p>
 * Maps are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath*:maps/*.json} – built-in maps shipped with the engine</li>
 *   <li>External folder: {@code ./maps/} in the working directory – custom maps</li>
 * </ol>
 * If a custom map has the same {@code id} as a built-in map, the custom one wins.
 * Only the JSON is read here; {@link WorldMapFactory} resolves the names.
 */
@Component
@Slf4j
public class MapLoader {

    private final ObjectMapper objectMapper;
    private final Path externalDir;

    /** All loaded maps keyed by their id. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    @Autowired
    public MapLoader(ObjectMapper objectMapper) {
        this(objectMapper, Paths.get("maps"));
    }

    MapLoader(ObjectMapper objectMapper, Path externalDir) {
        this.objectMapper = objectMapper;
        this.externalDir = externalDir;
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No map definitions found! No game can be set up without at least one map.");
        } else {
            log.info("Loaded {} map(s): {}", maps.size(), maps.keySet());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded map definition.
     */
    public List<MapDefinition> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * Get a specific map by its id.
     *
     * @throws IllegalArgumentException if the map id is unknown
     */
    public MapDefinition getMap(String mapId) {
        MapDefinition map = maps.get(mapId);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + mapId
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    /**
     * Read one map file outside the scanned locations.
     *
     * @throws MapLoadException if the file cannot be read or is not a map document
     */
    public MapDefinition load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, stem(path.getFileName().toString()));
        } catch (IOException e) {
            throw new MapLoadException("Failed to read map file " + path, e);
        }
    }

    // ── classpath maps ──────────────────────────────────────────────────

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath*:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    MapDefinition map = read(is, stem(resource.getFilename()));
                    maps.put(map.id(), map);
                    log.info("Loaded built-in map '{}' ({}) from classpath", map.name(), map.id());
                } catch (IOException | MapLoadException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    // ── external maps (./maps/ folder) ──────────────────────────────────

    private void loadExternalMaps() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external maps directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory", e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try {
            MapDefinition map = load(path);
            maps.put(map.id(), map);
            log.info("Loaded custom map '{}' ({}) from {}", map.name(), map.id(), path);
        } catch (MapLoadException e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }

    private MapDefinition read(InputStream is, String fallbackId) throws IOException {
        MapDefinition map = objectMapper.readValue(is, MapDefinition.class);
        if (map == null || map.territories() == null || map.continents() == null) {
            throw new MapLoadException("Map '" + fallbackId + "' needs both 'territories' and 'continents'");
        }
        return map.id() == null || map.id().isBlank() ? map.withId(fallbackId) : map;
    }

    private static String stem(String filename) {
        if (filename == null) return "unnamed";
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
