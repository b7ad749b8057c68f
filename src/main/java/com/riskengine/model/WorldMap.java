package com.riskengine.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The region graph plus its groups. Owns all writes to region ownership and garrisons;
 * the turn engine is the only caller of the mutating methods.
 */
public class WorldMap implements MapView {

    private final Map<String, Region> regionsByName;
    private final List<RegionGroup> groups;

    private WorldMap(Map<String, Region> regionsByName, List<RegionGroup> groups) {
        this.regionsByName = regionsByName;
        this.groups = List.copyOf(groups);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── queries ─────────────────────────────────────────────────────────

    @Override
    public List<Region> getRegions() {
        return List.copyOf(regionsByName.values());
    }

    @Override
    public List<RegionGroup> getGroups() {
        return groups;
    }

    @Override
    public Optional<Region> findRegion(String name) {
        return Optional.ofNullable(name == null ? null : regionsByName.get(name));
    }

    @Override
    public List<Region> regionsOwnedBy(PlayerAccount player) {
        return regionsByName.values().stream()
                .filter(r -> r.isOwnedBy(player))
                .toList();
    }

    @Override
    public int countOwnedBy(PlayerAccount player) {
        return (int) regionsByName.values().stream()
                .filter(r -> r.isOwnedBy(player))
                .count();
    }

    @Override
    public int totalGarrisonOf(PlayerAccount player) {
        return regionsByName.values().stream()
                .filter(r -> r.isOwnedBy(player))
                .mapToInt(Region::getGarrison)
                .sum();
    }

    @Override
    public List<RegionGroup> groupsControlledBy(PlayerAccount player) {
        return groups.stream()
                .filter(g -> g.isControlledBy(player))
                .toList();
    }

    @Override
    public List<Region> attackableNeighbors(Region region) {
        PlayerAccount owner = region.getOwner();
        return region.getNeighbors().stream()
                .filter(n -> n.getOwner() != null && n.getOwner() != owner)
                .toList();
    }

    @Override
    public boolean hasAttackableNeighbor(Region region) {
        return !attackableNeighbors(region).isEmpty();
    }

    @Override
    public Set<Region> reachableThroughOwned(Region from) {
        PlayerAccount owner = from.getOwner();
        Set<Region> visited = new LinkedHashSet<>();
        if (owner == null) return visited;

        Deque<Region> frontier = new ArrayDeque<>();
        frontier.add(from);
        visited.add(from);
        while (!frontier.isEmpty()) {
            for (Region next : frontier.poll().getNeighbors()) {
                if (next.isOwnedBy(owner) && visited.add(next)) {
                    frontier.add(next);
                }
            }
        }
        visited.remove(from);
        return visited;
    }

    // ── mutations ───────────────────────────────────────────────────────

    /**
     * Setup-time assignment of an unowned region.
     */
    public void assign(Region region, PlayerAccount owner, int garrison) {
        region.setOwner(owner);
        region.setGarrison(garrison);
    }

    /**
     * Hand a captured region to its new owner. The garrison is left as is (zero after combat)
     * until the post-capture move fills it.
     */
    public void transferOwnership(Region region, PlayerAccount newOwner) {
        region.setOwner(newOwner);
    }

    public void reinforce(Region region, int amount) {
        region.setGarrison(region.getGarrison() + amount);
    }

    public void removeTroops(Region region, int amount) {
        region.setGarrison(region.getGarrison() - amount);
    }

    /**
     * Troop-move primitive. Performs no validation; callers check ownership and amounts first.
     */
    public void moveTroops(Region from, Region to, int amount) {
        from.setGarrison(from.getGarrison() - amount);
        to.setGarrison(to.getGarrison() + amount);
    }

    public void recomputeGroupOwners() {
        groups.forEach(RegionGroup::recomputeOwner);
    }

    /**
     * Assembles a map from names. Reference checking is the caller's job; the builder
     * only refuses names it has never seen.
     */
    public static final class Builder {

        private final Map<String, Region> regions = new LinkedHashMap<>();
        private final List<RegionGroup> groups = new ArrayList<>();

        private Builder() {
        }

        public Builder region(String name, String groupName) {
            if (regions.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate region: " + name);
            }
            regions.put(name, new Region(name, groupName));
            return this;
        }

        /**
         * Declares {@code to} reachable from {@code from}. Adjacency is directed as declared.
         */
        public Builder connect(String from, String to) {
            require(from).addNeighbor(require(to));
            return this;
        }

        public Builder connectBoth(String a, String b) {
            return connect(a, b).connect(b, a);
        }

        public Builder group(String name, int bonus, List<String> members) {
            List<Region> resolved = new ArrayList<>();
            for (String member : members) {
                resolved.add(require(member));
            }
            groups.add(new RegionGroup(name, bonus, resolved));
            return this;
        }

        public boolean hasRegion(String name) {
            return regions.containsKey(name);
        }

        public WorldMap build() {
            return new WorldMap(Collections.unmodifiableMap(new LinkedHashMap<>(regions)), groups);
        }

        private Region require(String name) {
            Region region = regions.get(name);
            if (region == null) {
                throw new IllegalArgumentException("Unknown region: " + name);
            }
            return region;
        }
    }
}
