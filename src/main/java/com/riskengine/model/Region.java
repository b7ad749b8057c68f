package com.riskengine.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents a region (territory) of the world map.
 * <p>
 * Regions are created once by the map factory and never destroyed. Ownership and garrison
 * change only through {@link WorldMap}, which is the single writer for both.
 */
@Getter
public class Region {

    private final String name;
    private final String groupName;
    private final Set<Region> neighbors = new LinkedHashSet<>();

    private PlayerAccount owner;
    private int garrison;

    public Region(String name, String groupName) {
        this.name = name;
        this.groupName = groupName;
    }

    public Set<Region> getNeighbors() {
        return Collections.unmodifiableSet(neighbors);
    }

    public boolean isOwnedBy(PlayerAccount player) {
        return owner != null && owner == player;
    }

    public boolean isNeighborOf(Region other) {
        return neighbors.contains(other);
    }

    /**
     * A region can launch an attack only if it can leave one troop behind.
     */
    public boolean canAttackFrom() {
        return garrison > 1;
    }

    void addNeighbor(Region neighbor) {
        neighbors.add(neighbor);
    }

    void setOwner(PlayerAccount owner) {
        this.owner = owner;
    }

    void setGarrison(int garrison) {
        this.garrison = garrison;
    }

    @Override
    public String toString() {
        String ownerName = owner != null ? owner.getName() : "nobody";
        return name + " (" + groupName + ") - Owner: " + ownerName + ", Armies: " + garrison;
    }
}
