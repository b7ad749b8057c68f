package com.riskengine.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the world map handed to decision policies.
 * Every owner-derived answer is computed from the regions themselves.
 */
public interface MapView {

    List<Region> getRegions();

    List<RegionGroup> getGroups();

    Optional<Region> findRegion(String name);

    List<Region> regionsOwnedBy(PlayerAccount player);

    int countOwnedBy(PlayerAccount player);

    int totalGarrisonOf(PlayerAccount player);

    List<RegionGroup> groupsControlledBy(PlayerAccount player);

    /**
     * Neighbors of {@code region} held by a player other than its owner.
     */
    List<Region> attackableNeighbors(Region region);

    boolean hasAttackableNeighbor(Region region);

    /**
     * Regions reachable from {@code from} by stepping only through regions of the same owner,
     * {@code from} itself excluded.
     */
    Set<Region> reachableThroughOwned(Region from);
}
