package com.riskengine.model;

import lombok.Getter;

import java.util.List;

/**
 * A continent: a fixed set of regions granting bonus reinforcements to whoever holds all of them.
 * The owner is derived, recomputed at the start of every turn rather than tracked per capture.
 */
@Getter
public class RegionGroup {

    private final String name;
    private final int bonus;
    private final List<Region> regions;

    private PlayerAccount owner;

    public RegionGroup(String name, int bonus, List<Region> regions) {
        this.name = name;
        this.bonus = bonus;
        this.regions = List.copyOf(regions);
    }

    /**
     * Check if a player controls all regions in this group.
     */
    public boolean isControlledBy(PlayerAccount player) {
        if (regions.isEmpty()) return false;
        return regions.stream().allMatch(r -> r.isOwnedBy(player));
    }

    void recomputeOwner() {
        PlayerAccount candidate = regions.isEmpty() ? null : regions.get(0).getOwner();
        owner = candidate != null && isControlledBy(candidate) ? candidate : null;
    }

    @Override
    public String toString() {
        return name + " (Bonus: " + bonus + ") - " + regions.size() + " regions";
    }
}
