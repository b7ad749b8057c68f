package com.riskengine.service;

import com.riskengine.model.MapView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.RegionGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service responsible for the draft allowance.
 */
@Service
@Slf4j
public class ReinforcementService {

    static final int MINIMUM_ALLOWANCE = 3;
    static final int REGIONS_PER_TROOP = 3;

    /**
     * Regions / 3, minimum 3, plus the bonus of every group the player owns. Group owners must
     * have been recomputed for the current turn.
     */
    public int calculateAllowance(MapView map, PlayerAccount player) {
        if (player == null) return 0;

        int regions = map.countOwnedBy(player);
        int allowance = Math.max(MINIMUM_ALLOWANCE, regions / REGIONS_PER_TROOP);

        for (RegionGroup group : map.getGroups()) {
            if (group.getOwner() == player) {
                allowance += group.getBonus();
            }
        }

        log.debug("{} holds {} regions, allowance {}", player.getName(), regions, allowance);
        return allowance;
    }
}
