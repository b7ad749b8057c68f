package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.MapView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.service.CardService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Greedy policy - no lookahead, always concentrates on the strongest front.
 * <p>
 * Ties between regions of equal garrison go to the one listed first on the map.
 */
@Component
@RequiredArgsConstructor
public class GreedyPolicy implements DecisionPolicy {

    private final CardService cardService;

    @Override
    public PolicyType getType() {
        return PolicyType.GREEDY;
    }

    /**
     * Everything onto the strongest region that can attack, or the strongest region if none can.
     */
    @Override
    public PolicyMove decideDraft(GameView game, PlayerAccount self, int allowance) {
        MapView map = game.getMap();
        List<Region> owned = map.regionsOwnedBy(self);

        Region target = strongest(owned, map::hasAttackableNeighbor);
        if (target == null) {
            target = strongest(owned, r -> true);
        }
        if (target == null) {
            return null;
        }
        return PolicyMove.draft(target.getName(), allowance);
    }

    /**
     * Strongest attacker (garrison above 2, with an enemy neighbor) against its weakest neighbor,
     * as long as that neighbor holds fewer than the troops being committed.
     */
    @Override
    public PolicyMove decideAttack(GameView game, PlayerAccount self) {
        MapView map = game.getMap();
        Region attacker = strongest(map.regionsOwnedBy(self),
                r -> r.getGarrison() > 2 && map.hasAttackableNeighbor(r));
        if (attacker == null) {
            return PolicyMove.endAttack();
        }

        int committed = attacker.getGarrison() - 1;
        Region target = weakest(map.attackableNeighbors(attacker), r -> r.getGarrison() < committed);
        if (target == null) {
            return PolicyMove.endAttack();
        }
        return PolicyMove.attack(attacker.getName(), target.getName(), committed);
    }

    /**
     * Moves the whole surplus of the strongest interior region to the strongest connected
     * region that can still attack.
     */
    @Override
    public PolicyMove decideFortify(GameView game, PlayerAccount self) {
        MapView map = game.getMap();
        Region source = strongest(map.regionsOwnedBy(self), r -> !map.hasAttackableNeighbor(r));
        if (source == null || source.getGarrison() <= 1) {
            return PolicyMove.skipFortify();
        }

        Region destination = strongest(map.reachableThroughOwned(source), map::hasAttackableNeighbor);
        if (destination == null || destination == source) {
            return PolicyMove.skipFortify();
        }
        return PolicyMove.fortify(source.getName(), destination.getName(), source.getGarrison() - 1);
    }

    @Override
    public int decideCaptureMove(GameView game, PlayerAccount self, Region from, Region to, int minimum, int maximum) {
        return maximum;
    }

    @Override
    public Optional<List<Card>> decideTrade(GameView game, PlayerAccount self, boolean forced) {
        return cardService.findBestTradeableSet(self.getHand()).map(set -> set.getCards());
    }

    private static Region strongest(Collection<Region> regions, Predicate<Region> eligible) {
        Region best = null;
        for (Region region : regions) {
            if (eligible.test(region) && (best == null || region.getGarrison() > best.getGarrison())) {
                best = region;
            }
        }
        return best;
    }

    private static Region weakest(Collection<Region> regions, Predicate<Region> eligible) {
        Region best = null;
        for (Region region : regions) {
            if (eligible.test(region) && (best == null || region.getGarrison() < best.getGarrison())) {
                best = region;
            }
        }
        return best;
    }
}
