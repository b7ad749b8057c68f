package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.MapView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.service.CardService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Random policy - makes random decisions.
 */
@Component
@RequiredArgsConstructor
public class RandomPolicy implements DecisionPolicy {

    private final Random random;
    private final CardService cardService;

    @Override
    public PolicyType getType() {
        return PolicyType.RANDOM;
    }

    @Override
    public PolicyMove decideDraft(GameView game, PlayerAccount self, int allowance) {
        List<Region> owned = game.getMap().regionsOwnedBy(self);
        if (owned.isEmpty()) {
            return null;
        }

        Region target = owned.get(random.nextInt(owned.size()));
        return PolicyMove.draft(target.getName(), random.nextInt(allowance) + 1);
    }

    @Override
    public PolicyMove decideAttack(GameView game, PlayerAccount self) {
        // 50% chance to attack
        if (random.nextBoolean()) {
            return PolicyMove.endAttack();
        }

        MapView map = game.getMap();
        List<Region> attackCapable = map.regionsOwnedBy(self).stream()
                .filter(Region::canAttackFrom)
                .filter(map::hasAttackableNeighbor)
                .toList();
        if (attackCapable.isEmpty()) {
            return PolicyMove.endAttack();
        }

        Region from = attackCapable.get(random.nextInt(attackCapable.size()));
        List<Region> targets = map.attackableNeighbors(from);
        Region to = targets.get(random.nextInt(targets.size()));
        int troops = Math.min(3, from.getGarrison() - 1);
        return PolicyMove.attack(from.getName(), to.getName(), troops);
    }

    @Override
    public PolicyMove decideFortify(GameView game, PlayerAccount self) {
        // Rarely fortifies
        if (random.nextInt(3) != 0) {
            return PolicyMove.skipFortify();
        }

        MapView map = game.getMap();
        List<Region> canMove = map.regionsOwnedBy(self).stream()
                .filter(r -> r.getGarrison() > 1)
                .filter(r -> !map.reachableThroughOwned(r).isEmpty())
                .toList();
        if (canMove.isEmpty()) {
            return PolicyMove.skipFortify();
        }

        Region from = canMove.get(random.nextInt(canMove.size()));
        List<Region> destinations = new ArrayList<>(map.reachableThroughOwned(from));
        Region to = destinations.get(random.nextInt(destinations.size()));
        int troops = random.nextInt(from.getGarrison() - 1) + 1;
        return PolicyMove.fortify(from.getName(), to.getName(), troops);
    }

    @Override
    public int decideCaptureMove(GameView game, PlayerAccount self, Region from, Region to, int minimum, int maximum) {
        return minimum + random.nextInt(maximum - minimum + 1);
    }

    @Override
    public Optional<List<Card>> decideTrade(GameView game, PlayerAccount self, boolean forced) {
        return cardService.findBestTradeableSet(self.getHand()).map(set -> set.getCards());
    }
}
