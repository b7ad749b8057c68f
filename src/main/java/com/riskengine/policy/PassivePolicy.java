package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.service.CardService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Passive policy - drafts everything onto a random region and never attacks or fortifies.
 */
@Component
@RequiredArgsConstructor
public class PassivePolicy implements DecisionPolicy {

    private final Random random;
    private final CardService cardService;

    @Override
    public PolicyType getType() {
        return PolicyType.PASSIVE;
    }

    @Override
    public PolicyMove decideDraft(GameView game, PlayerAccount self, int allowance) {
        List<Region> owned = game.getMap().regionsOwnedBy(self);
        if (owned.isEmpty()) {
            return null;
        }
        Region target = owned.get(random.nextInt(owned.size()));
        return PolicyMove.draft(target.getName(), allowance);
    }

    @Override
    public PolicyMove decideAttack(GameView game, PlayerAccount self) {
        return PolicyMove.endAttack();
    }

    @Override
    public PolicyMove decideFortify(GameView game, PlayerAccount self) {
        return PolicyMove.skipFortify();
    }

    @Override
    public int decideCaptureMove(GameView game, PlayerAccount self, Region from, Region to, int minimum, int maximum) {
        return minimum;
    }

    @Override
    public Optional<List<Card>> decideTrade(GameView game, PlayerAccount self, boolean forced) {
        if (!forced) {
            return Optional.empty();
        }
        return cardService.findBestTradeableSet(self.getHand()).map(set -> set.getCards());
    }
}
