package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;

import java.util.List;
import java.util.Optional;

/**
 * Decides moves for one player. Implementations only read the game; the turn engine validates
 * and applies whatever they propose, and calls again with the updated state after every
 * applied move.
 */
public interface DecisionPolicy {

    /**
     * Pick an owned region and how many of the remaining {@code allowance} troops to place there.
     */
    PolicyMove decideDraft(GameView game, PlayerAccount self, int allowance);

    /**
     * Propose the next attack, or {@link PolicyMove#endAttack()} to end the attack phase.
     */
    PolicyMove decideAttack(GameView game, PlayerAccount self);

    /**
     * Propose the single voluntary regroup move, or {@link PolicyMove#skipFortify()}.
     */
    PolicyMove decideFortify(GameView game, PlayerAccount self);

    /**
     * How many troops to move into a region just captured, within {@code [minimum, maximum]}.
     */
    int decideCaptureMove(GameView game, PlayerAccount self, Region from, Region to, int minimum, int maximum);

    /**
     * Cards to trade, in selection order, or empty to decline. Declining is only legal when
     * {@code forced} is false.
     */
    Optional<List<Card>> decideTrade(GameView game, PlayerAccount self, boolean forced);

    PolicyType getType();
}
