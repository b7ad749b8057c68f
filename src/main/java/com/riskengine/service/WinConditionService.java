package com.riskengine.service;

import com.riskengine.model.Card;
import com.riskengine.model.GameState;
import com.riskengine.model.GameStatus;
import com.riskengine.model.GamePhase;
import com.riskengine.model.PlayerAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for elimination and the end of the game.
 */
@Service
@Slf4j
public class WinConditionService {

    /**
     * Remove {@code defender} from the roster if they hold no region, handing their cards to
     * {@code eliminator}. A player already off the roster is left alone.
     *
     * @return true if the player was eliminated by this call
     */
    public boolean eliminateIfDefeated(GameState state, PlayerAccount defender, PlayerAccount eliminator) {
        if (defender == null || state.getMap().countOwnedBy(defender) > 0) {
            return false;
        }
        if (!state.removeFromRoster(defender)) {
            return false;
        }

        List<Card> cards = state.transferHand(defender, eliminator);
        state.refreshGarrison(defender);

        state.log(defender.getName() + " was eliminated by " + eliminator.getName()
                + ", who takes " + cards.size() + " cards.");
        log.info("{} eliminated by {} in round {}", defender.getName(), eliminator.getName(), state.getRound());
        return true;
    }

    /**
     * Last player standing wins.
     */
    public boolean checkVictory(GameState state) {
        if (state.getRoster().size() != 1) {
            return false;
        }
        PlayerAccount winner = state.getRoster().get(0);
        state.finish(winner);
        state.log(winner.getName() + " controls every region and wins the game!");
        log.info("Game won by {} in round {}", winner.getName(), state.getRound());
        return true;
    }

    /**
     * Stop a game that has run for {@code maxRounds} rounds. Zero disables the limit.
     */
    public boolean checkRoundLimit(GameState state, int maxRounds) {
        if (maxRounds <= 0 || state.getRound() < maxRounds) {
            return false;
        }
        state.setStatus(GameStatus.ABANDONED);
        state.setPhase(GamePhase.GAME_OVER);
        state.log("Round limit of " + maxRounds + " reached without a winner.");
        log.info("Game abandoned after {} rounds with {} players left", state.getRound(), state.getRoster().size());
        return true;
    }
}
