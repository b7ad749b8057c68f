package com.riskengine.service;

import com.riskengine.config.GameProperties;
import com.riskengine.dto.AttackOutcome;
import com.riskengine.dto.BattleResult;
import com.riskengine.dto.CardSet;
import com.riskengine.dto.GameSummary;
import com.riskengine.exception.InvalidMoveException;
import com.riskengine.model.Card;
import com.riskengine.model.GamePhase;
import com.riskengine.model.GameState;
import com.riskengine.model.GameStatus;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.model.WorldMap;
import com.riskengine.policy.DecisionPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives the round loop: every player on the live roster plays Draft, Attack, Fortify and End
 * in order until one player is left.
 * <p>
 * Each round walks the roster by index. Eliminating a seat before the active one shifts the index
 * down (see {@link GameState#removeFromRoster}), so the walk neither skips nor repeats a player.
 * Policies are asked one move at a time; each proposal is validated, then applied in full before
 * the next question.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnService {

    static final int MIN_CAPTURE_MOVE = 3;

    private final CombatService combatService;
    private final CardService cardService;
    private final ReinforcementService reinforcementService;
    private final WinConditionService winConditionService;
    private final MoveValidator moveValidator;
    private final GameProperties properties;

    /**
     * Play rounds until the game is won or the round limit stops it.
     */
    public GameSummary playGame(GameState state) {
        if (!state.isInProgress()) {
            throw new IllegalStateException("Game is not in progress: " + state.getStatus());
        }

        while (state.isInProgress()) {
            if (winConditionService.checkRoundLimit(state, properties.getMaxRounds())) {
                break;
            }
            playRound(state);
        }
        return summarize(state);
    }

    public void playRound(GameState state) {
        state.startRound();
        log.debug("Round {} starting with {} players", state.getRound(), state.getRoster().size());

        while (state.isInProgress() && state.getActiveIndex() < state.getRoster().size()) {
            playTurn(state, state.getActivePlayer());
            state.setActiveIndex(state.getActiveIndex() + 1);
        }
    }

    public void playTurn(GameState state, PlayerAccount player) {
        state.log("--- Round " + state.getRound() + ": " + player.getName() + "'s turn ---");

        runDraftPhase(state, player);
        boolean earnedCard = runAttackPhase(state, player);
        if (!state.isInProgress()) {
            return;
        }
        runFortifyPhase(state, player);
        endTurn(state, player, earnedCard);
    }

    // ── draft ───────────────────────────────────────────────────────────

    void runDraftPhase(GameState state, PlayerAccount player) {
        state.setPhase(GamePhase.DRAFT);
        state.getMap().recomputeGroupOwners();

        int allowance = reinforcementService.calculateAllowance(state.getMap(), player);
        state.setAllowance(player, allowance);
        state.log("[DRAFT] " + player.getName() + " receives " + allowance + " troops ("
                + state.getMap().countOwnedBy(player) + " regions).");

        runTrades(state, player, false);
        placeAllowance(state, player);
    }

    /**
     * Offer trades while the hand holds a set ({@code forcedOnly}: while the hand is at the forced
     * size). A forced trade the policy never answers validly is made with the best set in hand.
     */
    void runTrades(GameState state, PlayerAccount player, boolean forcedOnly) {
        DecisionPolicy policy = player.getPolicy();
        while (forcedOnly ? cardService.isTradeForced(player) : cardService.hasAnyValidSet(player.getHand())) {
            boolean forced = cardService.isTradeForced(player);
            Optional<CardSet> choice = promptUntilValid(state, player,
                    () -> policy.decideTrade(state, player, forced),
                    proposal -> moveValidator.validateTrade(state, player, proposal, forced));

            if (choice == null) {
                if (!forced) {
                    return;
                }
                choice = Optional.of(cardService.findBestTradeableSet(player.getHand())
                        .orElseThrow(() -> new IllegalStateException("Forced trade without a set in hand")));
                log.warn("{} did not pick a set; trading {}", player.getName(), choice.get().getCards());
                state.log(player.getName() + " must trade; best set chosen automatically.");
            }
            if (choice.isEmpty()) {
                return;
            }
            cardService.applyTradeIn(state, player, choice.get().getCards());
        }
    }

    void placeAllowance(GameState state, PlayerAccount player) {
        WorldMap map = state.getMap();
        while (player.getAllowance() > 0) {
            int remaining = player.getAllowance();
            ValidatedMove move = promptUntilValid(state, player,
                    () -> player.getPolicy().decideDraft(state, player, remaining),
                    proposal -> moveValidator.validateDraft(state, player, proposal));

            if (move == null) {
                log.warn("{} forfeits {} unplaced troops", player.getName(), remaining);
                state.log(player.getName() + " forfeits " + remaining + " troops.");
                state.setAllowance(player, 0);
                return;
            }

            map.reinforce(move.to(), move.troops());
            state.spendAllowance(player, move.troops());
            state.log("Placed " + move.troops() + " troops in " + move.to().getName() + ".");
        }
    }

    // ── attack ──────────────────────────────────────────────────────────

    /**
     * @return true if at least one region was captured, earning the end-of-turn card
     */
    boolean runAttackPhase(GameState state, PlayerAccount player) {
        state.setPhase(GamePhase.ATTACK);
        boolean captured = false;

        while (state.isInProgress()) {
            ValidatedMove move = promptUntilValid(state, player,
                    () -> player.getPolicy().decideAttack(state, player),
                    proposal -> moveValidator.validateAttack(state, player, proposal));
            if (move == null || move.end()) {
                break;
            }
            captured |= executeAttack(state, player, move).isCaptured();
        }
        return captured;
    }

    AttackOutcome executeAttack(GameState state, PlayerAccount player, ValidatedMove move) {
        WorldMap map = state.getMap();
        Region from = move.from();
        Region to = move.to();
        PlayerAccount defender = to.getOwner();
        int defending = to.getGarrison();

        BattleResult battle = combatService.resolveBattle(move.troops(), defending);
        int attackerLosses = move.troops() - battle.getRemainingAttackers();
        int defenderLosses = defending - battle.getRemainingDefenders();
        map.removeTroops(from, attackerLosses);
        map.removeTroops(to, defenderLosses);

        state.log(player.getName() + " attacked " + to.getName() + " from " + from.getName() + " with "
                + move.troops() + " troops: lost " + attackerLosses + ", " + defender.getName()
                + " lost " + defenderLosses + ".");

        AttackOutcome.AttackOutcomeBuilder outcome = AttackOutcome.builder()
                .fromRegion(from.getName())
                .toRegion(to.getName())
                .troopsCommitted(move.troops())
                .attackerLosses(attackerLosses)
                .defenderLosses(defenderLosses);

        if (to.getGarrison() > 0) {
            return outcome.build();
        }

        map.transferOwnership(to, player);
        state.log(player.getName() + " captured " + to.getName() + " from " + defender.getName() + ".");
        outcome.captured(true);

        if (winConditionService.eliminateIfDefeated(state, defender, player)) {
            outcome.eliminatedPlayer(defender.getName());
        }
        if (winConditionService.checkVictory(state)) {
            return outcome.troopsMovedIn(occupy(state, player, from, to)).gameOver(true).build();
        }

        // Cards taken from an eliminated player can push the hand over the limit. The trade happens
        // before the move in; its troops are drafted once the captured region is garrisoned.
        if (cardService.isTradeForced(player)) {
            runTrades(state, player, true);
        }
        outcome.troopsMovedIn(occupy(state, player, from, to));
        if (player.getAllowance() > 0) {
            placeAllowance(state, player);
        }
        return outcome.build();
    }

    /**
     * Mandatory move into a captured region: at least {@value #MIN_CAPTURE_MOVE} troops unless
     * no more than that can leave, in which case everything that can leave moves without asking.
     */
    int occupy(GameState state, PlayerAccount player, Region from, Region to) {
        int available = from.getGarrison() - 1;
        int amount;
        if (available <= MIN_CAPTURE_MOVE) {
            amount = available;
        } else {
            Integer chosen = promptUntilValid(state, player,
                    () -> player.getPolicy().decideCaptureMove(state, player, from, to, MIN_CAPTURE_MOVE, available),
                    proposal -> moveValidator.validateCaptureMove(state, player, proposal, MIN_CAPTURE_MOVE, available));
            amount = chosen != null ? chosen : MIN_CAPTURE_MOVE;
        }

        state.getMap().moveTroops(from, to, amount);
        state.log("Moved " + amount + " troops from " + from.getName() + " into " + to.getName() + ".");
        return amount;
    }

    // ── fortify / end ───────────────────────────────────────────────────

    void runFortifyPhase(GameState state, PlayerAccount player) {
        state.setPhase(GamePhase.FORTIFY);
        ValidatedMove move = promptUntilValid(state, player,
                () -> player.getPolicy().decideFortify(state, player),
                proposal -> moveValidator.validateFortify(state, player, proposal));
        if (move == null || move.end()) {
            return;
        }

        state.getMap().moveTroops(move.from(), move.to(), move.troops());
        state.log("Fortified " + move.to().getName() + " with " + move.troops() + " troops from "
                + move.from().getName() + ".");
    }

    void endTurn(GameState state, PlayerAccount player, boolean earnedCard) {
        state.setPhase(GamePhase.END);
        for (PlayerAccount p : state.getRoster()) {
            state.refreshGarrison(p);
        }

        if (earnedCard) {
            Card card = state.getDeck().draw();
            state.dealCards(player, List.of(card));
            state.log(player.getName() + " drew a card.");
        }
        state.log(player.getName() + " ends with " + player.getTotalGarrison() + " troops.");
    }

    // ── helpers ─────────────────────────────────────────────────────────

    /**
     * Ask the policy until its answer validates, at most {@code max-invalid-moves} times.
     *
     * @return the validated answer, or null once the attempts are used up
     */
    private <P, V> V promptUntilValid(GameState state, PlayerAccount player,
                                      Supplier<P> decision, Function<P, V> validation) {
        int attempts = Math.max(1, properties.getMaxInvalidMoves());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            P proposal = decision.get();
            try {
                return validation.apply(proposal);
            } catch (InvalidMoveException e) {
                log.warn("Rejected {} move by {} (attempt {}/{}): {}",
                        e.getPhase(), e.getPlayerName(), attempt, attempts, e.getMessage());
                state.log("Invalid move by " + player.getName() + ": " + e.getMessage());
            }
        }
        return null;
    }

    private GameSummary summarize(GameState state) {
        return GameSummary.builder()
                .status(state.getStatus())
                .winner(state.getStatus() == GameStatus.FINISHED ? state.getWinner().getName() : null)
                .rounds(state.getRound())
                .eliminationOrder(state.getEliminated().stream().map(PlayerAccount::getName).toList())
                .eventCount(state.getEventLog().size())
                .build();
    }
}
