package com.riskengine.service;

import com.riskengine.dto.CardSet;
import com.riskengine.exception.InvalidMoveException;
import com.riskengine.model.Card;
import com.riskengine.model.GameState;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.policy.PolicyMove;
import com.riskengine.policy.PolicyMove.MoveType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Checks proposed moves against the live game before anything is applied.
 * Every rejection is an {@link InvalidMoveException}; nothing here mutates state.
 */
@Component
@RequiredArgsConstructor
public class MoveValidator {

    private final CardService cardService;

    public ValidatedMove validateDraft(GameState state, PlayerAccount player, PolicyMove move) {
        if (move == null || move.getType() != MoveType.DRAFT) {
            throw invalid(state, player, "Expected a draft move, got " + move);
        }
        Region region = resolve(state, player, move.getToRegion());
        if (!region.isOwnedBy(player)) {
            throw invalid(state, player, "You don't own " + region.getName());
        }
        if (move.getTroops() < 1 || move.getTroops() > player.getAllowance()) {
            throw invalid(state, player, "Cannot place " + move.getTroops() + " troops with "
                    + player.getAllowance() + " remaining");
        }
        return new ValidatedMove(null, region, move.getTroops(), false);
    }

    public ValidatedMove validateAttack(GameState state, PlayerAccount player, PolicyMove move) {
        if (move == null || move.getType() == MoveType.END_ATTACK) {
            return ValidatedMove.endPhase();
        }
        if (move.getType() != MoveType.ATTACK) {
            throw invalid(state, player, "Expected an attack, got " + move);
        }

        Region from = resolve(state, player, move.getFromRegion());
        Region to = resolve(state, player, move.getToRegion());

        if (!from.isOwnedBy(player)) {
            throw invalid(state, player, "You don't own the attacking region " + from.getName());
        }
        if (!from.canAttackFrom()) {
            throw invalid(state, player, from.getName() + " needs at least 2 troops to attack");
        }
        if (to.getOwner() == null || to.isOwnedBy(player)) {
            throw invalid(state, player, "Cannot attack " + to.getName() + ": not an enemy region");
        }
        if (!from.isNeighborOf(to)) {
            throw invalid(state, player, from.getName() + " and " + to.getName() + " are not adjacent");
        }
        if (move.getTroops() < 1 || move.getTroops() > from.getGarrison() - 1) {
            throw invalid(state, player, "Invalid number of attacking troops: " + move.getTroops());
        }
        return new ValidatedMove(from, to, move.getTroops(), false);
    }

    public ValidatedMove validateFortify(GameState state, PlayerAccount player, PolicyMove move) {
        if (move == null || move.getType() == MoveType.SKIP_FORTIFY) {
            return ValidatedMove.endPhase();
        }
        if (move.getType() != MoveType.FORTIFY) {
            throw invalid(state, player, "Expected a fortify move, got " + move);
        }

        Region from = resolve(state, player, move.getFromRegion());
        Region to = resolve(state, player, move.getToRegion());

        if (!from.isOwnedBy(player) || !to.isOwnedBy(player)) {
            throw invalid(state, player, "You must own both " + from.getName() + " and " + to.getName());
        }
        if (from == to) {
            throw invalid(state, player, "Source and destination are both " + from.getName());
        }
        if (!state.getMap().reachableThroughOwned(from).contains(to)) {
            throw invalid(state, player, to.getName() + " is not connected to " + from.getName()
                    + " through your regions");
        }
        if (move.getTroops() < 1 || move.getTroops() >= from.getGarrison()) {
            throw invalid(state, player, "Must move at least 1 and leave at least 1 army behind");
        }
        return new ValidatedMove(from, to, move.getTroops(), false);
    }

    public int validateCaptureMove(GameState state, PlayerAccount player, Integer amount, int minimum, int maximum) {
        if (amount == null || amount < minimum || amount > maximum) {
            throw invalid(state, player, "Must move between " + minimum + " and " + maximum
                    + " troops into the captured region, got " + amount);
        }
        return amount;
    }

    /**
     * @return the classified set, or empty for a legal decline
     */
    public Optional<CardSet> validateTrade(GameState state, PlayerAccount player,
                                           Optional<List<Card>> proposal, boolean forced) {
        if (proposal == null || proposal.isEmpty()) {
            if (forced) {
                throw invalid(state, player, "Must trade with " + player.getHandSize() + " cards in hand");
            }
            return Optional.empty();
        }

        List<Card> cards = proposal.get();
        if (!player.holdsAll(cards)) {
            throw invalid(state, player, "Cards not in hand: " + cards);
        }
        return Optional.of(cardService.classify(cards)
                .orElseThrow(() -> invalid(state, player, "Not a valid set: " + cards)));
    }

    private Region resolve(GameState state, PlayerAccount player, String name) {
        return state.getMap().findRegion(name)
                .orElseThrow(() -> invalid(state, player, "Region not found: " + name));
    }

    private InvalidMoveException invalid(GameState state, PlayerAccount player, String message) {
        return new InvalidMoveException(player.getName(), state.getPhase(), message);
    }
}
