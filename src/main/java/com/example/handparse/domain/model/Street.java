package com.example.handparse.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A post-flop betting round: the board cards it dealt and the actions taken on it.
 *
 * @param name    which street this is
 * @param cards   cards dealt on this street only (3 for the flop, 1 for turn and river)
 * @param actions actions of this street in log order, empty when nobody acted
 */
public record Street(StreetName name, List<Card> cards, List<PlayerAction> actions) {

    public Street {
        cards = List.copyOf(cards);
        actions = List.copyOf(actions);
    }

    /**
     * @return flop texture, or {@code null} for the turn and river
     */
    public FlopTexture texture() {
        return name == StreetName.FLOP ? FlopTexture.of(cards) : null;
    }

    /**
     * @return distinct actor names in order of first appearance
     */
    public List<String> players() {
        List<String> names = new ArrayList<>();
        for (PlayerAction action : actions) {
            if (!names.contains(action.name())) {
                names.add(action.name());
            }
        }
        return names;
    }
}
