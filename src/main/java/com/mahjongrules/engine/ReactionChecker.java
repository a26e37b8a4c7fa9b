package com.mahjongrules.engine;

import com.mahjongrules.model.ChiOption;
import com.mahjongrules.model.Hand;
import com.mahjongrules.model.ReactionType;
import com.mahjongrules.model.Tile;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 操作检查器 - 检查玩家对别人打出的牌能否吃、碰、杠、胡
 */
public class ReactionChecker {

    private final boolean chiFromNextSeatOnly;
    private final WinAnalyzer winAnalyzer;

    public ReactionChecker(boolean chiFromNextSeatOnly, WinAnalyzer winAnalyzer) {
        this.chiFromNextSeatOnly = chiFromNextSeatOnly;
        this.winAnalyzer = winAnalyzer;
    }

    public boolean isChiFromNextSeatOnly() {
        return chiFromNextSeatOnly;
    }

    /**
     * 列出所有吃法，顺序固定：
     * 1. 手里有 d-2, d-1
     * 2. 手里有 d-1, d+1
     * 3. 手里有 d+1, d+2
     * 只有万条饼可以吃，字牌和花牌返回空列表
     */
    public List<ChiOption> enumerateChiOptions(Hand hand, Tile discardedTile) {
        if (hand == null || discardedTile == null) {
            throw new IllegalArgumentException("手牌和被打出的牌都不能为空");
        }
        List<ChiOption> options = new ArrayList<>();
        if (!discardedTile.isSuited()) {
            return options;
        }

        Map<Integer, Tile> held = new TreeMap<>();
        for (Tile tile : hand.getConcealedWithDrawn()) {
            held.putIfAbsent(tile.getOrdinal(), tile);
        }
        int value = discardedTile.getValue();
        int ordinal = discardedTile.getOrdinal();

        if (value >= 3) {
            addOption(options, discardedTile, held.get(ordinal - 2), held.get(ordinal - 1));
        }
        if (value >= 2 && value <= 8) {
            addOption(options, discardedTile, held.get(ordinal - 1), held.get(ordinal + 1));
        }
        if (value <= 7) {
            addOption(options, discardedTile, held.get(ordinal + 1), held.get(ordinal + 2));
        }
        return options;
    }

    /**
     * 吃：必须能组成顺子；按规则配置只能吃上家的牌
     */
    public boolean canChi(Hand hand, Tile discardedTile, int discarderSeat, int reactorSeat) {
        validateSeat(discarderSeat);
        validateSeat(reactorSeat);
        if (discarderSeat == reactorSeat) {
            return false;
        }
        if (chiFromNextSeatOnly && !isNextSeat(discarderSeat, reactorSeat)) {
            return false;
        }
        return !enumerateChiOptions(hand, discardedTile).isEmpty();
    }

    /**
     * 碰：手牌中有2张相同的牌
     */
    public boolean canPon(Hand hand, Tile discardedTile) {
        return countMatching(hand, discardedTile) >= 2;
    }

    /**
     * 明杠：手牌中有3张相同的牌，可以杠别人打出的牌
     */
    public boolean canKong(Hand hand, Tile discardedTile) {
        return countMatching(hand, discardedTile) >= 3;
    }

    /**
     * 点炮：把这张牌当作进张，能和牌即可
     */
    public boolean canRon(Hand hand, Tile discardedTile) {
        if (hand == null || discardedTile == null) {
            throw new IllegalArgumentException("手牌和被打出的牌都不能为空");
        }
        if (discardedTile.isBonus() || hand.getDrawnTile() != null) {
            return false;
        }
        Hand test = hand.copy();
        test.setDrawnTile(discardedTile);
        return winAnalyzer.analyze(test).isWinning();
    }

    /**
     * 暗杠：暗牌（含刚摸的牌）中有4张相同的牌
     */
    public List<Tile> findConcealedQuadCandidates(Hand hand) {
        if (hand == null) {
            throw new IllegalArgumentException("手牌不能为空");
        }
        Map<Integer, Integer> counts = new TreeMap<>();
        for (Tile tile : hand.getConcealedWithDrawn()) {
            if (!tile.isBonus()) {
                counts.merge(tile.getOrdinal(), 1, Integer::sum);
            }
        }
        List<Tile> candidates = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == 4) {
                candidates.add(Tile.ofOrdinal(entry.getKey()));
            }
        }
        return candidates;
    }

    /**
     * 某个座位对这张牌可以做的所有操作，总是包含“过”
     */
    public Set<ReactionType> availableReactions(Hand hand, Tile discardedTile, int discarderSeat, int reactorSeat) {
        Set<ReactionType> reactions = EnumSet.of(ReactionType.PASS);
        if (discarderSeat == reactorSeat) {
            return reactions;
        }
        if (canRon(hand, discardedTile)) {
            reactions.add(ReactionType.RON);
        }
        if (canKong(hand, discardedTile)) {
            reactions.add(ReactionType.KONG);
        }
        if (canPon(hand, discardedTile)) {
            reactions.add(ReactionType.PON);
        }
        if (canChi(hand, discardedTile, discarderSeat, reactorSeat)) {
            reactions.add(ReactionType.CHI);
        }
        return reactions;
    }

    public static boolean isNextSeat(int discarderSeat, int reactorSeat) {
        return reactorSeat == (discarderSeat + 1) % 4;
    }

    private int countMatching(Hand hand, Tile discardedTile) {
        if (hand == null || discardedTile == null) {
            throw new IllegalArgumentException("手牌和被打出的牌都不能为空");
        }
        if (discardedTile.isBonus()) {
            return 0;
        }
        int count = 0;
        for (Tile tile : hand.getConcealedTiles()) {
            if (tile.equals(discardedTile)) {
                count++;
            }
        }
        return count;
    }

    private void addOption(List<ChiOption> options, Tile discardedTile, Tile first, Tile second) {
        if (first != null && second != null) {
            options.add(new ChiOption(discardedTile, first, second));
        }
    }

    private static void validateSeat(int seat) {
        if (seat < 0 || seat > 3) {
            throw new IllegalArgumentException("座位必须在 0..3 之间：" + seat);
        }
    }
}
