package com.mahjongrules.engine;

import com.mahjongrules.model.HandAnalysisResult;
import com.mahjongrules.model.ScoreResult;
import com.mahjongrules.model.Tile;
import com.mahjongrules.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 算番
 * 十三幺固定 8 番；七对、清一色兜底在（底分 + 花牌）基础上 +3；
 * 面子和牌在（底分 + 花牌）基础上累加自摸、杠、牌型、番牌
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int THIRTEEN_ORPHANS_POINTS = 8;

    private static final int[] DRAGONS = {Tile.RED_DRAGON, Tile.GREEN_DRAGON, Tile.WHITE_DRAGON};

    private final int roundWind;

    public ScoringEngine() {
        this(Tile.EAST);
    }

    public ScoringEngine(int roundWind) {
        validateWind(roundWind);
        this.roundWind = roundWind;
    }

    public int getRoundWind() {
        return roundWind;
    }

    public ScoreResult score(HandAnalysisResult analysis, int seat, boolean selfDrawn,
                             int selfQuads, int claimedQuads, Collection<Tile> bonusTiles) {
        return score(analysis, seat, selfDrawn, selfQuads, claimedQuads, bonusTiles, roundWind);
    }

    /**
     * @param seat       座位 0..3，门风 = 东 + seat
     * @param selfQuads  暗杠数
     * @param claimedQuads 明杠数
     * @param bonusTiles 玩家的花牌
     * @param roundWind  圈风序号 401..404
     */
    public ScoreResult score(HandAnalysisResult analysis, int seat, boolean selfDrawn,
                             int selfQuads, int claimedQuads, Collection<Tile> bonusTiles, int roundWind) {
        if (analysis == null) {
            throw new IllegalArgumentException("牌型分析结果不能为空");
        }
        if (seat < 0 || seat > 3) {
            throw new IllegalArgumentException("座位必须在 0..3 之间：" + seat);
        }
        if (selfQuads < 0 || claimedQuads < 0) {
            throw new IllegalArgumentException("杠数不能为负数");
        }
        if (bonusTiles == null) {
            throw new IllegalArgumentException("花牌列表不能为空（没有花牌请传空列表）");
        }
        validateWind(roundWind);

        if (!analysis.isWinning()) {
            return ScoreResult.zero();
        }

        List<String> breakdown = new ArrayList<>();
        switch (analysis.getWinShape()) {
            case THIRTEEN_ORPHANS:
                breakdown.add("Thirteen Orphans: " + THIRTEEN_ORPHANS_POINTS);
                return finish(THIRTEEN_ORPHANS_POINTS, breakdown);
            case SEVEN_PAIRS: {
                breakdown.add("Base Win: +1");
                int points = 1 + bonusAdjustment(seat, bonusTiles, breakdown);
                breakdown.add("Seven Pairs: +3");
                return finish(points + 3, breakdown);
            }
            case PURE_SUIT_FALLBACK: {
                breakdown.add("Base Win: +1");
                int points = 1 + bonusAdjustment(seat, bonusTiles, breakdown);
                breakdown.add("Pure Hand (Non-Traditional): +3");
                return finish(points + 3, breakdown);
            }
            case TRADITIONAL:
                return scoreTraditional(analysis, seat, selfDrawn, selfQuads, claimedQuads,
                        bonusTiles, roundWind, breakdown);
            default:
                return ScoreResult.zero();
        }
    }

    private ScoreResult scoreTraditional(HandAnalysisResult analysis, int seat, boolean selfDrawn,
                                         int selfQuads, int claimedQuads, Collection<Tile> bonusTiles,
                                         int roundWind, List<String> breakdown) {
        int points = 1;
        breakdown.add("Base Win: +1");

        // 和牌方式
        if (selfDrawn && analysis.isFullyConcealed()) {
            points += 3;
            breakdown.add("Concealed Self-Draw: +3");
        } else if (selfDrawn) {
            points += 1;
            breakdown.add("Self-Draw: +1");
        }
        if (!selfDrawn && analysis.isFullyExposed() && selfQuads == 0) {
            points += 2;
            breakdown.add("Fully Exposed Hand: +2");
        }

        if (selfQuads > 0) {
            points += 2 * selfQuads;
            breakdown.add("Concealed Kong x" + selfQuads + ": +" + (2 * selfQuads));
        }
        if (claimedQuads > 0) {
            points += claimedQuads;
            breakdown.add("Exposed Kong x" + claimedQuads + ": +" + claimedQuads);
        }

        points += bonusAdjustment(seat, bonusTiles, breakdown);

        // 牌型
        if (analysis.isPureSuit()) {
            points += 4;
            breakdown.add("True Pure Hand: +4");
        } else if (analysis.isHalfSuit()) {
            points += 2;
            breakdown.add("Half Pure Hand: +2");
        }
        if (analysis.getSequenceCount() == 4 && analysis.getTripletCount() == 0) {
            points += 1;
            breakdown.add("All Sequences: +1");
        }
        if (analysis.getTripletCount() == 4 && analysis.getSequenceCount() == 0) {
            points += 2;
            breakdown.add("All Triplets: +2");
        }

        // 番牌
        List<Integer> triplets = analysis.getTripletOrdinals();
        for (int dragon : DRAGONS) {
            if (triplets.contains(dragon)) {
                points += 1;
                breakdown.add("Dragon Triplet (" + Tile.ofOrdinal(dragon).getDisplayName() + "): +1");
            }
        }
        int seatWind = Tile.EAST + seat;
        if (triplets.contains(seatWind)) {
            points += 1;
            breakdown.add("Seat Wind (" + Tile.ofOrdinal(seatWind).getDisplayName() + "): +1");
        }
        if (triplets.contains(roundWind)) {
            points += 1;
            breakdown.add("Round Wind (" + Tile.ofOrdinal(roundWind).getDisplayName() + "): +1");
        }

        return finish(points, breakdown);
    }

    /**
     * 花牌加减分，明细按顺序追加到 breakdown
     * 本家花（序号 = 座位 + 1）一张都没有扣 1 分；两张本家花加 1 分；
     * 八花齐 +3，同色四花 +2，混色凑齐 1-4 +1
     */
    int bonusAdjustment(int seat, Collection<Tile> bonusTiles, List<String> breakdown) {
        List<Tile> held = new ArrayList<>();
        for (Tile tile : bonusTiles) {
            if (tile != null && tile.isBonus()) {
                held.add(tile);
            }
        }
        if (held.isEmpty()) {
            return 0;
        }

        int adjustment = 0;
        int ownRank = seat + 1;
        int own = 0;
        for (Tile tile : held) {
            if (tile.getValue() == ownRank) {
                own++;
            }
        }
        if (own == 0) {
            adjustment -= 1;
            breakdown.add("Wrong Flower(s): -1");
        } else if (own >= 2) {
            adjustment += 1;
            breakdown.add("Double Own Flower: +1");
        }

        Map<TileType, Set<Integer>> ranksByColour = new EnumMap<>(TileType.class);
        Set<Integer> allRanks = new HashSet<>();
        for (Tile tile : held) {
            ranksByColour.computeIfAbsent(tile.getType(), k -> new HashSet<>()).add(tile.getValue());
            allRanks.add(tile.getValue());
        }
        boolean blueSet = ranksByColour.getOrDefault(TileType.BLUE_BONUS, Set.of()).size() == 4;
        boolean redSet = ranksByColour.getOrDefault(TileType.RED_BONUS, Set.of()).size() == 4;

        if (blueSet && redSet) {
            adjustment += 3;
            breakdown.add("All Eight Flowers: +3");
        } else if (blueSet || redSet) {
            adjustment += 2;
            breakdown.add("Full Flower Set: +2");
        } else if (allRanks.size() == 4) {
            adjustment += 1;
            breakdown.add("Mixed Flower Set: +1");
        }
        return adjustment;
    }

    private ScoreResult finish(int points, List<String> breakdown) {
        ScoreResult result = new ScoreResult(points, breakdown);
        log.info("算番完成：{} 番 {}", points, breakdown);
        return result;
    }

    private static void validateWind(int windOrdinal) {
        if (windOrdinal < Tile.EAST || windOrdinal > Tile.NORTH) {
            throw new IllegalArgumentException("圈风必须是东南西北之一：" + windOrdinal);
        }
    }
}
