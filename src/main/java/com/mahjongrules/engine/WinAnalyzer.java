package com.mahjongrules.engine;

import com.mahjongrules.exception.MalformedHandException;
import com.mahjongrules.model.Hand;
import com.mahjongrules.model.HandAnalysisResult;
import com.mahjongrules.model.Meld;
import com.mahjongrules.model.MeldType;
import com.mahjongrules.model.Tile;
import com.mahjongrules.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 和牌分析器
 * 和牌形式：
 * 1. 十三幺、七对：只在没有任何副露/暗杠时成立
 * 2. 面子结构：4 组面子（刻子/顺子，含副露和杠）+ 1 对将
 * 3. 清一色兜底：全部是同一种数牌，即使拆不成面子也算和牌
 */
public class WinAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(WinAnalyzer.class);

    private final boolean sevenPairsAllowQuads;

    public WinAnalyzer() {
        this(false);
    }

    public WinAnalyzer(boolean sevenPairsAllowQuads) {
        this.sevenPairsAllowQuads = sevenPairsAllowQuads;
    }

    /**
     * 分析手牌是否和牌，并给出牌型拆解
     */
    public HandAnalysisResult analyze(Hand hand) {
        HandAnalysisResult result = evaluate(hand);
        if (result.isWinning()) {
            log.info("和牌！牌型：{}", result.getWinShape());
            logComposition(result);
        }
        return result;
    }

    /**
     * 听牌：当前手牌再进哪一张牌可以和，按序号升序
     * 手牌必须比和牌少一张（已经摸了牌的手牌返回空列表）
     */
    public List<Tile> findWaitingTiles(Hand hand) {
        if (hand == null) {
            throw new IllegalArgumentException("手牌不能为空");
        }
        if (hand.getDrawnTile() != null) {
            return Collections.emptyList();
        }
        int setsNeeded = setsNeededFromConcealed(hand);
        int concealedCount = countConcealed(hand.getConcealedTiles(), new TreeMap<>());
        if (concealedCount != 3 * setsNeeded + 1) {
            return Collections.emptyList();
        }

        Map<Integer, Integer> functionalCounts = countOrdinals(hand.getFunctionalTiles());
        List<Tile> waiting = new ArrayList<>();
        for (Tile candidate : TileFactory.functionalKinds()) {
            // 四张都已经在自己手里，不可能再摸到
            if (functionalCounts.getOrDefault(candidate.getOrdinal(), 0) >= 4) {
                continue;
            }
            Hand test = hand.copy();
            test.setDrawnTile(candidate);
            if (evaluate(test).isWinning()) {
                waiting.add(candidate);
            }
        }
        return waiting;
    }

    private HandAnalysisResult evaluate(Hand hand) {
        if (hand == null) {
            throw new IllegalArgumentException("手牌不能为空");
        }
        int setsNeeded = setsNeededFromConcealed(hand);
        validateSelfQuads(hand);

        // 花牌不参与牌型判断，只计数
        TreeMap<Integer, Integer> counts = new TreeMap<>();
        int concealedCount = countConcealed(hand.getConcealedWithDrawn(), counts);
        int strayBonus = hand.getConcealedWithDrawn().size() - concealedCount;

        int selfQuadCount = hand.getSelfQuads().size();
        int exposedCount = hand.getExposedMelds().size();

        HandAnalysisResult.Builder builder = HandAnalysisResult.builder()
                .bonusTileCount(hand.getBonusTiles().size() + strayBonus)
                .fullyConcealed(exposedCount == 0)
                .fullyExposed(exposedCount == 4 && selfQuadCount == 0);

        List<Tile> functionalTiles = hand.getFunctionalTiles();
        builder.pureSuit(isPureSuit(functionalTiles));
        builder.halfSuit(isHalfSuit(functionalTiles));

        // 张数约束：每个杠多一张；等价于暗牌数 = 3 * 还需的面子数 + 2
        int expectedTotal = 14 + selfQuadCount + hand.getClaimedQuadCount();
        if (functionalTiles.size() != expectedTotal || concealedCount != 3 * setsNeeded + 2) {
            log.warn("手牌张数不符：共 {} 张（应为 {}），暗牌 {} 张，按未和牌处理",
                    functionalTiles.size(), expectedTotal, concealedCount);
            return builder.winning(false).build();
        }

        if (hand.getDeclaredGroupCount() == 0) {
            builder.thirteenOrphans(SpecialHandDetector.isThirteenOrphans(counts));
            if (!builder.isThirteenOrphans()) {
                builder.sevenPairs(SpecialHandDetector.isSevenPairs(counts, sevenPairsAllowQuads));
            }
        }

        if (!builder.isThirteenOrphans()) {
            Optional<Decomposition> decomposition = HandDecomposer.decomposeWithPair(counts, setsNeeded);
            if (decomposition.isPresent()) {
                builder.traditional(true);
                applyDecomposition(builder, decomposition.get());
                foldInDeclaredGroups(builder, hand);
            }
        }

        boolean structuralWin = builder.isTraditional() || builder.isSevenPairs() || builder.isThirteenOrphans();
        boolean pureFallback = builder.isPureSuit() && !structuralWin;
        return builder.winning(structuralWin || pureFallback).build();
    }

    private void applyDecomposition(HandAnalysisResult.Builder builder, Decomposition decomposition) {
        builder.pairOrdinal(decomposition.getPairOrdinal());
        for (int root : decomposition.getTripletRoots()) {
            builder.addTriplet(root);
        }
        for (int root : decomposition.getSequenceRoots()) {
            builder.addSequence(root);
        }
    }

    /**
     * 把暗杠和副露并入拆解结果：杠和碰算刻子，吃算顺子
     */
    private void foldInDeclaredGroups(HandAnalysisResult.Builder builder, Hand hand) {
        for (Meld quad : hand.getSelfQuads()) {
            builder.addTriplet(quad.getRoot());
        }
        for (Meld meld : hand.getExposedMelds()) {
            if (meld.getType() == MeldType.SEQUENCE) {
                builder.addSequence(meld.getRoot());
            } else {
                builder.addTriplet(meld.getRoot());
            }
        }
    }

    private int setsNeededFromConcealed(Hand hand) {
        int declared = hand.getDeclaredGroupCount();
        if (declared > 4) {
            throw new MalformedHandException("副露和暗杠共 " + declared + " 组，超过 4 组");
        }
        return 4 - declared;
    }

    private void validateSelfQuads(Hand hand) {
        for (Meld quad : hand.getSelfQuads()) {
            if (quad.getType() != MeldType.QUAD) {
                throw new MalformedHandException("暗杠必须是四张相同的牌：" + quad);
            }
        }
    }

    /**
     * 清一色：只有一种花色，且是数牌
     */
    private boolean isPureSuit(List<Tile> functionalTiles) {
        Set<TileType> suits = suitsOf(functionalTiles);
        return suits.size() == 1 && suits.iterator().next().isSuited();
    }

    /**
     * 混一色：一种数牌 + 字牌，至少 14 张
     */
    private boolean isHalfSuit(List<Tile> functionalTiles) {
        if (functionalTiles.size() < 14) {
            return false;
        }
        Set<TileType> suits = suitsOf(functionalTiles);
        int suited = 0;
        int honors = 0;
        for (TileType suit : suits) {
            if (suit.isSuited()) {
                suited++;
            } else if (suit.isHonor()) {
                honors++;
            }
        }
        return suited == 1 && honors >= 1;
    }

    private Set<TileType> suitsOf(List<Tile> tiles) {
        Set<TileType> suits = EnumSet.noneOf(TileType.class);
        for (Tile tile : tiles) {
            suits.add(tile.getType());
        }
        return suits;
    }

    /**
     * 统计非花牌的张数，同时填充“序号 -> 张数”
     */
    private int countConcealed(List<Tile> tiles, Map<Integer, Integer> counts) {
        int total = 0;
        for (Tile tile : tiles) {
            if (tile.isBonus()) {
                continue;
            }
            counts.merge(tile.getOrdinal(), 1, Integer::sum);
            total++;
        }
        return total;
    }

    private Map<Integer, Integer> countOrdinals(List<Tile> tiles) {
        Map<Integer, Integer> counts = new TreeMap<>();
        countConcealed(tiles, counts);
        return counts;
    }

    private void logComposition(HandAnalysisResult result) {
        if (!log.isDebugEnabled() || !result.isTraditional()) {
            return;
        }
        log.debug("--- 和牌牌型 ---");
        log.debug("将：{}", result.getPairOrdinal());
        log.debug("刻子/杠 {} 组：{}", result.getTripletCount(), result.getTripletOrdinals());
        for (int root : result.getSequenceRoots()) {
            log.debug("顺子：{}-{}-{}", root, root + 1, root + 2);
        }
    }
}
