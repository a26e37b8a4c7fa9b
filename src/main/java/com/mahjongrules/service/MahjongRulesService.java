package com.mahjongrules.service;

import com.mahjongrules.engine.InterruptArbiter;
import com.mahjongrules.engine.ReactionChecker;
import com.mahjongrules.engine.ScoringEngine;
import com.mahjongrules.engine.WinAnalyzer;
import com.mahjongrules.model.ChiOption;
import com.mahjongrules.model.Hand;
import com.mahjongrules.model.HandAnalysisResult;
import com.mahjongrules.model.ReactionCandidate;
import com.mahjongrules.model.ReactionType;
import com.mahjongrules.model.ScoreResult;
import com.mahjongrules.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 规则服务：判牌、算番，以及每张牌桌的抢牌裁决窗口
 */
@Service
public class MahjongRulesService {

    private static final Logger log = LoggerFactory.getLogger(MahjongRulesService.class);

    private final WinAnalyzer winAnalyzer;
    private final ScoringEngine scoringEngine;
    private final ReactionChecker reactionChecker;

    private final Map<String, InterruptArbiter> windows = new ConcurrentHashMap<>(); // tableId -> arbiter

    public MahjongRulesService(WinAnalyzer winAnalyzer, ScoringEngine scoringEngine, ReactionChecker reactionChecker) {
        this.winAnalyzer = winAnalyzer;
        this.scoringEngine = scoringEngine;
        this.reactionChecker = reactionChecker;
    }

    public HandAnalysisResult analyze(Hand hand) {
        return winAnalyzer.analyze(hand);
    }

    public ScoreResult score(HandAnalysisResult analysis, int seat, boolean selfDrawn,
                             int selfQuads, int claimedQuads, Collection<Tile> bonusTiles) {
        return scoringEngine.score(analysis, seat, selfDrawn, selfQuads, claimedQuads, bonusTiles);
    }

    /**
     * 判牌并算番，杠数和花牌取自手牌
     */
    public ScoreResult scoreHand(Hand hand, int seat, boolean selfDrawn) {
        HandAnalysisResult analysis = winAnalyzer.analyze(hand);
        return scoringEngine.score(analysis, seat, selfDrawn,
                hand.getSelfQuads().size(), hand.getClaimedQuadCount(), hand.getBonusTiles());
    }

    public List<Tile> findWaitingTiles(Hand hand) {
        return winAnalyzer.findWaitingTiles(hand);
    }

    public List<ChiOption> enumerateChiOptions(Hand hand, Tile discardedTile) {
        return reactionChecker.enumerateChiOptions(hand, discardedTile);
    }

    public Set<ReactionType> availableReactions(Hand hand, Tile discardedTile, int discarderSeat, int reactorSeat) {
        return reactionChecker.availableReactions(hand, discardedTile, discarderSeat, reactorSeat);
    }

    public List<Tile> findConcealedQuadCandidates(Hand hand) {
        return reactionChecker.findConcealedQuadCandidates(hand);
    }

    public ReactionCandidate resolveInterrupt(List<ReactionCandidate> candidates) {
        return InterruptArbiter.resolveInterrupt(candidates);
    }

    /**
     * 牌桌有人出牌，打开响应窗口
     */
    public void openReactionWindow(String tableId, int discarderSeat, Tile discardedTile) {
        if (tableId == null) {
            throw new IllegalArgumentException("牌桌编号不能为空");
        }
        // 打开失败时表里不留下新的裁决器
        windows.compute(tableId, (id, existing) -> {
            InterruptArbiter arbiter = existing != null ? existing : new InterruptArbiter(reactionChecker);
            arbiter.open(discarderSeat, discardedTile);
            return arbiter;
        });
        log.info("牌桌 {} 打开响应窗口", tableId);
    }

    public void submitReaction(String tableId, ReactionCandidate candidate) {
        requireWindow(tableId).submit(candidate);
    }

    public List<ChiOption> submitChi(String tableId, int seat, Hand hand) {
        return requireWindow(tableId).submitChi(seat, hand);
    }

    public void chooseChiOption(String tableId, int seat, ChiOption option) {
        requireWindow(tableId).chooseChiOption(seat, option);
    }

    public boolean isWindowComplete(String tableId) {
        InterruptArbiter arbiter = windows.get(tableId);
        return arbiter != null && arbiter.isComplete();
    }

    /**
     * 关闭响应窗口并裁决；没有响应（或没选完吃法）的玩家按“过”处理
     */
    public ReactionCandidate closeReactionWindow(String tableId) {
        // 先从表里摘下来，同一牌桌新打开的窗口会拿到新的裁决器
        InterruptArbiter arbiter = tableId == null ? null : windows.remove(tableId);
        if (arbiter == null) {
            log.warn("牌桌 {} 没有打开的响应窗口", tableId);
            throw new IllegalStateException("牌桌 " + tableId + " 没有打开的响应窗口");
        }
        ReactionCandidate result = arbiter.closeWindow();
        log.info("牌桌 {} 关闭响应窗口，结果 {}", tableId, result);
        return result;
    }

    public boolean hasOpenWindow(String tableId) {
        return tableId != null && windows.containsKey(tableId);
    }

    private InterruptArbiter requireWindow(String tableId) {
        InterruptArbiter arbiter = tableId == null ? null : windows.get(tableId);
        if (arbiter == null) {
            log.warn("牌桌 {} 没有打开的响应窗口", tableId);
            throw new IllegalStateException("牌桌 " + tableId + " 没有打开的响应窗口");
        }
        return arbiter;
    }
}
