package com.mahjongrules.engine;

import com.mahjongrules.model.ArbiterPhase;
import com.mahjongrules.model.ChiOption;
import com.mahjongrules.model.Hand;
import com.mahjongrules.model.ReactionCandidate;
import com.mahjongrules.model.ReactionType;
import com.mahjongrules.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 出牌后的抢牌裁决
 * 收集其他三家的响应（胡、杠、碰、吃、过），按优先级裁决：胡 > 杠 = 碰 > 吃 > 过
 * 同一优先级先登记的玩家优先；同一时刻只处理一张打出的牌
 */
public class InterruptArbiter {

    private static final Logger log = LoggerFactory.getLogger(InterruptArbiter.class);

    private final ReactionChecker reactionChecker;

    private ArbiterPhase phase = ArbiterPhase.IDLE;
    private int discarderSeat = -1;
    private Tile discardedTile;
    private final Map<Integer, ReactionCandidate> candidates = new LinkedHashMap<>();

    // 等待选择吃法的玩家
    private int pendingChiSeat = -1;
    private List<ChiOption> pendingChiOptions = Collections.emptyList();

    private ReactionCandidate result;

    public InterruptArbiter(ReactionChecker reactionChecker) {
        this.reactionChecker = reactionChecker;
    }

    /**
     * 有玩家出牌，开始收集响应
     */
    public synchronized void open(int discarderSeat, Tile discardedTile) {
        if (phase == ArbiterPhase.AWAITING_REACTIONS || phase == ArbiterPhase.AWAITING_CHI_CHOICE) {
            throw new IllegalStateException("上一张牌还没有裁决完：" + this.discardedTile);
        }
        validateSeat(discarderSeat);
        if (discardedTile == null || discardedTile.isBonus()) {
            throw new IllegalArgumentException("打出的牌不能为空或花牌：" + discardedTile);
        }
        clearWindow();
        this.discarderSeat = discarderSeat;
        this.discardedTile = discardedTile;
        this.result = null;
        this.phase = ArbiterPhase.AWAITING_REACTIONS;
        log.info("座位 {} 打出 {}，等待其他玩家响应", discarderSeat, discardedTile);
    }

    /**
     * 登记一个响应；吃牌必须带上吃法（或者使用 submitChi）
     */
    public synchronized void submit(ReactionCandidate candidate) {
        requireCollecting();
        if (candidate == null) {
            throw new IllegalArgumentException("响应不能为空");
        }
        int seat = candidate.getSeat();
        requireEligibleSeat(seat);
        if (candidate.getType() == ReactionType.CHI) {
            ChiOption option = candidate.getChiOption();
            if (option == null) {
                throw new IllegalArgumentException("吃牌必须指定吃法");
            }
            if (!option.getDiscardedTile().equals(discardedTile)) {
                throw new IllegalArgumentException("吃法与打出的牌不符：" + option);
            }
            requireChiSeat(seat);
        }
        candidates.put(seat, candidate);
        log.info("座位 {} 响应：{}", seat, candidate.getType());
    }

    /**
     * 吃牌：根据手牌列出吃法
     * 没有吃法抛异常；只有一种直接登记；多种则等待玩家选择
     *
     * @return 可选的吃法
     */
    public synchronized List<ChiOption> submitChi(int seat, Hand hand) {
        requireCollecting();
        requireEligibleSeat(seat);
        requireChiSeat(seat);
        if (phase == ArbiterPhase.AWAITING_CHI_CHOICE) {
            throw new IllegalStateException("座位 " + pendingChiSeat + " 正在选择吃法");
        }
        List<ChiOption> options = reactionChecker.enumerateChiOptions(hand, discardedTile);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("座位 " + seat + " 没有可以吃 " + discardedTile + " 的组合");
        }
        if (options.size() == 1) {
            candidates.put(seat, ReactionCandidate.chi(seat, options.get(0)));
            log.info("座位 {} 吃牌，唯一吃法 {}", seat, options.get(0));
        } else {
            pendingChiSeat = seat;
            pendingChiOptions = Collections.unmodifiableList(new ArrayList<>(options));
            phase = ArbiterPhase.AWAITING_CHI_CHOICE;
            log.info("座位 {} 吃牌，有 {} 种吃法，等待选择", seat, options.size());
        }
        return options;
    }

    /**
     * 多种吃法时，玩家选定其中一种
     */
    public synchronized void chooseChiOption(int seat, ChiOption option) {
        if (phase != ArbiterPhase.AWAITING_CHI_CHOICE || seat != pendingChiSeat) {
            throw new IllegalStateException("座位 " + seat + " 没有待选择的吃法");
        }
        if (option == null || !pendingChiOptions.contains(option)) {
            throw new IllegalArgumentException("不是可选的吃法：" + option);
        }
        candidates.put(seat, ReactionCandidate.chi(seat, option));
        log.info("座位 {} 选择吃法 {}", seat, option);
        pendingChiSeat = -1;
        pendingChiOptions = Collections.emptyList();
        phase = ArbiterPhase.AWAITING_REACTIONS;
    }

    /**
     * 其他三家都已经响应（且没有待选的吃法）
     */
    public synchronized boolean isComplete() {
        return phase == ArbiterPhase.AWAITING_REACTIONS && candidates.size() == 3;
    }

    /**
     * 裁决：没有响应的玩家按“过”处理
     * 有玩家还在选择吃法时不能裁决
     */
    public synchronized ReactionCandidate resolve() {
        if (phase == ArbiterPhase.AWAITING_CHI_CHOICE) {
            throw new IllegalStateException("座位 " + pendingChiSeat + " 还没有选择吃法");
        }
        requireCollecting();
        return finishResolution();
    }

    /**
     * 超时关闭：待选择吃法的玩家也按“过”处理
     */
    public synchronized ReactionCandidate closeWindow() {
        requireCollecting();
        if (phase == ArbiterPhase.AWAITING_CHI_CHOICE) {
            log.warn("座位 {} 超时未选择吃法，按过处理", pendingChiSeat);
            pendingChiSeat = -1;
            pendingChiOptions = Collections.emptyList();
            phase = ArbiterPhase.AWAITING_REACTIONS;
        }
        return finishResolution();
    }

    public synchronized void reset() {
        clearWindow();
        discarderSeat = -1;
        discardedTile = null;
        result = null;
        phase = ArbiterPhase.IDLE;
    }

    public synchronized ArbiterPhase getPhase() {
        return phase;
    }

    public synchronized ReactionCandidate getResult() {
        return result;
    }

    public synchronized Tile getDiscardedTile() {
        return discardedTile;
    }

    public synchronized int getDiscarderSeat() {
        return discarderSeat;
    }

    public synchronized List<ChiOption> getPendingChiOptions() {
        return pendingChiOptions;
    }

    /**
     * 按优先级裁决：胡 > 杠 = 碰 > 吃 > 过
     * 同一优先级取列表中最先出现的；全部是“过”时返回第一个
     */
    public static ReactionCandidate resolveInterrupt(List<ReactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("响应列表不能为空");
        }
        ReactionCandidate best = candidates.get(0);
        for (ReactionCandidate candidate : candidates) {
            if (candidate.getType().getPriority() > best.getType().getPriority()) {
                best = candidate;
            }
        }
        return best;
    }

    private ReactionCandidate finishResolution() {
        List<ReactionCandidate> collected = new ArrayList<>(candidates.values());
        // 从出牌玩家的下家开始，补齐没有响应的玩家
        for (int offset = 1; offset <= 3; offset++) {
            int seat = (discarderSeat + offset) % 4;
            if (!candidates.containsKey(seat)) {
                collected.add(ReactionCandidate.pass(seat));
            }
        }
        result = resolveInterrupt(collected);
        clearWindow();
        phase = ArbiterPhase.RESOLVED;
        if (result.isPass()) {
            log.info("{} 无人响应", discardedTile);
        } else {
            log.info("{} 裁决结果：座位 {} {}", discardedTile, result.getSeat(), result.getType());
        }
        return result;
    }

    private void clearWindow() {
        candidates.clear();
        pendingChiSeat = -1;
        pendingChiOptions = Collections.emptyList();
    }

    private void requireCollecting() {
        if (phase != ArbiterPhase.AWAITING_REACTIONS && phase != ArbiterPhase.AWAITING_CHI_CHOICE) {
            throw new IllegalStateException("当前没有等待响应的出牌，阶段：" + phase);
        }
    }

    private void requireEligibleSeat(int seat) {
        validateSeat(seat);
        if (seat == discarderSeat) {
            throw new IllegalArgumentException("出牌玩家不能响应自己打出的牌");
        }
        if (candidates.containsKey(seat) || seat == pendingChiSeat) {
            throw new IllegalStateException("座位 " + seat + " 已经响应过了");
        }
    }

    private void requireChiSeat(int seat) {
        if (reactionChecker.isChiFromNextSeatOnly() && !ReactionChecker.isNextSeat(discarderSeat, seat)) {
            throw new IllegalArgumentException("只能吃上家打出的牌，座位 " + seat + " 不是下家");
        }
    }

    private static void validateSeat(int seat) {
        if (seat < 0 || seat > 3) {
            throw new IllegalArgumentException("座位必须在 0..3 之间：" + seat);
        }
    }
}
