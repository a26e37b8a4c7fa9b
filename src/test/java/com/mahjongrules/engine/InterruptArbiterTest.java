package com.mahjongrules.engine;

import com.mahjongrules.model.ArbiterPhase;
import com.mahjongrules.model.ChiOption;
import com.mahjongrules.model.Hand;
import com.mahjongrules.model.ReactionCandidate;
import com.mahjongrules.model.ReactionType;
import com.mahjongrules.model.Tile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 抢牌裁决测试
 */
class InterruptArbiterTest {

    private static final Tile FIVE_CHARACTERS = Tile.ofOrdinal(105);

    private InterruptArbiter arbiter;

    @BeforeEach
    void setUp() {
        arbiter = new InterruptArbiter(new ReactionChecker(true, new WinAnalyzer()));
    }

    @Test
    void testPonBeatsChi() {
        // 东家打 5万：南家吃，西家碰，北家过
        arbiter.open(0, FIVE_CHARACTERS);
        arbiter.submitChi(1, Hand.ofOrdinals(103, 104, 201));
        arbiter.submit(ReactionCandidate.pon(2));
        arbiter.submit(ReactionCandidate.pass(3));

        assertTrue(arbiter.isComplete());
        ReactionCandidate result = arbiter.resolve();

        assertEquals(ReactionType.PON, result.getType());
        assertEquals(2, result.getSeat());
        assertEquals(ArbiterPhase.RESOLVED, arbiter.getPhase());
        assertEquals(result, arbiter.getResult());
    }

    @Test
    void testFirstRegisteredPonWins() {
        // 南家先登记吃，北家、西家先后碰：取先登记的碰，不取吃
        arbiter.open(0, FIVE_CHARACTERS);
        arbiter.submitChi(1, Hand.ofOrdinals(103, 104));
        arbiter.submit(ReactionCandidate.pon(3));
        arbiter.submit(ReactionCandidate.pon(2));

        assertEquals(ReactionCandidate.pon(3), arbiter.resolve());
    }

    @Test
    void testRonBeatsEverything() {
        arbiter.open(2, FIVE_CHARACTERS);
        arbiter.submit(ReactionCandidate.kong(0));
        arbiter.submit(ReactionCandidate.ron(1));
        arbiter.submit(ReactionCandidate.pass(3));

        ReactionCandidate result = arbiter.resolve();
        assertEquals(ReactionType.RON, result.getType());
        assertEquals(1, result.getSeat());
    }

    @Test
    void testResolveInterruptPriority() {
        ChiOption option = new ChiOption(FIVE_CHARACTERS, Tile.ofOrdinal(103), Tile.ofOrdinal(104));

        assertEquals(ReactionCandidate.ron(3), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.chi(1, option), ReactionCandidate.pon(2), ReactionCandidate.ron(3))));

        // 杠和碰同级，先登记的优先
        assertEquals(ReactionCandidate.kong(2), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.pass(1), ReactionCandidate.kong(2), ReactionCandidate.pon(3))));
        assertEquals(ReactionCandidate.pon(1), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.pon(1), ReactionCandidate.kong(3))));

        // 两家都能和：先登记的优先
        assertEquals(ReactionCandidate.ron(3), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.ron(3), ReactionCandidate.ron(1))));

        assertEquals(ReactionCandidate.chi(1, option), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.pass(3), ReactionCandidate.chi(1, option))));
    }

    @Test
    void testAllPassReturnsFirstPass() {
        assertEquals(ReactionCandidate.pass(2), InterruptArbiter.resolveInterrupt(List.of(
                ReactionCandidate.pass(2), ReactionCandidate.pass(3), ReactionCandidate.pass(1))));

        assertThrows(IllegalArgumentException.class, () -> InterruptArbiter.resolveInterrupt(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> InterruptArbiter.resolveInterrupt(null));
    }

    @Test
    void testMissingSeatsTreatedAsPass() {
        arbiter.open(1, FIVE_CHARACTERS);
        assertFalse(arbiter.isComplete());

        ReactionCandidate result = arbiter.resolve();
        assertTrue(result.isPass());
        assertEquals(2, result.getSeat(), "从出牌玩家的下家开始补“过”");
    }

    @Test
    void testMultipleChiOptionsRequireChoice() {
        arbiter.open(0, FIVE_CHARACTERS);
        List<ChiOption> options = arbiter.submitChi(1, Hand.ofOrdinals(103, 104, 106, 107));

        assertEquals(3, options.size());
        assertEquals(ArbiterPhase.AWAITING_CHI_CHOICE, arbiter.getPhase());
        assertEquals(options, arbiter.getPendingChiOptions());
        assertThrows(IllegalStateException.class, () -> arbiter.resolve(), "选吃法之前不能裁决");

        // 等待选吃法时其他玩家仍然可以响应
        arbiter.submit(ReactionCandidate.pass(2));
        arbiter.submit(ReactionCandidate.pass(3));
        assertFalse(arbiter.isComplete());

        assertThrows(IllegalStateException.class, () -> arbiter.chooseChiOption(2, options.get(0)));
        ChiOption notOffered = new ChiOption(Tile.ofOrdinal(205), Tile.ofOrdinal(203), Tile.ofOrdinal(204));
        assertThrows(IllegalArgumentException.class, () -> arbiter.chooseChiOption(1, notOffered));

        arbiter.chooseChiOption(1, options.get(1));
        assertEquals(ArbiterPhase.AWAITING_REACTIONS, arbiter.getPhase());
        assertTrue(arbiter.isComplete());

        ReactionCandidate result = arbiter.resolve();
        assertEquals(ReactionType.CHI, result.getType());
        assertEquals(options.get(1), result.getChiOption());
    }

    @Test
    void testCloseWindowDropsPendingChi() {
        arbiter.open(0, FIVE_CHARACTERS);
        arbiter.submitChi(1, Hand.ofOrdinals(103, 104, 106, 107));

        ReactionCandidate result = arbiter.closeWindow();
        assertTrue(result.isPass(), "超时没选吃法按过处理");
        assertEquals(ArbiterPhase.RESOLVED, arbiter.getPhase());
    }

    @Test
    void testChiWithoutOptionsRejected() {
        arbiter.open(0, FIVE_CHARACTERS);
        assertThrows(IllegalArgumentException.class, () -> arbiter.submitChi(1, Hand.ofOrdinals(101, 109)));
        assertEquals(ArbiterPhase.AWAITING_REACTIONS, arbiter.getPhase());
    }

    @Test
    void testChiFromWrongSeatRejected() {
        arbiter.open(0, FIVE_CHARACTERS);
        assertThrows(IllegalArgumentException.class, () -> arbiter.submitChi(2, Hand.ofOrdinals(103, 104)));

        ChiOption option = new ChiOption(FIVE_CHARACTERS, Tile.ofOrdinal(103), Tile.ofOrdinal(104));
        assertThrows(IllegalArgumentException.class, () -> arbiter.submit(ReactionCandidate.chi(3, option)));
        assertThrows(IllegalArgumentException.class, () -> arbiter.submit(ReactionCandidate.of(1, ReactionType.CHI)),
                "吃牌必须带吃法");
    }

    @Test
    void testChiOptionMustFormSequence() {
        // 5万 + 1饼 + 白：组不成顺子
        assertThrows(IllegalArgumentException.class,
                () -> new ChiOption(FIVE_CHARACTERS, Tile.ofOrdinal(201), Tile.ofOrdinal(503)));
        assertThrows(IllegalArgumentException.class,
                () -> new ChiOption(FIVE_CHARACTERS, Tile.ofOrdinal(107), Tile.ofOrdinal(108)), "不连续");
        assertThrows(IllegalArgumentException.class,
                () -> new ChiOption(Tile.ofOrdinal(401), Tile.ofOrdinal(402), Tile.ofOrdinal(403)), "字牌不能吃");
        assertThrows(IllegalArgumentException.class,
                () -> new ChiOption(FIVE_CHARACTERS, null, Tile.ofOrdinal(104)));

        // 合法吃法裁决出来后能直接变成副露
        arbiter.open(0, FIVE_CHARACTERS);
        arbiter.submit(ReactionCandidate.chi(1, new ChiOption(FIVE_CHARACTERS, Tile.ofOrdinal(104), Tile.ofOrdinal(103))));
        ReactionCandidate result = arbiter.resolve();
        assertEquals(103, result.getChiOption().toMeld().getRoot());
    }

    @Test
    void testInvalidSubmissions() {
        assertThrows(IllegalStateException.class, () -> arbiter.submit(ReactionCandidate.pon(1)), "没有出牌时不能响应");

        arbiter.open(0, FIVE_CHARACTERS);
        assertThrows(IllegalArgumentException.class, () -> arbiter.submit(ReactionCandidate.pon(0)), "出牌玩家不能响应");
        assertThrows(IllegalArgumentException.class, () -> arbiter.submit(ReactionCandidate.pon(4)));

        arbiter.submit(ReactionCandidate.pass(2));
        assertThrows(IllegalStateException.class, () -> arbiter.submit(ReactionCandidate.pon(2)), "每个玩家只能响应一次");

        assertThrows(IllegalStateException.class, () -> arbiter.open(1, Tile.ofOrdinal(201)), "上一张牌没裁决完");
    }

    @Test
    void testResetAndReopen() {
        arbiter.open(0, FIVE_CHARACTERS);
        arbiter.submit(ReactionCandidate.pon(2));
        arbiter.resolve();

        arbiter.open(2, Tile.ofOrdinal(301));
        assertEquals(ArbiterPhase.AWAITING_REACTIONS, arbiter.getPhase());
        assertEquals(2, arbiter.getDiscarderSeat());
        assertEquals(Tile.ofOrdinal(301), arbiter.getDiscardedTile());
        assertFalse(arbiter.isComplete(), "新的出牌不保留上一次的响应");

        arbiter.reset();
        assertEquals(ArbiterPhase.IDLE, arbiter.getPhase());
        assertNull(arbiter.getResult());
        assertThrows(IllegalStateException.class, () -> arbiter.resolve());
    }

    @Test
    void testConcurrentSubmissions() throws Exception {
        arbiter.open(0, FIVE_CHARACTERS);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        List<ReactionCandidate> submissions = List.of(
                ReactionCandidate.pass(1), ReactionCandidate.ron(2), ReactionCandidate.pon(3));
        try {
            for (ReactionCandidate candidate : submissions) {
                futures.add(executor.submit(() -> {
                    start.await();
                    arbiter.submit(candidate);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(arbiter.isComplete());
        assertEquals(ReactionCandidate.ron(2), arbiter.resolve());
    }
}
