package com.mahjongrules.model;

import com.mahjongrules.exception.MalformedHandException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 面子与手牌测试
 */
class MeldTest {

    @Test
    void testChiIsSortedSequence() {
        Meld meld = Meld.chi(Tile.ofOrdinal(205), Tile.ofOrdinal(203), Tile.ofOrdinal(204));
        assertEquals(MeldType.SEQUENCE, meld.getType());
        assertEquals(203, meld.getRoot());
        assertEquals(Tile.ofOrdinal(205), meld.getCalledTile());
        assertEquals(List.of(Tile.ofOrdinal(203), Tile.ofOrdinal(204), Tile.ofOrdinal(205)), meld.getTiles());
    }

    @Test
    void testInvalidMeldsRejected() {
        // 跨花色、字牌、不连续都不是顺子
        assertThrows(MalformedHandException.class,
                () -> Meld.chi(Tile.ofOrdinal(109), Tile.ofOrdinal(201), Tile.ofOrdinal(202)));
        assertThrows(MalformedHandException.class,
                () -> Meld.chi(Tile.ofOrdinal(401), Tile.ofOrdinal(402), Tile.ofOrdinal(403)));
        assertThrows(MalformedHandException.class,
                () -> Meld.chi(Tile.ofOrdinal(101), Tile.ofOrdinal(102), Tile.ofOrdinal(104)));
        // 花牌不能组成面子
        assertThrows(MalformedHandException.class, () -> Meld.pon(Tile.ofOrdinal(601)));
        // 叫来的牌必须在面子中
        assertThrows(MalformedHandException.class, () -> new Meld(MeldType.TRIPLET,
                List.of(Tile.ofOrdinal(101), Tile.ofOrdinal(101), Tile.ofOrdinal(101)), Tile.ofOrdinal(102)));
        // 杠必须是四张
        assertThrows(MalformedHandException.class, () -> new Meld(MeldType.QUAD,
                List.of(Tile.ofOrdinal(101), Tile.ofOrdinal(101), Tile.ofOrdinal(101)), null));
    }

    @Test
    void testNullTileInMeldRejected() {
        assertThrows(MalformedHandException.class,
                () -> Meld.chi(null, Tile.ofOrdinal(102), Tile.ofOrdinal(103)));
        assertThrows(MalformedHandException.class, () -> new Meld(MeldType.SEQUENCE,
                Arrays.asList(Tile.ofOrdinal(101), null, Tile.ofOrdinal(103)), null));
        assertThrows(MalformedHandException.class, () -> Meld.pon(null));
    }

    @Test
    void testNullCollectionsRejected() {
        Hand hand = Hand.ofOrdinals(101, 102, 103);

        assertThrows(IllegalArgumentException.class, () -> hand.setConcealedTiles(null));
        assertThrows(IllegalArgumentException.class, () -> hand.setSelfQuads(null));
        assertThrows(IllegalArgumentException.class, () -> hand.setExposedMelds(null));
        assertThrows(IllegalArgumentException.class, () -> hand.setBonusTiles(null));
        assertEquals(3, hand.getConcealedTiles().size(), "设置失败不应改动原手牌");

        // 没有摸牌是合法状态
        hand.setDrawnTile(null);
        assertNull(hand.getDrawnTile());
    }

    @Test
    void testHandTileAccounting() {
        Hand hand = Hand.ofOrdinals(101, 102, 103, 201, 201);
        hand.setDrawnTile(Tile.ofOrdinal(202));
        hand.addSelfQuad(Meld.concealedKong(Tile.ofOrdinal(501)));
        hand.addExposedMeld(Meld.claimedKong(Tile.ofOrdinal(401)));
        hand.addExposedMeld(Meld.pon(Tile.ofOrdinal(309)));
        hand.addBonusTile(Tile.ofOrdinal(601));

        assertEquals(6, hand.getConcealedWithDrawn().size());
        assertEquals(6 + 4 + 4 + 3, hand.getFunctionalTiles().size(), "花牌不计入功能牌");
        assertEquals(3, hand.getDeclaredGroupCount());
        assertEquals(1, hand.getClaimedQuadCount());
    }

    @Test
    void testCopyIsIndependent() {
        Hand hand = Hand.ofOrdinals(101, 102, 103);
        Hand copy = hand.copy();
        copy.addTile(Tile.ofOrdinal(104));
        copy.setDrawnTile(Tile.ofOrdinal(105));

        assertEquals(3, hand.getConcealedTiles().size(), "修改副本不应影响原手牌");
        assertNull(hand.getDrawnTile());
    }
}
