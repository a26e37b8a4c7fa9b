package com.mahjongrules.engine;

import com.mahjongrules.model.Tile;
import com.mahjongrules.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 随机手牌生成器（测试牌型、固定起手牌用）
 * 同一种牌最多用 4 张
 */
public class HandGenerator {

    private static final Logger log = LoggerFactory.getLogger(HandGenerator.class);

    private static final TileType[] SUITS = {TileType.CHARACTERS, TileType.CIRCLES, TileType.BAMBOOS};

    private final Random random;

    public HandGenerator(Random random) {
        this.random = random;
    }

    /**
     * 随机和牌：1 对将 + 4 组刻子/顺子，共 14 张，已打乱
     */
    public List<Tile> randomWinningHand() {
        return buildWinningHand(null);
    }

    /**
     * 随机清一色和牌：全部来自同一种数牌
     */
    public List<Tile> randomPureSuitHand() {
        return buildWinningHand(SUITS[random.nextInt(SUITS.length)]);
    }

    /**
     * 七对一向听：6 个不同的对子 + 1 张单牌，等的就是这张单牌
     */
    public GeneratedHand sevenPairsIishanten() {
        List<Tile> pool = new ArrayList<>(TileFactory.functionalKinds());
        List<Tile> tiles = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            Tile pair = pool.remove(random.nextInt(pool.size()));
            tiles.add(pair);
            tiles.add(pair);
        }
        Tile single = pool.remove(random.nextInt(pool.size()));
        tiles.add(single);
        TileFactory.shuffle(tiles, random);
        return new GeneratedHand(tiles, single);
    }

    /**
     * 十三幺一向听：缺一种幺九牌，另有一种幺九牌成对，共 13 张
     */
    public GeneratedHand thirteenOrphansIishanten() {
        List<Integer> required = new ArrayList<>(TileFactory.THIRTEEN_ORPHAN_ORDINALS);
        int waiting = required.remove(random.nextInt(required.size()));
        int doubled = required.get(random.nextInt(required.size()));

        List<Tile> tiles = new ArrayList<>();
        for (int ordinal : required) {
            tiles.add(Tile.ofOrdinal(ordinal));
            if (ordinal == doubled) {
                tiles.add(Tile.ofOrdinal(ordinal));
            }
        }
        TileFactory.shuffle(tiles, random);
        log.debug("十三幺一向听：等 {}，对子 {}", waiting, doubled);
        return new GeneratedHand(tiles, Tile.ofOrdinal(waiting));
    }

    /**
     * @param suit 为空时任意牌都可以；否则只用这一种数牌
     */
    private List<Tile> buildWinningHand(TileType suit) {
        Map<Integer, Integer> used = new HashMap<>();
        List<Tile> tiles = new ArrayList<>();

        Tile pair = randomKind(suit);
        addCopies(tiles, used, pair.getOrdinal(), 2);

        int groups = 0;
        while (groups < 4) {
            if (random.nextBoolean()) {
                Tile triplet = randomKind(suit);
                if (remaining(used, triplet.getOrdinal()) >= 3) {
                    addCopies(tiles, used, triplet.getOrdinal(), 3);
                    groups++;
                }
            } else {
                TileType sequenceSuit = suit != null ? suit : SUITS[random.nextInt(SUITS.length)];
                int root = Tile.of(sequenceSuit, 1 + random.nextInt(7)).getOrdinal();
                if (remaining(used, root) >= 1 && remaining(used, root + 1) >= 1 && remaining(used, root + 2) >= 1) {
                    addCopies(tiles, used, root, 1);
                    addCopies(tiles, used, root + 1, 1);
                    addCopies(tiles, used, root + 2, 1);
                    groups++;
                }
            }
        }
        TileFactory.shuffle(tiles, random);
        return tiles;
    }

    private Tile randomKind(TileType suit) {
        if (suit == null) {
            List<Tile> kinds = TileFactory.functionalKinds();
            return kinds.get(random.nextInt(kinds.size()));
        }
        return Tile.of(suit, 1 + random.nextInt(9));
    }

    private int remaining(Map<Integer, Integer> used, int ordinal) {
        return 4 - used.getOrDefault(ordinal, 0);
    }

    private void addCopies(List<Tile> tiles, Map<Integer, Integer> used, int ordinal, int copies) {
        Tile tile = Tile.ofOrdinal(ordinal);
        for (int i = 0; i < copies; i++) {
            tiles.add(tile);
        }
        used.merge(ordinal, copies, Integer::sum);
    }

    /**
     * 生成的 13 张手牌和它等的那张牌
     */
    public static final class GeneratedHand {
        private final List<Tile> tiles;
        private final Tile waitingTile;

        public GeneratedHand(List<Tile> tiles, Tile waitingTile) {
            this.tiles = Collections.unmodifiableList(new ArrayList<>(tiles));
            this.waitingTile = waitingTile;
        }

        public List<Tile> getTiles() {
            return tiles;
        }

        public Tile getWaitingTile() {
            return waitingTile;
        }
    }
}
