package com.mahjongrules.engine;

import com.mahjongrules.model.Tile;
import com.mahjongrules.model.TileType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 麻将牌工厂 - 牌种枚举、整副牌和洗牌
 */
public class TileFactory {

    /**
     * 十三幺需要的 13 种幺九牌
     */
    public static final List<Integer> THIRTEEN_ORPHAN_ORDINALS = List.of(
            101, 109, 201, 209, 301, 309,
            401, 402, 403, 404,
            501, 502, 503);

    private static final List<Tile> FUNCTIONAL_KINDS = buildFunctionalKinds();
    private static final List<Tile> BONUS_TILES = buildBonusTiles();

    /**
     * 34 种参与牌型的牌（万饼条 1-9、东南西北、中发白），按序号升序
     */
    public static List<Tile> functionalKinds() {
        return FUNCTIONAL_KINDS;
    }

    /**
     * 8 张花牌（蓝花 1-4、红花 1-4）
     */
    public static List<Tile> bonusTiles() {
        return BONUS_TILES;
    }

    /**
     * 创建一副完整的牌（144张）
     * 34 种牌各 4 张（136张）
     * 蓝花、红花各 1-4（共8张花牌）
     */
    public static List<Tile> createFullDeck() {
        List<Tile> tiles = new ArrayList<>();
        for (Tile kind : FUNCTIONAL_KINDS) {
            for (int count = 0; count < 4; count++) {
                tiles.add(kind);
            }
        }
        tiles.addAll(BONUS_TILES);
        return tiles;
    }

    /**
     * 洗牌
     */
    public static void shuffle(List<Tile> tiles, Random random) {
        Collections.shuffle(tiles, random);
    }

    /**
     * 创建并洗好的牌墙
     */
    public static List<Tile> createAndShuffleWall(Random random) {
        List<Tile> tiles = createFullDeck();
        shuffle(tiles, random);
        return tiles;
    }

    private static List<Tile> buildFunctionalKinds() {
        List<Tile> result = new ArrayList<>();
        for (TileType type : TileType.values()) {
            if (type.isBonus()) {
                continue;
            }
            for (int value = 1; value <= type.getMaxRank(); value++) {
                result.add(Tile.of(type, value));
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static List<Tile> buildBonusTiles() {
        List<Tile> result = new ArrayList<>();
        for (TileType type : new TileType[]{TileType.BLUE_BONUS, TileType.RED_BONUS}) {
            for (int value = 1; value <= type.getMaxRank(); value++) {
                result.add(Tile.of(type, value));
            }
        }
        return Collections.unmodifiableList(result);
    }
}
