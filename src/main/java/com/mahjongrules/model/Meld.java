package com.mahjongrules.model;

import com.mahjongrules.exception.MalformedHandException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 一组已成型的面子：吃碰杠得到的副露，或自己暗杠的四张牌
 */
public final class Meld {

    private final MeldType type;
    private final List<Tile> tiles;     // 组成面子的牌（已排序）
    private final Tile calledTile;      // 从别人牌河里叫来的那张，暗杠为 null

    public Meld(MeldType type, List<Tile> tiles, Tile calledTile) {
        if (type == null || tiles == null) {
            throw new MalformedHandException("面子类型和牌不能为空");
        }
        for (Tile tile : tiles) {
            if (tile == null || tile.isBonus()) {
                throw new MalformedHandException("面子里不能有空牌或花牌：" + tiles);
            }
        }
        List<Tile> sorted = new ArrayList<>(tiles);
        Collections.sort(sorted);
        validate(type, sorted, calledTile);
        this.type = type;
        this.tiles = Collections.unmodifiableList(sorted);
        this.calledTile = calledTile;
    }

    /**
     * 吃：打出的牌 + 手里两张
     */
    public static Meld chi(Tile calledTile, Tile first, Tile second) {
        return new Meld(MeldType.SEQUENCE, Arrays.asList(calledTile, first, second), calledTile);
    }

    /**
     * 碰
     */
    public static Meld pon(Tile calledTile) {
        return new Meld(MeldType.TRIPLET, Collections.nCopies(3, calledTile), calledTile);
    }

    /**
     * 明杠（杠别人打出的牌）
     */
    public static Meld claimedKong(Tile calledTile) {
        return new Meld(MeldType.QUAD, Collections.nCopies(4, calledTile), calledTile);
    }

    /**
     * 暗杠
     */
    public static Meld concealedKong(Tile tile) {
        return new Meld(MeldType.QUAD, Collections.nCopies(4, tile), null);
    }

    public MeldType getType() {
        return type;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public Tile getCalledTile() {
        return calledTile;
    }

    public int size() {
        return tiles.size();
    }

    /**
     * 面子的根：最小的那张牌的序号
     */
    public int getRoot() {
        return tiles.get(0).getOrdinal();
    }

    public boolean isQuad() {
        return type == MeldType.QUAD;
    }

    /**
     * 排好序的三张牌是否是同一数牌花色的连续顺子
     */
    static boolean isSequence(List<Tile> sorted) {
        return sorted.size() == 3 && sorted.get(0).isSuited()
                && sorted.get(0).getType() == sorted.get(2).getType()
                && sorted.get(1).getOrdinal() == sorted.get(0).getOrdinal() + 1
                && sorted.get(2).getOrdinal() == sorted.get(0).getOrdinal() + 2;
    }

    private static void validate(MeldType type, List<Tile> tiles, Tile calledTile) {
        switch (type) {
            case SEQUENCE:
                if (!isSequence(tiles)) {
                    throw new MalformedHandException("不是有效的顺子：" + tiles);
                }
                break;
            case TRIPLET:
                if (tiles.size() != 3 || !allSame(tiles)) {
                    throw new MalformedHandException("不是有效的刻子：" + tiles);
                }
                break;
            case QUAD:
                if (tiles.size() != 4 || !allSame(tiles)) {
                    throw new MalformedHandException("不是有效的杠：" + tiles);
                }
                break;
            default:
                throw new MalformedHandException("未知的面子类型：" + type);
        }
        if (calledTile != null && !tiles.contains(calledTile)) {
            throw new MalformedHandException("叫来的牌 " + calledTile + " 不在面子 " + tiles + " 中");
        }
    }

    private static boolean allSame(List<Tile> tiles) {
        return tiles.stream().allMatch(t -> t.equals(tiles.get(0)));
    }

    @Override
    public String toString() {
        return type + tiles.toString();
    }
}
