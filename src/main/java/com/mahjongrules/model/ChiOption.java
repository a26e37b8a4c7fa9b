package com.mahjongrules.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一种吃法：打出的牌 + 手里的两张牌组成顺子
 */
public final class ChiOption {

    private final Tile discardedTile;
    private final Tile firstHandTile;
    private final Tile secondHandTile;

    public ChiOption(Tile discardedTile, Tile firstHandTile, Tile secondHandTile) {
        if (discardedTile == null || firstHandTile == null || secondHandTile == null) {
            throw new IllegalArgumentException("吃法的三张牌不能为空");
        }
        this.discardedTile = discardedTile;
        this.firstHandTile = firstHandTile;
        this.secondHandTile = secondHandTile;
        if (!Meld.isSequence(getSequenceSorted())) {
            throw new IllegalArgumentException("吃法组不成顺子：" + getSequenceSorted());
        }
    }

    public Tile getDiscardedTile() {
        return discardedTile;
    }

    public Tile getFirstHandTile() {
        return firstHandTile;
    }

    public Tile getSecondHandTile() {
        return secondHandTile;
    }

    /**
     * 顺子的三张牌（已排序）
     */
    public List<Tile> getSequenceSorted() {
        List<Tile> tiles = new ArrayList<>();
        tiles.add(discardedTile);
        tiles.add(firstHandTile);
        tiles.add(secondHandTile);
        Collections.sort(tiles);
        return tiles;
    }

    /**
     * 吃成之后的副露
     */
    public Meld toMeld() {
        return Meld.chi(discardedTile, firstHandTile, secondHandTile);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChiOption)) {
            return false;
        }
        ChiOption other = (ChiOption) o;
        return discardedTile.equals(other.discardedTile)
                && firstHandTile.equals(other.firstHandTile)
                && secondHandTile.equals(other.secondHandTile);
    }

    @Override
    public int hashCode() {
        return (discardedTile.hashCode() * 31 + firstHandTile.hashCode()) * 31 + secondHandTile.hashCode();
    }

    @Override
    public String toString() {
        return "吃" + getSequenceSorted();
    }
}
