package com.mahjongrules.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 玩家手牌快照
 * 由外部的回合管理系统持有和修改，规则核心只读取
 */
public class Hand {
    private List<Tile> concealedTiles;      // 暗牌
    private Tile drawnTile;                 // 刚摸到、尚未并入暗牌的牌
    private List<Meld> selfQuads;           // 暗杠
    private List<Meld> exposedMelds;        // 副露（吃、碰、明杠）
    private List<Tile> bonusTiles;          // 补的花牌

    public Hand() {
        this.concealedTiles = new ArrayList<>();
        this.selfQuads = new ArrayList<>();
        this.exposedMelds = new ArrayList<>();
        this.bonusTiles = new ArrayList<>();
    }

    /**
     * 按序号构造只有暗牌的手牌
     */
    public static Hand ofOrdinals(int... ordinals) {
        Hand hand = new Hand();
        for (int ordinal : ordinals) {
            hand.addTile(Tile.ofOrdinal(ordinal));
        }
        return hand;
    }

    public List<Tile> getConcealedTiles() {
        return concealedTiles;
    }

    public void setConcealedTiles(List<Tile> concealedTiles) {
        requireList(concealedTiles, "concealedTiles");
        this.concealedTiles = concealedTiles;
    }

    public Tile getDrawnTile() {
        return drawnTile;
    }

    public void setDrawnTile(Tile drawnTile) {
        this.drawnTile = drawnTile;
    }

    public List<Meld> getSelfQuads() {
        return selfQuads;
    }

    public void setSelfQuads(List<Meld> selfQuads) {
        requireList(selfQuads, "selfQuads");
        this.selfQuads = selfQuads;
    }

    public List<Meld> getExposedMelds() {
        return exposedMelds;
    }

    public void setExposedMelds(List<Meld> exposedMelds) {
        requireList(exposedMelds, "exposedMelds");
        this.exposedMelds = exposedMelds;
    }

    public List<Tile> getBonusTiles() {
        return bonusTiles;
    }

    public void setBonusTiles(List<Tile> bonusTiles) {
        requireList(bonusTiles, "bonusTiles");
        this.bonusTiles = bonusTiles;
    }

    /**
     * 添加暗牌
     */
    public void addTile(Tile tile) {
        concealedTiles.add(tile);
    }

    /**
     * 添加副露
     */
    public void addExposedMeld(Meld meld) {
        exposedMelds.add(meld);
    }

    /**
     * 添加暗杠
     */
    public void addSelfQuad(Meld quad) {
        selfQuads.add(quad);
    }

    /**
     * 补花
     */
    public void addBonusTile(Tile tile) {
        bonusTiles.add(tile);
    }

    /**
     * 暗牌 + 摸到的牌
     */
    public List<Tile> getConcealedWithDrawn() {
        List<Tile> tiles = new ArrayList<>(concealedTiles);
        if (drawnTile != null) {
            tiles.add(drawnTile);
        }
        return tiles;
    }

    /**
     * 所有参与牌型的牌（暗牌、摸牌、暗杠、副露，不含花牌）
     */
    public List<Tile> getFunctionalTiles() {
        List<Tile> tiles = new ArrayList<>();
        for (Tile tile : getConcealedWithDrawn()) {
            if (!tile.isBonus()) {
                tiles.add(tile);
            }
        }
        for (Meld quad : selfQuads) {
            tiles.addAll(quad.getTiles());
        }
        for (Meld meld : exposedMelds) {
            tiles.addAll(meld.getTiles());
        }
        return tiles;
    }

    /**
     * 已成型的面子数（暗杠 + 副露）
     */
    public int getDeclaredGroupCount() {
        return selfQuads.size() + exposedMelds.size();
    }

    /**
     * 明杠数量
     */
    public int getClaimedQuadCount() {
        return (int) exposedMelds.stream().filter(Meld::isQuad).count();
    }

    /**
     * 复制一份手牌，原手牌不受影响
     */
    public Hand copy() {
        Hand copy = new Hand();
        copy.concealedTiles = new ArrayList<>(concealedTiles);
        copy.drawnTile = drawnTile;
        copy.selfQuads = new ArrayList<>(selfQuads);
        copy.exposedMelds = new ArrayList<>(exposedMelds);
        copy.bonusTiles = new ArrayList<>(bonusTiles);
        return copy;
    }

    private static void requireList(List<?> list, String name) {
        if (list == null) {
            throw new IllegalArgumentException(name + " 不能为 null");
        }
    }
}
