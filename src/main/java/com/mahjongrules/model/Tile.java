package com.mahjongrules.model;

import com.mahjongrules.exception.InvalidTileException;

/**
 * 麻将牌（不可变值对象）
 * 同一序号的牌可以互相替换，序号是牌在规则核心与外部系统之间唯一的身份
 */
public final class Tile implements Comparable<Tile> {

    public static final int EAST = 401;
    public static final int SOUTH = 402;
    public static final int WEST = 403;
    public static final int NORTH = 404;
    public static final int RED_DRAGON = 501;
    public static final int GREEN_DRAGON = 502;
    public static final int WHITE_DRAGON = 503;

    private final TileType type;    // 牌类型
    private final int value;        // 点数

    private Tile(TileType type, int value) {
        this.type = type;
        this.value = value;
    }

    /**
     * 创建一张牌，花色/点数越界时抛出 InvalidTileException
     */
    public static Tile of(TileType type, int value) {
        if (type == null) {
            throw new InvalidTileException("牌类型不能为空");
        }
        if (value < 1 || value > type.getMaxRank()) {
            throw new InvalidTileException("点数越界：" + type + " " + value);
        }
        return new Tile(type, value);
    }

    /**
     * 根据序号（花色编号*100+点数）创建一张牌
     */
    public static Tile ofOrdinal(int ordinal) {
        TileType type = TileType.fromIndex(ordinal / 100);
        if (type == null) {
            throw new InvalidTileException("未知的牌序号：" + ordinal);
        }
        return of(type, ordinal % 100);
    }

    public TileType getType() {
        return type;
    }

    public int getValue() {
        return value;
    }

    public int getOrdinal() {
        return type.getIndex() * 100 + value;
    }

    public boolean isSuited() {
        return type.isSuited();
    }

    public boolean isHonor() {
        return type.isHonor();
    }

    public boolean isBonus() {
        return type.isBonus();
    }

    /**
     * 是否为幺九牌（数牌的1和9，以及所有字牌）
     */
    public boolean isTerminalOrHonor() {
        return isHonor() || (isSuited() && (value == 1 || value == 9));
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        switch (type) {
            case CHARACTERS:
                return value + "万";
            case CIRCLES:
                return value + "饼";
            case BAMBOOS:
                return value + "条";
            case WIND:
                return new String[]{"", "东", "南", "西", "北"}[value];
            case DRAGON:
                return new String[]{"", "中", "发", "白"}[value];
            case BLUE_BONUS:
                return "蓝花" + value;
            case RED_BONUS:
                return "红花" + value;
            default:
                return "未知";
        }
    }

    /**
     * 排序：按序号
     */
    @Override
    public int compareTo(Tile other) {
        return Integer.compare(getOrdinal(), other.getOrdinal());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile other = (Tile) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return getOrdinal();
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
