package com.mahjongrules.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 手牌分析结果
 * 每次分析新建一个，返回后不再修改
 */
public final class HandAnalysisResult {

    // 和牌类型
    private final boolean winning;
    private final boolean traditional;
    private final boolean sevenPairs;
    private final boolean thirteenOrphans;

    // 牌型属性
    private final boolean pureSuit;
    private final boolean halfSuit;
    private final boolean fullyConcealed;
    private final boolean fullyExposed;

    private final int bonusTileCount;

    // 面子拆解明细（含副露）
    private final int pairOrdinal;
    private final int tripletCount;
    private final List<Integer> tripletOrdinals;
    private final int sequenceCount;
    private final List<Integer> sequenceRoots;

    private HandAnalysisResult(Builder builder) {
        this.winning = builder.winning;
        this.traditional = builder.traditional;
        this.sevenPairs = builder.sevenPairs;
        this.thirteenOrphans = builder.thirteenOrphans;
        this.pureSuit = builder.pureSuit;
        this.halfSuit = builder.halfSuit;
        this.fullyConcealed = builder.fullyConcealed;
        this.fullyExposed = builder.fullyExposed;
        this.bonusTileCount = builder.bonusTileCount;
        this.pairOrdinal = builder.pairOrdinal;
        this.tripletCount = builder.tripletCount;
        this.tripletOrdinals = Collections.unmodifiableList(new ArrayList<>(builder.tripletOrdinals));
        this.sequenceCount = builder.sequenceCount;
        this.sequenceRoots = Collections.unmodifiableList(new ArrayList<>(builder.sequenceRoots));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isWinning() {
        return winning;
    }

    public boolean isTraditional() {
        return traditional;
    }

    public boolean isSevenPairs() {
        return sevenPairs;
    }

    public boolean isThirteenOrphans() {
        return thirteenOrphans;
    }

    public boolean isPureSuit() {
        return pureSuit;
    }

    public boolean isHalfSuit() {
        return halfSuit;
    }

    public boolean isFullyConcealed() {
        return fullyConcealed;
    }

    public boolean isFullyExposed() {
        return fullyExposed;
    }

    public int getBonusTileCount() {
        return bonusTileCount;
    }

    /**
     * 将的序号，非面子结构和牌时为 0
     */
    public int getPairOrdinal() {
        return pairOrdinal;
    }

    public int getTripletCount() {
        return tripletCount;
    }

    public List<Integer> getTripletOrdinals() {
        return tripletOrdinals;
    }

    public int getSequenceCount() {
        return sequenceCount;
    }

    public List<Integer> getSequenceRoots() {
        return sequenceRoots;
    }

    /**
     * 互斥的和牌牌型：十三幺 > 七对 > 面子结构 > 清一色兜底
     */
    public WinShape getWinShape() {
        if (!winning) {
            return WinShape.NONE;
        }
        if (thirteenOrphans) {
            return WinShape.THIRTEEN_ORPHANS;
        }
        if (sevenPairs) {
            return WinShape.SEVEN_PAIRS;
        }
        if (traditional) {
            return WinShape.TRADITIONAL;
        }
        return WinShape.PURE_SUIT_FALLBACK;
    }

    @Override
    public String toString() {
        return "HandAnalysisResult{shape=" + getWinShape()
                + ", pair=" + pairOrdinal
                + ", triplets=" + tripletOrdinals
                + ", sequences=" + sequenceRoots
                + ", pure=" + pureSuit
                + ", half=" + halfSuit
                + ", bonus=" + bonusTileCount + "}";
    }

    public static final class Builder {
        private boolean winning;
        private boolean traditional;
        private boolean sevenPairs;
        private boolean thirteenOrphans;
        private boolean pureSuit;
        private boolean halfSuit;
        private boolean fullyConcealed;
        private boolean fullyExposed;
        private int bonusTileCount;
        private int pairOrdinal;
        private int tripletCount;
        private final List<Integer> tripletOrdinals = new ArrayList<>();
        private int sequenceCount;
        private final List<Integer> sequenceRoots = new ArrayList<>();

        private Builder() {
        }

        public Builder winning(boolean winning) {
            this.winning = winning;
            return this;
        }

        public Builder traditional(boolean traditional) {
            this.traditional = traditional;
            return this;
        }

        public Builder sevenPairs(boolean sevenPairs) {
            this.sevenPairs = sevenPairs;
            return this;
        }

        public Builder thirteenOrphans(boolean thirteenOrphans) {
            this.thirteenOrphans = thirteenOrphans;
            return this;
        }

        public Builder pureSuit(boolean pureSuit) {
            this.pureSuit = pureSuit;
            return this;
        }

        public Builder halfSuit(boolean halfSuit) {
            this.halfSuit = halfSuit;
            return this;
        }

        public Builder fullyConcealed(boolean fullyConcealed) {
            this.fullyConcealed = fullyConcealed;
            return this;
        }

        public Builder fullyExposed(boolean fullyExposed) {
            this.fullyExposed = fullyExposed;
            return this;
        }

        public Builder bonusTileCount(int bonusTileCount) {
            this.bonusTileCount = bonusTileCount;
            return this;
        }

        public Builder pairOrdinal(int pairOrdinal) {
            this.pairOrdinal = pairOrdinal;
            return this;
        }

        /**
         * 记一组刻子/杠，序号去重，数量不去重
         */
        public Builder addTriplet(int ordinal) {
            tripletCount++;
            if (!tripletOrdinals.contains(ordinal)) {
                tripletOrdinals.add(ordinal);
            }
            return this;
        }

        public Builder addSequence(int rootOrdinal) {
            sequenceCount++;
            sequenceRoots.add(rootOrdinal);
            return this;
        }

        public boolean isWinning() {
            return winning;
        }

        public boolean isTraditional() {
            return traditional;
        }

        public boolean isSevenPairs() {
            return sevenPairs;
        }

        public boolean isThirteenOrphans() {
            return thirteenOrphans;
        }

        public boolean isPureSuit() {
            return pureSuit;
        }

        public HandAnalysisResult build() {
            return new HandAnalysisResult(this);
        }
    }
}
