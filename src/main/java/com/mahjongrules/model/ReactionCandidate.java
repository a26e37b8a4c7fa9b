package com.mahjongrules.model;

/**
 * 某个座位对一张打出的牌表态
 */
public final class ReactionCandidate {

    private final int seat;
    private final ReactionType type;
    private final ChiOption chiOption;  // 只有吃牌时才有

    private ReactionCandidate(int seat, ReactionType type, ChiOption chiOption) {
        if (type == null) {
            throw new IllegalArgumentException("反应类型不能为空");
        }
        this.seat = seat;
        this.type = type;
        this.chiOption = chiOption;
    }

    public static ReactionCandidate pass(int seat) {
        return new ReactionCandidate(seat, ReactionType.PASS, null);
    }

    public static ReactionCandidate pon(int seat) {
        return new ReactionCandidate(seat, ReactionType.PON, null);
    }

    public static ReactionCandidate kong(int seat) {
        return new ReactionCandidate(seat, ReactionType.KONG, null);
    }

    public static ReactionCandidate ron(int seat) {
        return new ReactionCandidate(seat, ReactionType.RON, null);
    }

    public static ReactionCandidate chi(int seat, ChiOption option) {
        return new ReactionCandidate(seat, ReactionType.CHI, option);
    }

    public static ReactionCandidate of(int seat, ReactionType type) {
        return new ReactionCandidate(seat, type, null);
    }

    public int getSeat() {
        return seat;
    }

    public ReactionType getType() {
        return type;
    }

    public ChiOption getChiOption() {
        return chiOption;
    }

    public boolean isPass() {
        return type == ReactionType.PASS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReactionCandidate)) {
            return false;
        }
        ReactionCandidate other = (ReactionCandidate) o;
        return seat == other.seat && type == other.type
                && (chiOption == null ? other.chiOption == null : chiOption.equals(other.chiOption));
    }

    @Override
    public int hashCode() {
        return (seat * 31 + type.hashCode()) * 31 + (chiOption == null ? 0 : chiOption.hashCode());
    }

    @Override
    public String toString() {
        return "座位" + seat + ":" + type + (chiOption == null ? "" : " " + chiOption);
    }
}
