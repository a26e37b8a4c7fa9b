package com.mahjongrules.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 计分结果：总分 + 逐项明细
 */
public final class ScoreResult {

    private final int points;
    private final List<String> breakdown;

    public ScoreResult(int points, List<String> breakdown) {
        this.points = points;
        this.breakdown = Collections.unmodifiableList(new ArrayList<>(breakdown));
    }

    public static ScoreResult zero() {
        return new ScoreResult(0, Collections.emptyList());
    }

    public int getPoints() {
        return points;
    }

    public List<String> getBreakdown() {
        return breakdown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreResult)) {
            return false;
        }
        ScoreResult other = (ScoreResult) o;
        return points == other.points && breakdown.equals(other.breakdown);
    }

    @Override
    public int hashCode() {
        return 31 * points + breakdown.hashCode();
    }

    @Override
    public String toString() {
        return points + " " + breakdown;
    }
}
