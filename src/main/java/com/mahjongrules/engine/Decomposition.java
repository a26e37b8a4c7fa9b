package com.mahjongrules.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一种有效的面子拆法：将 + 刻子根 + 顺子根
 * 每层递归返回新的对象，不修改已有对象
 */
public final class Decomposition {

    private static final Decomposition EMPTY =
            new Decomposition(0, Collections.emptyList(), Collections.emptyList());

    private final int pairOrdinal;
    private final List<Integer> tripletRoots;
    private final List<Integer> sequenceRoots;

    private Decomposition(int pairOrdinal, List<Integer> tripletRoots, List<Integer> sequenceRoots) {
        this.pairOrdinal = pairOrdinal;
        this.tripletRoots = Collections.unmodifiableList(tripletRoots);
        this.sequenceRoots = Collections.unmodifiableList(sequenceRoots);
    }

    static Decomposition empty() {
        return EMPTY;
    }

    Decomposition withTriplet(int root) {
        List<Integer> triplets = new ArrayList<>();
        triplets.add(root);
        triplets.addAll(tripletRoots);
        return new Decomposition(pairOrdinal, triplets, sequenceRoots);
    }

    Decomposition withSequence(int root) {
        List<Integer> sequences = new ArrayList<>();
        sequences.add(root);
        sequences.addAll(sequenceRoots);
        return new Decomposition(pairOrdinal, tripletRoots, sequences);
    }

    Decomposition withPair(int ordinal) {
        return new Decomposition(ordinal, tripletRoots, sequenceRoots);
    }

    /**
     * 将的序号，没有将时为 0
     */
    public int getPairOrdinal() {
        return pairOrdinal;
    }

    public boolean hasPair() {
        return pairOrdinal != 0;
    }

    public List<Integer> getTripletRoots() {
        return tripletRoots;
    }

    public List<Integer> getSequenceRoots() {
        return sequenceRoots;
    }

    public int getSetCount() {
        return tripletRoots.size() + sequenceRoots.size();
    }

    @Override
    public String toString() {
        return "将=" + pairOrdinal + " 刻=" + tripletRoots + " 顺=" + sequenceRoots;
    }
}
