package com.dcruver.vaultdrift.domain;

import java.util.Arrays;

/**
 * Session embedding of a note: weighted semantic part followed by the temporal features.
 */
public final class Embedding {

    private final double[] values;
    private final int semanticDimension;

    public Embedding(double[] values, int semanticDimension) {
        if (semanticDimension < 0 || semanticDimension > values.length) {
            throw new IllegalArgumentException(
                "Semantic dimension " + semanticDimension + " outside vector of length " + values.length);
        }
        this.values = values.clone();
        this.semanticDimension = semanticDimension;
    }

    public double[] values() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public int semanticDimension() {
        return semanticDimension;
    }

    public double[] semantic() {
        return Arrays.copyOfRange(values, 0, semanticDimension);
    }

    public double[] temporal() {
        return Arrays.copyOfRange(values, semanticDimension, values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Embedding)) {
            return false;
        }
        Embedding other = (Embedding) o;
        return semanticDimension == other.semanticDimension && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + semanticDimension;
    }

    @Override
    public String toString() {
        return "Embedding[dim=" + values.length + ", semantic=" + semanticDimension + "]";
    }
}
