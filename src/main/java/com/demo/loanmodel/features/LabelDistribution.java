package com.demo.loanmodel.features;

public record LabelDistribution(long rejected, long approved) {

    public static LabelDistribution of(int[] labels) {
        long approved = 0;
        for (int l : labels) if (l == 1) approved++;
        return new LabelDistribution(labels.length - approved, approved);
    }

    public long total() {
        return rejected + approved;
    }

    /** Exactly one label value occurs. */
    public boolean isDegenerate() {
        return (rejected == 0) != (approved == 0);
    }

    @Override
    public String toString() {
        return "{0=" + rejected + ", 1=" + approved + "}";
    }
}
