package com.demo.loanmodel.export;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/** Written as a flat array: the scaled features followed by the integer label. */
public record TrainingRow(double[] features, int label) {

    @JsonValue
    public List<Number> values() {
        List<Number> out = new ArrayList<>(features.length + 1);
        for (double f : features) out.add(f);
        out.add(label);
        return out;
    }
}
