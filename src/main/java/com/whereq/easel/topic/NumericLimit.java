package com.whereq.easel.topic;

import lombok.Value;

/**
 * Inclusive bounds for one numeric parameter; either side may be open
 */
@Value
public class NumericLimit {

    Double min;

    Double max;

    public double clamp(double value) {
        double result = value;
        if (min != null) {
            result = Math.max(result, min);
        }
        if (max != null) {
            result = Math.min(result, max);
        }
        return result;
    }
}
