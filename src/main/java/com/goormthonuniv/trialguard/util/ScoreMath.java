package com.goormthonuniv.trialguard.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ScoreMath {

    private ScoreMath() {}

    public static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /** Half-up rounding on the decimal representation, so 29.95 reports as 30.0. */
    public static double round(double v, int places) {
        return BigDecimal.valueOf(v).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
