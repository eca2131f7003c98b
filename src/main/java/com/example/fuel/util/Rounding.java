package com.example.fuel.util;

public final class Rounding {

    private Rounding() {
    }

    /** Rounds half-up to two decimal places. */
    public static double cents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
