package me.golemcore.careergraph.adapter.inbound.web.controller;

/**
 * Rounding applied to scores at the HTTP boundary.
 */
final class Scores {

    private Scores() {
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
