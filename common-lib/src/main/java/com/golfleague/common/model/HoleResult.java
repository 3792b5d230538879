package com.golfleague.common.model;

/**
 * Strokes taken on one hole against that hole's par.
 */
public record HoleResult(int strokes, int par) {

    public int relativeToPar() {
        return strokes - par;
    }
}
