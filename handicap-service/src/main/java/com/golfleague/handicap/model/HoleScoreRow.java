package com.golfleague.handicap.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read projection: one hole of a round joined with the hole's par.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoleScoreRow {

    private int holeNumber;

    private int strokes;

    private int par;
}
