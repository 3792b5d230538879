package com.golfleague.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoleScoreRow {

    private int strokes;

    private int par;
}
