package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("scores")
public class HoleScore {

    @Id
    private UUID id;

    private UUID roundId;

    private UUID holeId;

    private int strokes;
}
