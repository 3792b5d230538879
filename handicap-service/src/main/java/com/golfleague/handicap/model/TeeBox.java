package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("tee_boxes")
public class TeeBox {

    @Id
    private UUID id;

    private UUID courseId;

    private String name;

    private Double courseRating;

    private Integer slopeRating;
}
