package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("courses")
public class Course {

    @Id
    private UUID id;

    private String name;

    private Integer totalPar;
}
