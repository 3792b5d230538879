package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

/**
 * League member profile. Only the handicap-related columns are mapped here.
 *
 * <p>{@code handicapVersion} increments on every index write and is the
 * compare-and-swap token guarding concurrent recomputes for the same player.
 */
@Data
@NoArgsConstructor
@Table("profiles")
public class Profile {

    @Id
    private UUID id;

    private String firstName;

    private String lastName;

    private String role;

    /** Null until five rounds have been posted. */
    private Double currentHandicapIndex;

    private Long handicapVersion;
}
