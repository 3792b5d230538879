package com.golfleague.leaderboard.repository;

import com.golfleague.leaderboard.model.HoleScoreRow;
import com.golfleague.leaderboard.model.LeaderboardRoundRow;
import com.golfleague.leaderboard.model.PlayerRoundRow;
import com.golfleague.leaderboard.model.Round;
import com.golfleague.leaderboard.model.TeamScoreRow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface LeaderboardRoundRepository extends ReactiveCrudRepository<Round, UUID> {

    @Query("""
        SELECT r.id AS round_id, r.user_id, p.first_name, p.last_name, r.total_score,
               r.course_handicap, p.current_handicap_index, c.total_par, r.played_date
        FROM rounds r
        LEFT JOIN profiles p ON p.id = r.user_id
        LEFT JOIN courses  c ON c.id = r.course_id
        WHERE r.event_id = :eventId
        ORDER BY r.total_score ASC
        """)
    Flux<LeaderboardRoundRow> findEventRounds(UUID eventId);

    /** Every round in the window, event or casual, oldest first. Bounds inclusive. */
    @Query("""
        SELECT r.id AS round_id, r.user_id, p.first_name, p.last_name, r.total_score,
               r.course_handicap, p.current_handicap_index, c.total_par, r.played_date
        FROM rounds r
        LEFT JOIN profiles p ON p.id = r.user_id
        LEFT JOIN courses  c ON c.id = r.course_id
        WHERE r.played_date BETWEEN :from AND :to
        ORDER BY r.played_date ASC
        """)
    Flux<LeaderboardRoundRow> findRoundsPlayedBetween(LocalDate from, LocalDate to);

    @Query("""
        SELECT r.id AS round_id, r.user_id, p.first_name, p.last_name, r.total_score,
               r.course_handicap, p.current_handicap_index, c.total_par, r.played_date
        FROM rounds r
        LEFT JOIN profiles p ON p.id = r.user_id
        LEFT JOIN courses  c ON c.id = r.course_id
        ORDER BY r.played_date ASC
        """)
    Flux<LeaderboardRoundRow> findAllRounds();

    /**
     * Event rounds of players on a team for the event's season. Players without a
     * team that season are not returned.
     */
    @Query("""
        SELECT t.id AS team_id, t.name AS team_name, r.user_id, r.total_score, r.course_handicap
        FROM rounds r
        JOIN events       e  ON e.id = r.event_id
        JOIN team_members tm ON tm.user_id = r.user_id
        JOIN teams        t  ON t.id = tm.team_id
                            AND t.season_year = CAST(EXTRACT(YEAR FROM e.event_date) AS INTEGER)
        WHERE r.event_id = :eventId
        ORDER BY t.name ASC
        """)
    Flux<TeamScoreRow> findTeamScores(UUID eventId);

    /** A player's rounds, newest first; same-day rounds by creation time, newest first. */
    @Query("""
        SELECT r.id AS round_id, r.total_score, r.played_date, c.name AS course_name
        FROM rounds r
        LEFT JOIN courses c ON c.id = r.course_id
        WHERE r.user_id = :userId
        ORDER BY r.played_date DESC, r.created_at DESC
        """)
    Flux<PlayerRoundRow> findPlayerRounds(UUID userId);

    @Query("""
        SELECT r.id AS round_id, r.total_score, r.played_date, c.name AS course_name
        FROM rounds r
        LEFT JOIN courses c ON c.id = r.course_id
        WHERE r.user_id = :userId
        ORDER BY r.played_date DESC, r.created_at DESC
        LIMIT :limit
        """)
    Flux<PlayerRoundRow> findRecentPlayerRounds(UUID userId, int limit);

    /** Every hole score the player has entered, across all rounds. */
    @Query("""
        SELECT s.strokes, h.par
        FROM scores s
        JOIN rounds r ON r.id = s.round_id
        JOIN holes  h ON h.id = s.hole_id
        WHERE r.user_id = :userId
        """)
    Flux<HoleScoreRow> findPlayerHoleScores(UUID userId);
}
