package com.commandertracker.stats.repository;

import com.commandertracker.stats.model.GameEntryRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface GameEntryRecordRepository extends ReactiveCrudRepository<GameEntryRecord, Long> {

    /**
     * Every entry grouped by game, in insertion order within a game.
     * {@code bracket} is cast to text whatever its column type.
     */
    @Query("""
        SELECT id, game_id, player, commander, CAST(bracket AS TEXT) AS bracket
        FROM gameentry
        ORDER BY game_id ASC, id ASC
        """)
    Flux<GameEntryRecord> findAllOrderByGame();
}
