package com.commandertracker.stats.repository;

import com.commandertracker.stats.model.GameRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface GameRecordRepository extends ReactiveCrudRepository<GameRecord, Long> {

    /** Every game in id order, so that the snapshot is stable between exports. */
    @Query("SELECT * FROM game ORDER BY id ASC")
    Flux<GameRecord> findAllOrderById();
}
