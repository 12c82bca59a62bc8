package com.commandertracker.stats.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of the {@code game} table. {@code playedAt} is stored without zone and read as UTC.
 */
@Data
@NoArgsConstructor
@Table("game")
public class GameRecord {

    @Id
    private Long id;

    private LocalDateTime playedAt;
    private String notes;
    private String winnerPlayer;
}
