package com.commandertracker.stats.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Row of the {@code gameentry} table: one participant of one game.
 *
 * <p>{@code bracket} is mapped as text so that legacy values ("high", "7", blank) reach the
 * engine's tier normalizer instead of failing the read.
 */
@Data
@NoArgsConstructor
@Table("gameentry")
public class GameEntryRecord {

    @Id
    private Long id;

    private Long gameId;
    private String player;
    private String commander;
    private String bracket;
}
