package com.commandertracker.common.segmentation;

import com.commandertracker.common.aggregation.PairRow;
import com.commandertracker.common.aggregation.PlayerRow;

import java.util.List;
import java.util.Map;

/**
 * Player and pair tables split by table size.
 *
 * <p>{@code sizes} is ascending; both maps iterate in the same order and hold one entry
 * per size.
 */
public record PodSizeSegments(
    List<Integer>                  sizes,
    Map<Integer, List<PlayerRow>>  playersBySize,
    Map<Integer, List<PairRow>>    pairsBySize
) {

    public static final PodSizeSegments EMPTY = new PodSizeSegments(List.of(), Map.of(), Map.of());
}
