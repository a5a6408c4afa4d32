package com.mysteryhub.gameservice.games.mystery.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueDiscovery;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueView;

import java.util.Optional;

/**
 * 搜证结果：found=false 表示该处没有线索
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(boolean found, boolean newlyFound, ClueView clue) {

    public static SearchResponse of(Optional<ClueDiscovery> discovery) {
        return discovery
                .map(d -> new SearchResponse(true, d.newlyFound(), d.clue()))
                .orElseGet(() -> new SearchResponse(false, false, null));
    }
}
