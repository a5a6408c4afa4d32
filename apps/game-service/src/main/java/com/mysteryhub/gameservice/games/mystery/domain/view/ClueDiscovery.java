package com.mysteryhub.gameservice.games.mystery.domain.view;

/**
 * 一次搜证的结果
 *
 * @param clue     命中的线索（含发现记录）
 * @param newlyFound true=本次首次发现并已广播；false=此前已被发现
 */
public record ClueDiscovery(ClueView clue, boolean newlyFound) {
}
