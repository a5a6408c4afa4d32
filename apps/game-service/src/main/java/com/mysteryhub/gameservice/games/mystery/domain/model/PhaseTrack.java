package com.mysteryhub.gameservice.games.mystery.domain.model;

import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 阶段推进表
 * ----------------------------------------
 * 固定的全序：lobby → character_select → script_reading → investigation
 *            → discussion → voting → reveal → ended
 *
 * 调整阶段顺序或增删阶段只需改这里的数据，推进逻辑只查表。
 */
public final class PhaseTrack {

    /** 阶段全序 */
    public static final List<GamePhase> ORDER = List.of(
            GamePhase.LOBBY,
            GamePhase.CHARACTER_SELECT,
            GamePhase.SCRIPT_READING,
            GamePhase.INVESTIGATION,
            GamePhase.DISCUSSION,
            GamePhase.VOTING,
            GamePhase.REVEAL,
            GamePhase.ENDED
    );

    /** 不能通过“推进阶段”离开的阶段：选角完成由开始游戏驱动，ended 为终态 */
    private static final Set<GamePhase> NOT_ADVANCEABLE =
            EnumSet.of(GamePhase.LOBBY, GamePhase.CHARACTER_SELECT, GamePhase.ENDED);

    /** 允许选角的阶段 */
    private static final Set<GamePhase> SELECTION_OPEN =
            EnumSet.of(GamePhase.LOBBY, GamePhase.CHARACTER_SELECT);

    /** 开始游戏后进入的第一个游戏阶段 */
    public static final GamePhase FIRST_GAMEPLAY_PHASE = GamePhase.SCRIPT_READING;

    private PhaseTrack() {
    }

    public static boolean isAdvanceable(GamePhase phase) {
        return !NOT_ADVANCEABLE.contains(phase);
    }

    public static boolean isSelectionOpen(GamePhase phase) {
        return SELECTION_OPEN.contains(phase);
    }

    /**
     * 下一个阶段；已是最后一个则为空
     */
    public static Optional<GamePhase> next(GamePhase phase) {
        int idx = ORDER.indexOf(phase);
        if (idx < 0 || idx >= ORDER.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(ORDER.get(idx + 1));
    }

    /**
     * phase 是否不早于 anchor（用于“复盘后才公开”之类的判断）
     */
    public static boolean isAtOrAfter(GamePhase phase, GamePhase anchor) {
        return ORDER.indexOf(phase) >= ORDER.indexOf(anchor);
    }

    public static boolean isTerminal(GamePhase phase) {
        return phase == ORDER.get(ORDER.size() - 1);
    }
}
