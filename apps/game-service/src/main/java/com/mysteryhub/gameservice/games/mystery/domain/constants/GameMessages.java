package com.mysteryhub.gameservice.games.mystery.domain.constants;

/**
 * 剧本杀对局相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   throw GameException.of(GameError.NOT_HOST, GameMessages.ONLY_HOST_CAN_START);
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 会话 / 剧本 ==========

    public static final String SESSION_NOT_FOUND = "房间不存在或已过期：%s";

    public static final String STORY_NOT_FOUND = "剧本不存在：%s";

    public static final String PLAYER_NOT_FOUND = "玩家不在该房间内";

    public static final String SESSION_FULL = "房间已满（最多 %d 人）";

    public static final String SESSION_ALREADY_STARTED = "游戏已开始，无法加入";

    public static final String GAME_ALREADY_STARTED = "游戏已开始";

    public static final String SESSION_CORRUPTED = "房间状态异常，已关闭，请重新创建房间";

    // ========== 玩家名 ==========

    public static final String NAME_REQUIRED = "玩家名不能为空";

    public static final String NAME_TOO_LONG = "玩家名最多 %d 个字符";

    // ========== 选角 ==========

    public static final String CHARACTER_NOT_FOUND = "角色不存在：%s";

    public static final String CHARACTER_TAKEN = "该角色已被其他玩家选择";

    public static final String SELECTION_CLOSED = "当前阶段不能选择角色";

    public static final String NO_CHARACTER_SELECTED = "尚未选择角色";

    // ========== 房主操作 ==========

    public static final String ONLY_HOST_CAN_START = "只有房主可以开始游戏";

    public static final String ONLY_HOST_CAN_ADVANCE = "只有房主可以推进阶段";

    public static final String PLAYERS_NOT_READY = "还有玩家未选择角色，或人数不足（至少 %d 人）";

    public static final String PHASE_NOT_ADVANCEABLE = "当前阶段（%s）不能推进";

    // ========== 搜证 / 投票 / 聊天 ==========

    public static final String SEARCH_ONLY_IN_INVESTIGATION = "只能在搜证阶段搜索线索";

    public static final String VOTE_ONLY_IN_VOTING = "只能在投票阶段投票";

    public static final String CHAT_EMPTY = "消息内容不能为空";

    public static String format(String template, Object... args) {
        return String.format(template, args);
    }
}
