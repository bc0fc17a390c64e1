package com.wordhub.gameservice.games.scrabble.domain.constants;

/**
 * 拼字游戏相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 房间 ==========

    public static final String ROOM_NOT_FOUND = "房间不存在：%s";

    public static final String ROOM_FULL = "房间已满";

    public static final String ROOM_BUSY = "房间繁忙，请稍后再试";

    public static final String ROOM_NOT_READY = "房间人数不足，无法开始";

    public static final String LEAVE_NOT_ALLOWED = "对局已开始，不能离开房间";

    public static final String BOT_NOT_FOUND = "机器人不存在：%s";

    public static String formatRoomNotFound(String roomId) {
        return String.format(ROOM_NOT_FOUND, roomId);
    }

    public static String formatBotNotFound(String botId) {
        return String.format(BOT_NOT_FOUND, botId);
    }

    // ========== 对局状态 ==========

    public static final String GAME_NOT_ACTIVE = "对局未在进行中";

    public static final String NOT_YOUR_TURN = "还没轮到你";

    public static final String NOT_IN_ROOM = "你不在该房间中";

    // ========== 走子校验 ==========

    public static final String EMPTY_PLACEMENT = "至少需要摆放一张牌";

    public static final String OUT_OF_BOUNDS = "落点超出棋盘";

    public static final String CELL_OCCUPIED = "该格已有字母";

    public static final String DUPLICATE_CELL = "同一格不能摆两张牌";

    public static final String NOT_IN_LINE = "所有牌必须摆在同一行或同一列";

    public static final String HAS_GAP = "摆放的牌之间不能有空格";

    public static final String FIRST_MOVE_CENTER = "第一步必须覆盖中心格";

    public static final String NOT_CONNECTED = "必须与棋盘上已有的字母相连";

    public static final String NO_WORD_FORMED = "没有组成任何单词";

    public static final String RACK_MISMATCH = "字架中没有这些牌";

    public static final String INVALID_LETTER = "非法字母：%s";

    public static final String INVALID_WORD = "不是合法单词：%s";

    public static final String EXCHANGE_BAG_LOW = "牌袋少于 %d 张，不能换牌";

    public static final String EXCHANGE_EMPTY = "至少需要换一张牌";

    public static final String CHALLENGE_NOT_ALLOWED = "没有可以质疑的出牌";

    public static final String DICTIONARY_UNAVAILABLE = "词典 %s 暂不可用，请重试";

    public static String formatInvalidWord(String word) {
        return String.format(INVALID_WORD, word);
    }

    public static String formatInvalidLetter(String letter) {
        return String.format(INVALID_LETTER, letter);
    }

    public static String formatExchangeBagLow(int min) {
        return String.format(EXCHANGE_BAG_LOW, min);
    }

    public static String formatDictionaryUnavailable(String dictionaryId) {
        return String.format(DICTIONARY_UNAVAILABLE, dictionaryId);
    }
}
