package com.wordhub.gameservice.games.scrabble.interfaces.ws.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 -> 后端：/app/scrabble.* 指令；
 * 后端 -> 前端：/topic/room.{roomId} 广播与 /user/queue/scrabble.* 私信。
 */
public class ScrabbleMessages {

    /**
     * 入座（客户端 → 服务端）
     * roomId 为空时走快速匹配。
     */
    @Data
    public static class JoinCmd {
        private String roomId;
        private String displayName;
    }

    /**
     * 只带房间号的简单命令：开始、弃权、认输、心跳。
     */
    @Data
    public static class RoomCmd {
        private String roomId;
    }

    /**
     * 走子命令（客户端 → 服务端）
     * ---------------------------------------------
     *   - type      ：PLAY / EXCHANGE / PASS / CHALLENGE；
     *   - placements：PLAY 时摆放的牌；
     *   - exchange  ：EXCHANGE 时要换掉的字架符号（空白牌为 '_'）。
     */
    @Data
    public static class MoveCmd {
        private String roomId;
        private String type;
        private List<PlacementDto> placements = new ArrayList<>();
        private List<Character> exchange = new ArrayList<>();
    }

    /**
     * 一张摆放的牌；blank=true 时 letter 为空白牌代表的字母。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlacementDto {
        private int row;
        private int col;
        private char letter;
        private boolean blank;
    }

    /**
     * 广播事件（服务端 → 客户端）
     *   - type   ：STATE / MOVE / TURN / TIMER_SYNC / TIMER_EXPIRED / GAME_COMPLETED / RACK / PONG / ERROR；
     *   - payload：事件内容。
     */
    @Data
    public static class BroadcastEvent {
        private String roomId;
        private String type;
        private Object payload;
    }

    /**
     * 只发给提交者本人的错误。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorPayload {
        private String code;
        private String message;
        private String detail;
    }
}
