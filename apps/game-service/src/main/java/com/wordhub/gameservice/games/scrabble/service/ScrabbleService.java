package com.wordhub.gameservice.games.scrabble.service;

import com.wordhub.gameservice.games.scrabble.application.RoomOptions;
import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.RackView;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;

import java.util.List;
import java.util.Optional;

/**
 * 拼字对局服务：传输层（STOMP/REST）与调度器的唯一入口。
 * 所有失败以 GameException 抛出，错误码见 ErrorCode。
 */
public interface ScrabbleService {

    /** 新建等待中的房间 */
    RoomView createRoom(RoomOptions options);

    /** 人类玩家入座；已在座视为重连 */
    RoomView join(String roomId, String userId, String displayName);

    /** 快速匹配：坐进最早的可加入房间，没有则新建 */
    RoomView quickJoin(String userId, String displayName);

    /** 把目录中的机器人放进房间 */
    RoomView attachBot(String roomId, String botId);

    /** 等待中离开；房间空了即销毁 */
    void leave(String roomId, String userId);

    RoomView start(String roomId);

    /**
     * 提交一步（出牌/换牌/弃权/质疑），cmd.playerId 为调用方身份。
     */
    Move submitMove(String roomId, MoveCommand cmd);

    Move pass(String roomId, String playerId);

    RoomView resign(String roomId, String playerId);

    RoomView pause(String roomId);

    RoomView resume(String roomId);

    /** 心跳：标记在线并私发 PONG */
    void heartbeat(String roomId, String playerId);

    /** 连接断开：标记离线，超过宽限期由周期驱动判负 */
    void playerDisconnected(String roomId, String playerId);

    /** 周期驱动：结算时钟并推送同步 */
    RoomStatus tick(String roomId);

    /**
     * 机器人提交：房间版本不是 epoch 时不做任何事并返回 empty。
     */
    Optional<Move> submitBotMove(String roomId, long epoch, MoveCommand cmd);

    RoomView getRoom(String roomId);

    /** 只有本人可以查看自己的字架 */
    RackView getRack(String roomId, String playerId);

    List<RoomView> listRooms();

    List<BotProfile> listBots();
}
