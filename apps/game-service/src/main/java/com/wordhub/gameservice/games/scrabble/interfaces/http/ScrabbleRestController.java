package com.wordhub.gameservice.games.scrabble.interfaces.http;

import com.wordhub.gameservice.games.scrabble.application.RoomOptions;
import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.RackView;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;
import com.wordhub.gameservice.games.scrabble.interfaces.http.dto.CreateRoomRequest;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.MoveCommandConverter;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.MoveCmd;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import com.wordhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 拼字游戏 http 接口。
 * 调用方身份由身份协作方放在 X-Player-Id 头中。
 * 状态变化同样会经房间事件推送到 /topic/room.{roomId}。
 */
@RestController
@RequestMapping("/api/scrabble")
@RequiredArgsConstructor
public class ScrabbleRestController {

    static final String PLAYER_HEADER = "X-Player-Id";

    private final ScrabbleService svc;

    /**
     * 新建等待中的房间（不自动入座）。
     */
    @PostMapping("/rooms")
    public ResponseEntity<ApiResponse<RoomView>> createRoom(@Valid @RequestBody(required = false) CreateRoomRequest req) {
        RoomOptions options = req == null ? RoomOptions.defaults() : req.toOptions();
        return ResponseEntity.ok(ApiResponse.success(svc.createRoom(options)));
    }

    @PostMapping("/rooms/{roomId}/join")
    public ResponseEntity<ApiResponse<RoomView>> join(@PathVariable String roomId,
                                                      @RequestHeader(PLAYER_HEADER) String playerId,
                                                      @RequestParam(name = "displayName", required = false) String displayName) {
        return ResponseEntity.ok(ApiResponse.success(svc.join(roomId, playerId, displayName)));
    }

    /**
     * 快速匹配：进最早的可加入房间或新建一个。
     */
    @PostMapping("/rooms/quick-join")
    public ResponseEntity<ApiResponse<RoomView>> quickJoin(@RequestHeader(PLAYER_HEADER) String playerId,
                                                           @RequestParam(name = "displayName", required = false) String displayName) {
        return ResponseEntity.ok(ApiResponse.success(svc.quickJoin(playerId, displayName)));
    }

    @PostMapping("/rooms/{roomId}/bots/{botId}")
    public ResponseEntity<ApiResponse<RoomView>> attachBot(@PathVariable String roomId, @PathVariable String botId) {
        return ResponseEntity.ok(ApiResponse.success(svc.attachBot(roomId, botId)));
    }

    @PostMapping("/rooms/{roomId}/leave")
    public ResponseEntity<ApiResponse<Void>> leave(@PathVariable String roomId,
                                                   @RequestHeader(PLAYER_HEADER) String playerId) {
        svc.leave(roomId, playerId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    @PostMapping("/rooms/{roomId}/start")
    public ResponseEntity<ApiResponse<RoomView>> start(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(svc.start(roomId)));
    }

    @PostMapping("/rooms/{roomId}/moves")
    public ResponseEntity<ApiResponse<Move>> move(@PathVariable String roomId,
                                                  @RequestHeader(PLAYER_HEADER) String playerId,
                                                  @RequestBody MoveCmd cmd) {
        return ResponseEntity.ok(ApiResponse.success(svc.submitMove(roomId, MoveCommandConverter.toCommand(playerId, cmd))));
    }

    @PostMapping("/rooms/{roomId}/pass")
    public ResponseEntity<ApiResponse<Move>> pass(@PathVariable String roomId,
                                                  @RequestHeader(PLAYER_HEADER) String playerId) {
        return ResponseEntity.ok(ApiResponse.success(svc.pass(roomId, playerId)));
    }

    @PostMapping("/rooms/{roomId}/resign")
    public ResponseEntity<ApiResponse<RoomView>> resign(@PathVariable String roomId,
                                                        @RequestHeader(PLAYER_HEADER) String playerId) {
        return ResponseEntity.ok(ApiResponse.success(svc.resign(roomId, playerId)));
    }

    /** 运维暂停：冻结双方时钟 */
    @PostMapping("/rooms/{roomId}/pause")
    public ResponseEntity<ApiResponse<RoomView>> pause(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(svc.pause(roomId)));
    }

    @PostMapping("/rooms/{roomId}/resume")
    public ResponseEntity<ApiResponse<RoomView>> resume(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(svc.resume(roomId)));
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<ApiResponse<RoomView>> view(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(svc.getRoom(roomId)));
    }

    /** 只返回调用方本人的字架 */
    @GetMapping("/rooms/{roomId}/rack")
    public ResponseEntity<ApiResponse<RackView>> rack(@PathVariable String roomId,
                                                      @RequestHeader(PLAYER_HEADER) String playerId) {
        return ResponseEntity.ok(ApiResponse.success(svc.getRack(roomId, playerId)));
    }

    @GetMapping("/rooms")
    public ResponseEntity<ApiResponse<List<RoomView>>> rooms() {
        return ResponseEntity.ok(ApiResponse.success(svc.listRooms()));
    }

    @GetMapping("/bots")
    public ResponseEntity<ApiResponse<List<BotProfile>>> bots() {
        return ResponseEntity.ok(ApiResponse.success(svc.listBots()));
    }
}
