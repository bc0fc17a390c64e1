package com.wordhub.gameservice.games.scrabble.interfaces.http.dto;

import com.wordhub.gameservice.games.scrabble.application.RoomOptions;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 建房请求；各字段可空，空则使用服务端默认值。
 */
@Data
public class CreateRoomRequest {

    private GameMode mode;

    private String dictionaryId;

    /** 每方初始用时（毫秒） */
    @Positive
    private Long initialClockMs;

    public RoomOptions toOptions() {
        return new RoomOptions(mode, dictionaryId, initialClockMs);
    }
}
