package com.wordhub.gameservice.games.scrabble.interfaces.ws;

import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlacedTile;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.ErrorPayload;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.JoinCmd;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.MoveCmd;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.PlacementDto;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.RoomCmd;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import com.wordhub.gameservice.platform.ws.PlayerPrincipal;
import com.wordhub.gameservice.platform.ws.RoomSessionTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrabbleWsControllerTest {

    private final ScrabbleService service = mock(ScrabbleService.class);
    private final RoomEventSink sink = mock(RoomEventSink.class);
    private RoomSessionTracker tracker;
    private ScrabbleWsController controller;
    private SimpMessageHeaderAccessor sha;

    @BeforeEach
    void setUp() {
        tracker = new RoomSessionTracker(service);
        controller = new ScrabbleWsController(service, sink, tracker);
        sha = SimpMessageHeaderAccessor.create();
        sha.setUser(new PlayerPrincipal("alice"));
        sha.setSessionId("s-1");
    }

    @Test
    void blankRoomIdMeansQuickMatch() {
        RoomView view = mock(RoomView.class);
        when(view.roomId()).thenReturn("r-9");
        when(service.quickJoin("alice", "Alice")).thenReturn(view);
        JoinCmd cmd = new JoinCmd();
        cmd.setDisplayName("Alice");

        controller.join(cmd, sha);

        assertThat(tracker.bindings("s-1")).containsExactly(new RoomSessionTracker.Binding("r-9", "alice"));
    }

    @Test
    void moveUsesConnectionIdentityAndNormalisesLetters() {
        MoveCmd cmd = new MoveCmd();
        cmd.setRoomId("r-1");
        cmd.setType("play");
        cmd.setPlacements(List.of(new PlacementDto(7, 7, 'c', false), new PlacementDto(7, 8, 'a', true)));

        controller.move(cmd, sha);

        ArgumentCaptor<MoveCommand> captor = ArgumentCaptor.forClass(MoveCommand.class);
        verify(service).submitMove(eq("r-1"), captor.capture());
        MoveCommand sent = captor.getValue();
        assertThat(sent.playerId()).isEqualTo("alice");
        assertThat(sent.type()).isEqualTo(MoveType.PLAY);
        assertThat(sent.placements()).containsExactly(PlacedTile.of(7, 7, 'C'), PlacedTile.blank(7, 8, 'A'));
    }

    @Test
    void rejectionGoesPrivatelyToSubmitter() {
        when(service.pass("r-1", "alice"))
                .thenThrow(new GameException(ErrorCode.NOT_YOUR_TURN, "not your turn"));
        RoomCmd cmd = new RoomCmd();
        cmd.setRoomId("r-1");

        controller.pass(cmd, sha);

        RoomEvent event = singlePublished();
        assertThat(event.type()).isEqualTo(RoomEventType.ERROR);
        assertThat(event.recipient()).isEqualTo("alice");
        assertThat(((ErrorPayload) event.payload()).getCode()).isEqualTo("NOT_YOUR_TURN");
    }

    @Test
    void malformedMoveIsBadRequest() {
        MoveCmd cmd = new MoveCmd();
        cmd.setRoomId("r-1");
        cmd.setType("shuffle");

        controller.move(cmd, sha);

        verify(service, never()).submitMove(any(), any());
        assertThat(((ErrorPayload) singlePublished().payload()).getCode()).isEqualTo("BAD_REQUEST");
    }

    @Test
    void pingRefreshesPresenceAndBindsSession() {
        RoomCmd cmd = new RoomCmd();
        cmd.setRoomId("r-1");

        controller.ping(cmd, sha);

        verify(service).heartbeat("r-1", "alice");
        assertThat(tracker.bindings("s-1")).hasSize(1);

        tracker.sessionClosed("s-1");
        verify(service).playerDisconnected("r-1", "alice");
        assertThat(tracker.bindings("s-1")).isEmpty();
    }

    @SuppressWarnings("unchecked")
    private RoomEvent singlePublished() {
        ArgumentCaptor<List<RoomEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(sink).publish(captor.capture());
        assertThat(captor.getValue()).hasSize(1);
        return captor.getValue().get(0);
    }
}
