package com.wordhub.gameservice.games.scrabble.interfaces.http;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "wordhub.bots[0].id=bot-fast",
        "wordhub.bots[0].name=Speedy",
        "wordhub.bots[0].difficulty=EASY",
        "wordhub.bots[0].min-think-ms=50",
        "wordhub.bots[0].max-think-ms=200"
})
@AutoConfigureMockMvc
class ScrabbleRestControllerTest {

    private static final String PLAYER = ScrabbleRestController.PLAYER_HEADER;

    @Autowired
    private MockMvc mvc;

    @Test
    void createJoinAndPlayThroughHttp() throws Exception {
        String roomId = createRoom("{\"mode\":\"CLASSIC\",\"dictionaryId\":\"TWL\"}");

        mvc.perform(post("/api/scrabble/rooms/{id}/join", roomId).header(PLAYER, "alice").param("displayName", "Alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("WAITING"));
        String body = mvc.perform(post("/api/scrabble/rooms/{id}/join", roomId).header(PLAYER, "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.players", hasSize(2)))
                .andReturn().getResponse().getContentAsString();

        String current = JsonPath.read(body, "$.data.currentPlayerId");
        String other = "alice".equals(current) ? "bob" : "alice";

        mvc.perform(get("/api/scrabble/rooms/{id}/rack", roomId).header(PLAYER, current))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tiles", hasSize(7)));

        mvc.perform(post("/api/scrabble/rooms/{id}/pass", roomId).header(PLAYER, other))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("NOT_YOUR_TURN"));

        mvc.perform(post("/api/scrabble/rooms/{id}/moves", roomId).header(PLAYER, current)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"PASS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.type").value("PASS"))
                .andExpect(jsonPath("$.data.moveNumber").value(1));

        mvc.perform(post("/api/scrabble/rooms/{id}/resign", roomId).header(PLAYER, current))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("COMPLETED"))
                .andExpect(jsonPath("$.data.result.winnerId").value(other));
    }

    @Test
    void unknownRoomIs404() throws Exception {
        mvc.perform(get("/api/scrabble/rooms/{id}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ROOM_NOT_FOUND"));
    }

    @Test
    void missingPlayerHeaderIs400() throws Exception {
        String roomId = createRoom("{}");

        mvc.perform(post("/api/scrabble/rooms/{id}/join", roomId))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownDictionaryIsRejected() throws Exception {
        mvc.perform(post("/api/scrabble/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dictionaryId\":\"KLINGON\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownMoveTypeIsRejected() throws Exception {
        String roomId = createRoom("{}");

        mvc.perform(post("/api/scrabble/rooms/{id}/moves", roomId).header(PLAYER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"SHUFFLE\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void botCatalogComesFromConfiguration() throws Exception {
        mvc.perform(get("/api/scrabble/bots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].id", hasItem("bot-fast")))
                .andExpect(jsonPath("$.data", hasSize(1)));

        String roomId = createRoom("{}");
        mvc.perform(post("/api/scrabble/rooms/{id}/bots/{bot}", roomId, "bot-nobody"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("BOT_NOT_FOUND"));
    }

    private String createRoom(String json) throws Exception {
        String body = mvc.perform(post("/api/scrabble/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.data.roomId");
    }
}
