package ch.netplay.netplaybackend.application.service;

import ch.netplay.netplaybackend.domain.OpenRoomSummary;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.web.api.controller.RoomListController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RoomListController.class)
class RoomListControllerContractTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    RoomRegistry roomRegistry;

    @Test
    void listOpenRooms_shouldReturnRoomsKeyedBySessionId_contractTest() throws Exception {
        when(roomRegistry.listOpen("mario")).thenReturn(List.of(
                new OpenRoomSummary("S1", "Friday night", 1, 4, "Alice", false),
                new OpenRoomSummary("S2", "Locked", 2, 3, "Bob", true)
        ));

        MvcResult result = mockMvc.perform(get("/list").param("game_id", "mario"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.S1.room_name").value("Friday night"))
                .andExpect(jsonPath("$.S1.current").value(1))
                .andExpect(jsonPath("$.S1.max").value(4))
                .andExpect(jsonPath("$.S1.player_name").value("Alice"))
                .andExpect(jsonPath("$.S1.hasPassword").value(false))
                .andExpect(jsonPath("$.S2.hasPassword").value(true))
                .andReturn();

        String json = result.getResponse().getContentAsString();

        // no internals in the listing
        assertThat(json).doesNotContain("password\"");
        assertThat(json).doesNotContain("connectionId");
        assertThat(json).doesNotContain("sessionId");
    }

    @Test
    void listOpenRooms_shouldReturnEmptyObject_whenNoRoomsMatch() throws Exception {
        when(roomRegistry.listOpen("zelda")).thenReturn(List.of());

        MvcResult result = mockMvc.perform(get("/list").param("game_id", "zelda"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(result.getResponse().getContentAsString()).isEqualTo("{}");
    }

    @Test
    void listOpenRooms_shouldReturnEmptyObject_whenGameIdMissing() throws Exception {
        when(roomRegistry.listOpen(null)).thenReturn(List.of());

        MvcResult result = mockMvc.perform(get("/list"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(result.getResponse().getContentAsString()).isEqualTo("{}");
    }
}
