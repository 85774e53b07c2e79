package com.example.chatrelay.controller;

import com.example.chatrelay.service.ChatService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Standalone MVC test: no Spring context.
 */
class HealthControllerTest {

    @Test
    void health_reportsLiveRoomCount() throws Exception {
        ChatService chatService = Mockito.mock(ChatService.class);
        when(chatService.liveRoomCount()).thenReturn(3);

        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(chatService)).build();

        mvc.perform(get("/health"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.status").value("ok"))
           .andExpect(jsonPath("$.rooms").value(3));
    }

    @Test
    void healthz_isPlainOk() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(Mockito.mock(ChatService.class))).build();

        mvc.perform(get("/healthz"))
           .andExpect(status().isOk())
           .andExpect(content().string("ok"));
    }
}
