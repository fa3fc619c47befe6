package com.myscrollr.delivery.delivery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = EventStreamController.class)
@DisplayName("EventStreamController Tests")
class EventStreamControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SseDeliveryStream deliveryStream;

    @Test
    @DisplayName("Should report the number of open streams")
    void shouldReportViewers() throws Exception {
        when(deliveryStream.viewerCount()).thenReturn(4);

        mockMvc.perform(get("/events/viewers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(4));
    }

    @Test
    @DisplayName("Should refuse a stream without a user id")
    void shouldRequireUserId() throws Exception {
        mockMvc.perform(get("/events")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/events").header("X-User-Id", "  ")).andExpect(status().isBadRequest());

        verify(deliveryStream, never()).open(anyString());
    }
}
