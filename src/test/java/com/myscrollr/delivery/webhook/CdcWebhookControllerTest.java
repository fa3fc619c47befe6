package com.myscrollr.delivery.webhook;

import com.myscrollr.delivery.config.RoutingProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CdcWebhookController.class)
@Import({CdcEnvelopeParser.class, CdcWebhookControllerTest.PropertiesConfig.class})
@TestPropertySource(properties = "app.routing.webhook-secret=s3cret")
@DisplayName("CdcWebhookController Tests")
class CdcWebhookControllerTest {

    private static final String BODY = """
            {"records":[{"action":"insert","table_name":"trades","record":{"symbol":"AAPL"}}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CdcDispatchService dispatchService;

    @TestConfiguration
    @EnableConfigurationProperties(RoutingProperties.class)
    static class PropertiesConfig {
    }

    @Test
    @DisplayName("Should route an authorized batch and return the resolved users")
    void shouldReturnUsers() throws Exception {
        when(dispatchService.dispatch(anyList())).thenReturn(new LinkedHashSet<>(List.of("u1", "u2")));

        mockMvc.perform(post("/webhooks/cdc")
                        .header("Authorization", "Bearer s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users.length()").value(2))
                .andExpect(jsonPath("$.users[0]").value("u1"));
    }

    @Test
    @DisplayName("Should reject a missing or wrong bearer token with 401")
    void shouldRejectBadToken() throws Exception {
        mockMvc.perform(post("/webhooks/cdc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"));

        mockMvc.perform(post("/webhooks/cdc")
                        .header("Authorization", "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(dispatchService);
    }

    @Test
    @DisplayName("Should answer 400 when the body has no records")
    void shouldRejectEmptyBatch() throws Exception {
        mockMvc.perform(post("/webhooks/cdc")
                        .header("Authorization", "Bearer s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No records in request"));

        verifyNoInteractions(dispatchService);
    }

    @Test
    @DisplayName("Should return an empty user list when nothing resolves")
    void shouldReturnEmptyUsers() throws Exception {
        when(dispatchService.dispatch(anyList())).thenReturn(Set.<String>of());

        mockMvc.perform(post("/webhooks/cdc")
                        .header("Authorization", "Bearer s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"insert\",\"table_name\":\"audit\",\"record\":{}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users").isEmpty());
    }
}
