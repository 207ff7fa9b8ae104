package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.sync.persistence.ListingStore;
import com.drivehr.jobsync.sync.security.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class WebhookReconcileFailureTest {
    private static final String PATH = "/webhook/drivehr-sync";
    private static final String SECRET = "test-secret";
    private static final String PAYLOAD = "{\"jobs\":[{\"id\":\"F-1\",\"title\":\"Driver\"}]}";
    private static final AtomicInteger NEXT_HOST = new AtomicInteger(1);

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private ListingStore store;

    private MockMvc mockMvc;
    private String clientIp;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        this.clientIp = "203.0.113." + NEXT_HOST.getAndIncrement();
    }

    @Test
    void storeOutageDuringSyncReturnsInternalError() throws Exception {
        when(store.findRecordIdsByJobIds(anyCollection()))
            .thenThrow(new DataAccessResourceFailureException("Connection refused: db.internal:5432"));

        send(PAYLOAD)
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal server error"))
            .andExpect(jsonPath("$.timestamp").value(notNullValue()))
            .andExpect(jsonPath("$.success").doesNotExist())
            .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"))
            .andExpect(header().string("Pragma", "no-cache"))
            .andExpect(header().string("Expires", "0"))
            .andExpect(header().string("X-Content-Type-Options", "nosniff"));
    }

    @Test
    void unexpectedFailureDuringSyncReturnsInternalError() throws Exception {
        when(store.findRecordIdsByJobIds(anyCollection())).thenThrow(new IllegalStateException("boom"));

        send(PAYLOAD)
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal server error"))
            .andExpect(jsonPath("$.timestamp").value(notNullValue()))
            .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"));
    }

    private ResultActions send(String json) throws Exception {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        return mockMvc.perform(post(PATH)
            .header("X-Forwarded-For", clientIp)
            .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, SECRET))
            .header(WebhookSignatureVerifier.TIMESTAMP_HEADER, Long.toString(Instant.now().getEpochSecond()))
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
    }
}
