package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.sync.security.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ListingWebhookControllerTest {
    private static final String PATH = "/webhook/drivehr-sync";
    private static final String SECRET = "test-secret";
    private static final AtomicInteger NEXT_HOST = new AtomicInteger(1);

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private MockMvc mockMvc;
    private String clientIp;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        this.clientIp = "198.51.100." + NEXT_HOST.getAndIncrement();
        jdbc.update("DELETE FROM job_listings", new MapSqlParameterSource());
    }

    @Test
    void signedSnapshotIsReconciled() throws Exception {
        send("{\"jobs\":[{\"id\":\"W-1\",\"title\":\"Driver\"},{\"id\":\"W-2\",\"title\":\"Mechanic\"}]}")
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Type", MediaType.APPLICATION_JSON_VALUE))
            .andExpect(header().string("X-Content-Type-Options", "nosniff"))
            .andExpect(header().string("X-Frame-Options", "DENY"))
            .andExpect(header().string("X-Robots-Tag", "noindex, nofollow, noarchive, nosnippet"))
            .andExpect(header().doesNotExist("Pragma"))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.processed").value(2))
            .andExpect(jsonPath("$.updated").value(0))
            .andExpect(jsonPath("$.skipped").value(0))
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.errors.length()").value(0))
            .andExpect(jsonPath("$.removed").value(0))
            .andExpect(jsonPath("$.source").value("drivehr-netlify-sync"))
            .andExpect(jsonPath("$.timestamp").value(notNullValue()));

        send("{\"jobs\":[{\"id\":\"W-1\",\"title\":\"Driver\"}]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(0))
            .andExpect(jsonPath("$.updated").value(1))
            .andExpect(jsonPath("$.removed").value(1))
            .andExpect(jsonPath("$.removed_job_ids[0]").value("W-2"));
    }

    @Test
    void invalidItemsAreReportedWithSuccess() throws Exception {
        send("{\"jobs\":[{\"id\":\"W-3\",\"title\":\"Driver\"},{\"id\":\"W-4\"},\"oops\"]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(1))
            .andExpect(jsonPath("$.skipped").value(1))
            .andExpect(jsonPath("$.errors[0]").value("Job 'W-4': Missing required fields: id and title are required"))
            .andExpect(jsonPath("$.errors[1]").value("Job at index 2: Invalid job data format"));
    }

    @Test
    void nonPostMethodsAreRejected() throws Exception {
        mockMvc.perform(get(PATH).header("X-Forwarded-For", clientIp))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(header().string("Allow", "POST"))
            .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"))
            .andExpect(header().string("Pragma", "no-cache"))
            .andExpect(header().string("Expires", "0"))
            .andExpect(jsonPath("$.error").value("Method not allowed"))
            .andExpect(jsonPath("$.allowed_methods[0]").value("POST"))
            .andExpect(jsonPath("$.timestamp").value(notNullValue()));

        mockMvc.perform(put(PATH).header("X-Forwarded-For", clientIp))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void badSignatureIsUnauthorized() throws Exception {
        byte[] body = "{\"jobs\":[]}".getBytes(StandardCharsets.UTF_8);
        mockMvc.perform(post(PATH)
                .header("X-Forwarded-For", clientIp)
                .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, "wrong-secret"))
                .header(WebhookSignatureVerifier.TIMESTAMP_HEADER, now())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Unauthorized - Invalid signature"))
            .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"));
    }

    @Test
    void staleTimestampIsUnauthorized() throws Exception {
        byte[] body = "{\"jobs\":[]}".getBytes(StandardCharsets.UTF_8);
        mockMvc.perform(post(PATH)
                .header("X-Forwarded-For", clientIp)
                .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, SECRET))
                .header(WebhookSignatureVerifier.TIMESTAMP_HEADER, Long.toString(Instant.now().getEpochSecond() - 301))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post(PATH)
                .header("X-Forwarded-For", clientIp)
                .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, SECRET))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        send("{\"jobs\": [")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid JSON format"));

        send("{\"jobs\":[]} trailing")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid JSON format"));

        send("")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid JSON format"));
    }

    @Test
    void wrongShapeIsBadRequest() throws Exception {
        send("{\"listings\":[]}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid webhook data structure"))
            .andExpect(jsonPath("$.expected.jobs").value("array"));

        send("{\"jobs\":[{\"title\":\"No id\"}]}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid webhook data structure"));
    }

    @Test
    void oversizedBatchIsRejectedWithoutSideEffects() throws Exception {
        StringBuilder jobs = new StringBuilder();
        for (int i = 0; i < 101; i++) {
            if (i > 0) {
                jobs.append(',');
            }
            jobs.append("{\"id\":\"big-").append(i).append("\",\"title\":\"Job ").append(i).append("\"}");
        }
        send("{\"jobs\":[" + jobs + "]}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid webhook data structure"));
    }

    @Test
    void eleventhRequestInWindowIsThrottled() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(post(PATH)
                    .header("X-Forwarded-For", clientIp)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"jobs\":[]}"))
                .andExpect(status().isUnauthorized());
        }

        send("{\"jobs\":[]}")
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error").value("Rate limit exceeded"))
            .andExpect(jsonPath("$.retry_after").value(60))
            .andExpect(header().string("Pragma", "no-cache"));
    }

    private ResultActions send(String json) throws Exception {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        return mockMvc.perform(post(PATH)
            .header("X-Forwarded-For", clientIp)
            .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, SECRET))
            .header(WebhookSignatureVerifier.TIMESTAMP_HEADER, now())
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
    }

    private static String now() {
        return Long.toString(Instant.now().getEpochSecond());
    }
}
