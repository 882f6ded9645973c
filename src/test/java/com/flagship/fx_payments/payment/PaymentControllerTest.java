package com.flagship.fx_payments.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface for quotes and payments.
 *
 * These tests verify:
 * - Quotes and drafts are created with 201
 * - The actor header is required on mutating calls
 * - Domain refusals map to the documented status codes
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class PaymentControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fx_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("fx.provider.api-key", () -> "");
    }

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private String createQuote() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/quotes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_currency\":\"GBP\",\"target_currency\":\"EUR\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.source_currency").value("GBP"))
            .andExpect(jsonPath("$.target_currency").value("EUR"))
            .andExpect(jsonPath("$.rate_source").value("MOCK"))
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        printOutput("Quote", body);
        return body.get("id").asText();
    }

    private String createDraft(String quoteId, String actor) throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("quote_id", quoteId);
        request.put("direction", "SEND");
        request.put("amount", "250.00");
        request.put("reference", "INV-2002");

        MvcResult result = mockMvc.perform(post("/api/payments")
                .header(ACTOR_HEADER, actor)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.created_by").value(actor))
            .andExpect(jsonPath("$.source_currency").value("GBP"))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    @Test
    @DisplayName("Draft, submit and approve over HTTP")
    void testWorkflowOverHttp() throws Exception {
        printTestHeader("HTTP Workflow");

        String paymentId = createDraft(createQuote(), "user42");

        mockMvc.perform(post("/api/payments/{id}/submit", paymentId).header(ACTOR_HEADER, "user42"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING_APPROVAL"));

        mockMvc.perform(post("/api/payments/{id}/approve", paymentId)
                .header(ACTOR_HEADER, "user7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"comment\":\"ok\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("APPROVED"));

        mockMvc.perform(get("/api/payments/{id}/approvals", paymentId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2));

        printSuccess("Payment approved through the API");
    }

    @Test
    @DisplayName("Self approval returns 403 with its error code")
    void testSelfApproval_Forbidden() throws Exception {
        printTestHeader("HTTP Self Approval");

        String paymentId = createDraft(createQuote(), "user42");
        mockMvc.perform(post("/api/payments/{id}/submit", paymentId).header(ACTOR_HEADER, "user42"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/payments/{id}/approve", paymentId).header(ACTOR_HEADER, "user42"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("SELF_APPROVAL_FORBIDDEN"));

        mockMvc.perform(get("/api/payments/{id}", paymentId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING_APPROVAL"));

        printSuccess("Self approval refused with 403");
    }

    @Test
    @DisplayName("Approving a draft that was never submitted returns 409")
    void testApproveDraft_Conflict() throws Exception {
        String paymentId = createDraft(createQuote(), "user42");

        mockMvc.perform(post("/api/payments/{id}/approve", paymentId).header(ACTOR_HEADER, "user7"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Missing actor header is a 400")
    void testMissingActorHeader_BadRequest() throws Exception {
        String quoteId = createQuote();

        mockMvc.perform(post("/api/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quote_id\":\"" + quoteId + "\",\"direction\":\"SEND\",\"amount\":10}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown payment and unknown quote are 404")
    void testUnknownIds_NotFound() throws Exception {
        mockMvc.perform(get("/api/payments/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/quotes/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Currency list comes from the mock table")
    void testCurrencies() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/quotes/currencies"))
            .andExpect(status().isOk())
            .andReturn();

        JsonNode currencies = objectMapper.readTree(result.getResponse().getContentAsString()).get("currencies");
        printOutput("Currencies", currencies);
        assertEquals(13, currencies.size());
        assertEquals("AUD", currencies.get(0).asText());
    }

    @Test
    @DisplayName("Health endpoint reports the database and the mock rate source")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.rate_source").value("MOCK"));
    }
}
