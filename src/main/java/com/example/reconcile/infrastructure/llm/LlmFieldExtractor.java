package com.example.reconcile.infrastructure.llm;

import com.example.reconcile.domain.model.invoice.ExtractedInvoiceFields;
import com.example.reconcile.domain.model.invoice.Gstin;
import com.example.reconcile.domain.model.invoice.LlmExtractionResult;
import com.example.reconcile.infrastructure.config.LlmProperties;
import com.example.reconcile.infrastructure.config.LlmProvider;
import com.example.reconcile.infrastructure.exception.LlmRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infrastructure service that asks a hosted LLM to pick the right invoice fields from the document text.
 * The rule-based candidates are sent along so the model can choose between them.
 * Every failure is reported through {@link LlmExtractionResult#error()}.
 */
@Service
public class LlmFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmFieldExtractor.class);
    static final String SYSTEM_MESSAGE = "You are a document parsing assistant. Output only valid JSON.";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final double TEMPERATURE = 0.1;
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("100000000");

    private final RestClient restClient;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    public LlmFieldExtractor(@Qualifier("llmRestClient") RestClient restClient,
                             LlmProperties properties,
                             ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @return {@code true} when an API key is configured
     */
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    /**
     * Sends the (truncated) document text with the rule candidates and validates the answer.
     *
     * @param text       document text
     * @param candidates fields found by the rule-based parser
     * @return validated fields or the failure reason
     */
    public LlmExtractionResult extract(String text, ExtractedInvoiceFields candidates) {
        String provider = providerName();
        if (!isAvailable()) {
            return LlmExtractionResult.failure(provider, "LLM not configured");
        }
        try {
            String content = complete(buildPrompt(truncate(text), candidates));
            LlmExtractionResult result = parseResponse(content);
            if (!result.isSuccess()) {
                log.warn("LLM extraction via {} returned no usable fields: {}", provider, result.error());
            }
            return result;
        } catch (LlmRequestException e) {
            log.warn("LLM extraction via {} failed: {}", provider, e.getMessage());
            return LlmExtractionResult.failure(provider, e.getMessage());
        }
    }

    /**
     * Builds the instruction prompt.
     *
     * @param text       truncated document text
     * @param candidates rule candidates, may be {@code null}
     * @return prompt text
     */
    String buildPrompt(String text, ExtractedInvoiceFields candidates) {
        List<String> lines = new ArrayList<>();
        lines.add("You are an expert at extracting structured data from Indian invoices and receipts.");
        lines.add("Extract the following fields from the document text below.");
        lines.add("");
        lines.add("IMPORTANT GUIDELINES:");
        lines.add("1. For total_amount: Find the FINAL payable amount (Grand Total, Net Payable, Amount Due).");
        lines.add("   Ignore subtotals, tax breakdowns, or item prices.");
        lines.add("2. For vendor_name: Find the company/seller name, NOT the buyer.");
        lines.add("3. For invoice_date: Use ISO format YYYY-MM-DD.");
        lines.add("4. For invoice_number: Find the unique invoice/receipt/order number.");
        lines.add("5. For vendor_gstin: Find the seller's GST number (15 characters: 2 digits + 10 chars + 3 chars).");
        lines.add("");
        Map<String, Object> found = candidateValues(candidates);
        if (!found.isEmpty()) {
            lines.add("CANDIDATES FOUND BY RULES (pick the best one):");
            found.forEach((field, value) -> lines.add("- " + field + ": " + value));
            lines.add("");
        }
        lines.add("DOCUMENT TEXT:");
        lines.add("---");
        lines.add(text);
        lines.add("---");
        lines.add("");
        lines.add("Respond ONLY with valid JSON in this exact format (no explanation):");
        lines.add("{");
        lines.add("  \"vendor_name\": \"string or null\",");
        lines.add("  \"invoice_number\": \"string or null\",");
        lines.add("  \"invoice_date\": \"YYYY-MM-DD or null\",");
        lines.add("  \"total_amount\": number or null,");
        lines.add("  \"vendor_gstin\": \"string or null\",");
        lines.add("  \"confidence\": 0.0 to 1.0");
        lines.add("}");
        return String.join("\n", lines);
    }

    private Map<String, Object> candidateValues(ExtractedInvoiceFields candidates) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (candidates == null) {
            return values;
        }
        putIfPresent(values, "total_amount", candidates.totalAmount() == null ? null : candidates.totalAmount().toPlainString());
        putIfPresent(values, "vendor_name", candidates.vendorName());
        putIfPresent(values, "invoice_date", candidates.invoiceDate());
        putIfPresent(values, "invoice_number", candidates.invoiceNumber());
        putIfPresent(values, "vendor_gstin", candidates.vendorGstin());
        return values;
    }

    private static void putIfPresent(Map<String, Object> values, String key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    private String complete(String prompt) {
        try {
            JsonNode response = properties.provider() == LlmProvider.ANTHROPIC
                    ? callAnthropic(prompt)
                    : callOpenAi(prompt);
            if (response == null) {
                return null;
            }
            JsonNode content = properties.provider() == LlmProvider.ANTHROPIC
                    ? response.path("content").path(0).path("text")
                    : response.path("choices").path(0).path("message").path("content");
            return content.isTextual() ? content.asText() : null;
        } catch (RestClientResponseException e) {
            throw new LlmRequestException("API error: " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new LlmRequestException("LLM request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode callOpenAi(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.model());
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_MESSAGE),
                Map.of("role", "user", "content", prompt)
        ));
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", properties.maxTokens());
        return restClient.post()
                .uri(properties.endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer " + properties.apiKey())
                .body(body)
                .retrieve()
                .body(JsonNode.class);
    }

    private JsonNode callAnthropic(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.model());
        body.put("max_tokens", properties.maxTokens());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return restClient.post()
                .uri(properties.endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-api-key", properties.apiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
    }

    /**
     * Pulls the first JSON object out of the model answer and validates each field.
     *
     * @param content raw assistant message
     * @return validated fields or the failure reason
     */
    LlmExtractionResult parseResponse(String content) {
        String provider = providerName();
        if (content == null || content.isBlank()) {
            return LlmExtractionResult.failure(provider, "Empty LLM response");
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            return LlmExtractionResult.failure(provider, "No JSON in LLM response");
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            return LlmExtractionResult.failure(provider, "Failed to parse LLM response: " + e.getOriginalMessage());
        }
        double confidence = data.path("confidence").isNumber()
                ? data.path("confidence").asDouble()
                : properties.defaultConfidence();
        ExtractedInvoiceFields fields = new ExtractedInvoiceFields(
                text(data, "vendor_name"),
                Gstin.normalize(text(data, "vendor_gstin")),
                text(data, "invoice_number"),
                date(text(data, "invoice_date")),
                amount(data.path("total_amount")),
                null,
                confidence,
                List.of()
        );
        return LlmExtractionResult.success(fields, provider);
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().strip();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }

    private static LocalDate date(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static BigDecimal amount(JsonNode node) {
        BigDecimal value = null;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else if (node.isTextual()) {
            String digits = node.asText().replaceAll("[^\\d.]", "").replaceFirst("^\\.+", "");
            try {
                value = digits.isEmpty() ? null : new BigDecimal(digits);
            } catch (NumberFormatException ignored) {
                value = null;
            }
        }
        if (value == null || value.signum() <= 0 || value.compareTo(MAX_AMOUNT) >= 0) {
            return null;
        }
        return value;
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > properties.maxTextLength() ? text.substring(0, properties.maxTextLength()) : text;
    }

    private String providerName() {
        return properties.provider().name().toLowerCase(Locale.ROOT);
    }
}
