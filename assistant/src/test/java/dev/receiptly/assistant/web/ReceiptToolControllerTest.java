package dev.receiptly.assistant.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.receiptly.receipts.PurchasedItem;
import dev.receiptly.tools.ReceiptMatchView;
import dev.receiptly.tools.ReceiptTools;
import dev.receiptly.tools.ReceiptView;
import dev.receiptly.tools.ToolError;
import dev.receiptly.tools.ToolErrorCode;
import dev.receiptly.tools.ToolResult;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ReceiptToolControllerTest {

    private static final String REFERENCE = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    private MockMvc mockMvc;

    @Mock
    private ReceiptTools receiptTools;

    @InjectMocks
    private ReceiptToolController controller;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build()))
            .build();
    }

    @Test
    void storesReceiptForSession() throws Exception {
        when(receiptTools.storeReceipt(eq(REFERENCE), eq("Cafe X"), eq("2024-03-01T10:00:00Z"),
            eq(new BigDecimal("15000")), any(), eq("IDR"), any(ToolContext.class)))
            .thenReturn(ToolResult.success(view()));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/sessions/s1/tools/store-receipt")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"imageReference\":\"" + REFERENCE + "\",\"storeName\":\"Cafe X\","
                    + "\"transactionTime\":\"2024-03-01T10:00:00Z\",\"totalAmount\":15000,"
                    + "\"purchasedItems\":[{\"name\":\"Latte\",\"price\":15000}],\"currency\":\"IDR\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.receiptId").value(REFERENCE))
            .andExpect(jsonPath("$.data.transactionTime").value("2024-03-01T10:00:00Z"))
            .andExpect(jsonPath("$.error").isEmpty());

        verify(receiptTools).storeReceipt(eq(REFERENCE), eq("Cafe X"), eq("2024-03-01T10:00:00Z"),
            eq(new BigDecimal("15000")), any(), eq("IDR"), any(ToolContext.class));
    }

    @Test
    void reportsToolFailuresInsideEnvelope() throws Exception {
        when(receiptTools.searchReceiptsByRange("2024-12-31", "2024-01-01", null, new BigDecimal("-1")))
            .thenReturn(ToolResult.failure(ToolError.of(ToolErrorCode.INVALID_RANGE, "start after end")));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/tools/search-by-range")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startTime\":\"2024-12-31\",\"endTime\":\"2024-01-01\",\"maxAmount\":-1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").isEmpty())
            .andExpect(jsonPath("$.error.code").value("INVALID_RANGE"))
            .andExpect(jsonPath("$.error.retryable").value(false));
    }

    @Test
    void searchesByText() throws Exception {
        when(receiptTools.searchReceiptsByText("coffee", 3))
            .thenReturn(ToolResult.success(List.of(new ReceiptMatchView(view(), 0.25))));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/tools/search-by-text")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"queryText\":\"coffee\",\"limit\":3}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].receipt.storeName").value("Cafe X"))
            .andExpect(jsonPath("$.data[0].distance").value(0.25));
    }

    @Test
    void getsReceiptByReference() throws Exception {
        when(receiptTools.getReceipt(REFERENCE))
            .thenReturn(ToolResult.failure(ToolError.of(ToolErrorCode.NOT_FOUND, "No receipt stored")));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/tools/receipts/" + REFERENCE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    private static ReceiptView view() {
        return new ReceiptView(REFERENCE, "Cafe X", Instant.parse("2024-03-01T10:00:00Z"), new BigDecimal("15000"),
            "IDR", List.of(new PurchasedItem("Latte", new BigDecimal("15000"))),
            "memory://receipt-images/" + REFERENCE, Instant.parse("2024-05-01T12:00:00Z"));
    }
}
