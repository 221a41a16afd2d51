package com.sheetcalc.app.controllers;

import com.sheetcalc.app.SheetCalcApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests drive the formula engine end to end over HTTP.
 */
@SpringBootTest(
        classes = SheetCalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class WorkbookControllerIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<Map<String, Object>>() {};

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
    }

    private String baseUrl() {
        return "http://localhost:" + port + "/workbook";
    }

    private long createWorkbook(String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(baseUrl(), new HttpEntity<>(json, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private void putCell(long workbookId, String sheet, String reference, String raw) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        String url = baseUrl() + "/" + workbookId + "/sheet/" + sheet + "/cell/" + reference;
        restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(raw, headers), Void.class);
    }

    private Map<String, Object> getSheet(long workbookId, String sheet) {
        return restTemplate.exchange(baseUrl() + "/" + workbookId + "/sheet/" + sheet, HttpMethod.GET, null,
                JSON_OBJECT).getBody();
    }

    private void calculate(long workbookId) {
        restTemplate.postForEntity(baseUrl() + "/" + workbookId + "/calculate", null, Void.class);
    }

    private Map<String, Object> evaluate(long workbookId, String sheet, String formula) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"sheet\": \"" + sheet + "\", \"formula\": \"" + formula.replace("\"", "\\\"") + "\"}";
        return restTemplate.exchange(baseUrl() + "/" + workbookId + "/evaluate", HttpMethod.POST,
                new HttpEntity<>(body, headers), JSON_OBJECT).getBody();
    }

    /**
     * Sets values and formulas, recalculates, and reads the cached results back.
     */
    @Test
    void testSetCalculateAndRead() {
        long id = createWorkbook("{\"sheets\": [\"Sheet1\", \"Data\"]}");

        putCell(id, "Sheet1", "A1", "1");
        putCell(id, "Sheet1", "A2", "2");
        putCell(id, "Sheet1", "A3", "3");
        putCell(id, "Sheet1", "B1", "=SUM(A1:A3)");
        putCell(id, "Data", "A1", "=Sheet1!B1*2");
        putCell(id, "Sheet1", "C1", "=1/0");

        calculate(id);

        Map<String, Object> sheet1 = getSheet(id, "Sheet1");
        assertEquals(6.0, sheet1.get("B1"));
        assertEquals("#DIV/0!", sheet1.get("C1"));
        assertEquals(12.0, getSheet(id, "Data").get("A1"));
    }

    @Test
    void testEvaluateFormula() {
        long id = createWorkbook("{\"sheets\": [\"Sheet1\"]}");
        putCell(id, "Sheet1", "A1", "apple");

        Map<String, Object> number = evaluate(id, "Sheet1", "=2^10");
        assertEquals("NUMBER", number.get("type"));
        assertEquals(1024.0, number.get("value"));

        Map<String, Object> text = evaluate(id, "Sheet1", "=UPPER(A1)&\"!\"");
        assertEquals("TEXT", text.get("type"));
        assertEquals("APPLE!", text.get("value"));

        Map<String, Object> error = evaluate(id, "Sheet1", "=VLOOKUP(\"pear\",A1:A1,1,FALSE)");
        assertEquals("ERROR", error.get("type"));
        assertEquals("#N/A", error.get("value"));
    }

    /**
     * A workbook created without a body gets "Sheet1".
     */
    @Test
    void testCreateWithoutBody() {
        ResponseEntity<Long> response = restTemplate.postForEntity(baseUrl(), null, Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(getSheet(response.getBody(), "Sheet1").isEmpty());
    }

    @Test
    void testMalformedFormulaIsRejected() {
        long id = createWorkbook("{\"sheets\": [\"Sheet1\"]}");
        try {
            putCell(id, "Sheet1", "A1", "=SUM(1,");
            fail("Should have rejected the malformed formula!");
        } catch (HttpClientErrorException e) {
            assertEquals(400, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("PARSE_ERROR"));
        }
        assertTrue(getSheet(id, "Sheet1").isEmpty());
    }

    @Test
    void testCircularReferenceIsRejected() {
        long id = createWorkbook("{\"sheets\": [\"Sheet1\"]}");
        putCell(id, "Sheet1", "A1", "=B1");
        putCell(id, "Sheet1", "B1", "=A1");
        try {
            calculate(id);
            fail("Should have reported the circular reference!");
        } catch (HttpClientErrorException e) {
            assertEquals(400, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));
            assertTrue(e.getResponseBodyAsString().contains("Sheet1!A1"));
        }
        try {
            evaluate(id, "Sheet1", "=B1+1");
            fail("Should have reported the circular reference!");
        } catch (HttpClientErrorException e) {
            assertEquals(400, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));
            assertTrue(e.getResponseBodyAsString().contains("Sheet1!B1"));
        }
    }

    @Test
    void testNotFoundErrors() {
        long id = createWorkbook("{\"sheets\": [\"Sheet1\"]}");
        try {
            getSheet(id, "Missing");
            fail("Should have thrown for an unknown sheet!");
        } catch (HttpClientErrorException e) {
            assertEquals(404, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));
        }
        try {
            getSheet(999_999, "Sheet1");
            fail("Should have thrown for an unknown workbook!");
        } catch (HttpClientErrorException e) {
            assertEquals(404, e.getStatusCode().value());
        }
        try {
            putCell(id, "Sheet1", "ZZZZ1", "1");
            fail("Should have rejected the cell reference!");
        } catch (HttpClientErrorException e) {
            assertEquals(400, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));
        }
    }
}
