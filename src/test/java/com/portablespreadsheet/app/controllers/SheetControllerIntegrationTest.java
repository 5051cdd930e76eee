package com.portablespreadsheet.app.controllers;

import com.portablespreadsheet.app.AppApplication;
import com.portablespreadsheet.app.models.CellType;
import com.portablespreadsheet.app.models.CellView;
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
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private long sheetId;

    /**
     * A 4 x 4 sheet with (0,0) = 2 and (0,1) = 3.
     */
    @BeforeEach
    void setUp() {
        ResponseEntity<Long> createResponse = restTemplate.postForEntity(url("/sheet"),
                json("{\"rows\": 4, \"columns\": 4, \"rowLabels\": [\"Revenue\", \"Costs\", \"Profit\", \"Tax\"]}"),
                Long.class);
        assertEquals(HttpStatus.OK, createResponse.getStatusCode());
        assertNotNull(createResponse.getBody());
        sheetId = createResponse.getBody();

        putCell(0, 0, "{\"operation\": \"constant\", \"value\": 2}");
        putCell(0, 1, "{\"operation\": \"constant\", \"value\": 3}");
    }

    @Test
    void testSetAndGetComputedCell() {
        CellView view = putCell(1, 0, "{\"operation\": \"add\", \"arguments\": ["
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 0},"
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 1}],"
                + "\"description\": \"Total\", \"style\": {\"bold\": true}}");

        assertEquals(5, view.getValue());
        assertEquals(CellType.COMPUTATIONAL, view.getType());
        assertEquals("=B2+C2", view.getWords().get("excel"));
        assertEquals("values[0,0]+values[0,1]", view.getWords().get("python_numpy"));
        assertEquals("value at (Revenue, 1) + value at (Revenue, 2)", view.getWords().get("native"));
        assertEquals("Total", view.getDescription());
        assertEquals(true, view.getStyle().get("bold"));

        CellView fetched = restTemplate.getForObject(url("/sheet/" + sheetId + "/cell/1/0"), CellView.class);
        assertNotNull(fetched);
        assertEquals(view.getWords(), fetched.getWords());
    }

    /**
     * Notations registered from the configuration are rendered too.
     */
    @Test
    void testConfiguredNotationIsRendered() {
        CellView view = putCell(1, 1, "{\"operation\": \"divide\", \"arguments\": ["
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 1},"
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 0}]}");

        assertEquals(1.5, view.getValue());
        assertEquals("\\frac{x_{0,1}}{x_{0,0}}", view.getWords().get("latex"));
    }

    @Test
    void testSheetData() {
        Map<String, CellView> data = restTemplate.exchange(url("/sheet/" + sheetId), HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, CellView>>() {
                }).getBody();

        assertNotNull(data);
        assertEquals(2, data.size());
        assertEquals(3, data.get("0,1").getValue());
    }

    @Test
    void testVariable() {
        restTemplate.exchange(url("/sheet/" + sheetId + "/variable/rate"), HttpMethod.PUT,
                json("{\"value\": 0.25, \"description\": \"Tax rate\"}"), CellView.class);

        CellView view = putCell(3, 0, "{\"operation\": \"multiply\", \"arguments\": ["
                + "{\"operation\": \"variable\", \"name\": \"rate\"},"
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 0}]}");

        assertEquals(0.5, view.getValue());
        assertEquals("=rate*B2", view.getWords().get("excel"));
        assertEquals("variable rate * value at (Revenue, 1)", view.getWords().get("native"));
    }

    @Test
    void testErrors() {
        assertError(HttpStatus.BAD_REQUEST, "INVALID_EXPRESSION",
                () -> putCell(1, 0, "{\"operation\": \"frobnicate\"}"));
        assertError(HttpStatus.BAD_REQUEST, "INVALID_TYPE",
                () -> putCell(1, 0, "{\"operation\": \"add\", \"arguments\": ["
                        + "{\"operation\": \"constant\", \"value\": \"x\"},"
                        + "{\"operation\": \"constant\", \"value\": 1}]}"));
        assertError(HttpStatus.BAD_REQUEST, "NOT_ANCHORED",
                () -> putCell(1, 0, "{\"operation\": \"reference\", \"arguments\": ["
                        + "{\"operation\": \"constant\", \"value\": 1}]}"));
        assertError(HttpStatus.NOT_FOUND, "VARIABLE_NOT_FOUND",
                () -> putCell(1, 0, "{\"operation\": \"variable\", \"name\": \"nope\"}"));
        assertError(HttpStatus.NOT_FOUND, "CELL_NOT_FOUND",
                () -> putCell(9, 0, "{\"operation\": \"constant\", \"value\": 1}"));
        assertError(HttpStatus.NOT_FOUND, "SHEET_NOT_FOUND",
                () -> restTemplate.getForObject(url("/sheet/0"), Map.class));
    }

    @Test
    void testDeleteRowAndColumn() {
        putCell(2, 2, "{\"operation\": \"sum\", \"arguments\": ["
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 0},"
                + "{\"operation\": \"cell\", \"row\": 0, \"column\": 1}]}");

        assertError(HttpStatus.CONFLICT, "DEPENDENT_CELLS",
                () -> restTemplate.delete(url("/sheet/" + sheetId + "/row/0")));

        ResponseEntity<Void> deleted = restTemplate.exchange(url("/sheet/" + sheetId + "/row/1"),
                HttpMethod.DELETE, null, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, deleted.getStatusCode());
        restTemplate.delete(url("/sheet/" + sheetId + "/column/3"));

        CellView moved = restTemplate.getForObject(url("/sheet/" + sheetId + "/cell/1/2"), CellView.class);
        assertNotNull(moved);
        assertEquals(5, moved.getValue());
        assertEquals("=SUM(B2:C2)", moved.getWords().get("excel"));
        assertEquals("sum of values from (Revenue, 1) to (Revenue, 2)", moved.getWords().get("native"));
    }

    private CellView putCell(int row, int column, String body) {
        return restTemplate.exchange(url("/sheet/" + sheetId + "/cell/" + row + "/" + column),
                HttpMethod.PUT, json(body), CellView.class).getBody();
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static void assertError(HttpStatus status, String code, Runnable call) {
        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, call::run);
        assertEquals(status, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains(code), e.getResponseBodyAsString());
    }
}
