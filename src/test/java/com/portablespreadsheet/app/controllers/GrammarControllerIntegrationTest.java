package com.portablespreadsheet.app.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portablespreadsheet.app.AppApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of notation registration over HTTP.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class GrammarControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    @Test
    void testBuiltInAndConfiguredNotations() {
        String[] names = restTemplate.getForObject(url("/grammar"), String[].class);

        assertNotNull(names);
        assertEquals(List.of("excel", "python_numpy", "native"), Arrays.asList(names).subList(0, 3));
        assertTrue(Arrays.asList(names).contains("latex"));
    }

    @Test
    void testRegisterAndRemove() {
        JsonNode grammar = restTemplate.getForObject(url("/grammar/excel"), JsonNode.class);
        assertNotNull(grammar);
        ((ObjectNode) grammar.get("cells").get("operation")).put("prefix", "+");

        ResponseEntity<Void> registered = restTemplate.postForEntity(url("/grammar/lotus"), json(grammar), Void.class);
        assertEquals(HttpStatus.OK, registered.getStatusCode());
        try {
            long sheetId = restTemplate.postForObject(url("/sheet"),
                    json("{\"rows\": 2, \"columns\": 2}"), Long.class);
            JsonNode cell = restTemplate.exchange(url("/sheet/" + sheetId + "/cell/1/1"), HttpMethod.PUT,
                    json("{\"operation\": \"sqrt\", \"arguments\": [{\"operation\": \"constant\", \"value\": 16}]}"),
                    JsonNode.class).getBody();
            assertNotNull(cell);
            assertEquals("+SQRT(16)", cell.at("/words/lotus").asText());
        } finally {
            restTemplate.delete(url("/grammar/lotus"));
        }

        String[] names = restTemplate.getForObject(url("/grammar"), String[].class);
        assertNotNull(names);
        assertFalse(Arrays.asList(names).contains("lotus"));
    }

    @Test
    void testValidate() {
        JsonNode grammar = restTemplate.getForObject(url("/grammar/native"), JsonNode.class);
        assertNotNull(grammar);
        assertEquals(Boolean.TRUE, restTemplate.postForObject(url("/grammar/validate"), json(grammar), Boolean.class));

        ((ObjectNode) grammar).remove("operations");
        assertEquals(Boolean.FALSE, restTemplate.postForObject(url("/grammar/validate"), json(grammar), Boolean.class));
    }

    @Test
    void testRejectedGrammars() {
        JsonNode grammar = restTemplate.getForObject(url("/grammar/excel"), JsonNode.class);
        assertNotNull(grammar);

        assertInvalidGrammar(() -> restTemplate.postForEntity(url("/grammar/excel"), json(grammar), Void.class));
        ((ObjectNode) grammar).put("extra", 1);
        assertInvalidGrammar(() -> restTemplate.postForEntity(url("/grammar/broken"), json(grammar), Void.class));
        assertInvalidGrammar(() -> restTemplate.delete(url("/grammar/unknown")));
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private static HttpEntity<Object> json(Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static void assertInvalidGrammar(Runnable call) {
        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, call::run);
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains("INVALID_GRAMMAR"));
    }
}
