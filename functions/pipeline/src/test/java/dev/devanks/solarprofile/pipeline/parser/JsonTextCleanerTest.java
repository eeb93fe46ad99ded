package dev.devanks.solarprofile.pipeline.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTextCleanerTest {

    private final JsonTextCleaner cleaner = new JsonTextCleaner();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "trailing comma in object | {\"a\": 1,}                | {\"a\": 1}",
            "trailing comma in array  | {\"a\": [1, 2,]}          | {\"a\": [1, 2]}",
            "unclosed object          | {\"a\": {\"b\": 1}        | {\"a\": {\"b\": 1}}",
            "unclosed array           | {\"a\": [1, 2            | {\"a\": [1, 2]}",
            "unmatched closer dropped | {\"a\": 1}}               | {\"a\": 1}",
    })
    @DisplayName("repairStructure fixes bracket and comma defects")
    void repairStructure_fixesStructure(String description, String input, String expected) {
        assertThat(cleaner.repairStructure(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("clean - drops JavaScript view members")
    void clean_dropsViewMembers() throws Exception {
        // Arrange
        String text = "{\"id\": 1, viewDashboard: true, \"name\": \"x\"}";

        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean(text));

        // Assert
        assertThat(node.path("id").asInt()).isEqualTo(1);
        assertThat(node.path("name").asText()).isEqualTo("x");
        assertThat(node.has("viewDashboard")).isFalse();
    }

    @Test
    @DisplayName("clean - replaces JavaScript boolean expressions with false")
    void clean_replacesBooleanExpressions() throws Exception {
        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean("{\"isPublic\": true && false && true, \"id\": 2}"));

        // Assert
        assertThat(node.path("isPublic").asBoolean(true)).isFalse();
        assertThat(node.path("id").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("clean - decodes HTML entities")
    void clean_decodesHtmlEntities() throws Exception {
        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean("{\"name\": \"Tom &amp; Jerry\"}"));

        // Assert
        assertThat(node.path("name").asText()).isEqualTo("Tom & Jerry");
    }

    @Test
    @DisplayName("clean - doubles backslashes that do not start a JSON escape")
    void clean_escapesInvalidBackslash() throws Exception {
        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean("{\"path\": \"C:\\data\\x\"}"));

        // Assert
        assertThat(node.path("path").asText()).isEqualTo("C:\\data\\x");
    }

    @Test
    @DisplayName("clean - escapes raw control characters inside strings")
    void clean_escapesControlCharacters() throws Exception {
        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean("{\"address\": \"line1\nline2\ttab\"}"));

        // Assert
        assertThat(node.path("address").asText()).isEqualTo("line1\nline2\ttab");
    }

    @Test
    @DisplayName("clean - brackets inside strings are left alone")
    void clean_ignoresBracketsInStrings() {
        assertThat(cleaner.clean("{\"name\": \"a } b ]\"}")).isEqualTo("{\"name\": \"a } b ]\"}");
    }

    @Test
    @DisplayName("clean - closes an unterminated string and its object")
    void clean_closesUnterminatedString() throws Exception {
        // Act
        JsonNode node = objectMapper.readTree(cleaner.clean("{\"name\": \"cut off"));

        // Assert
        assertThat(node.path("name").asText()).isEqualTo("cut off");
    }

    @Test
    @DisplayName("clean - null becomes empty text")
    void clean_null() {
        assertThat(cleaner.clean(null)).isEmpty();
    }
}
