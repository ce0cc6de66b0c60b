package de.leidenheit.apicontext.core.evaluation;

import de.leidenheit.apicontext.core.context.ApiContext;
import de.leidenheit.apicontext.core.exception.ApiContextAssertionException;
import de.leidenheit.apicontext.core.exception.ApiContextIllegalStateException;
import de.leidenheit.apicontext.core.exception.ApiContextParseException;
import de.leidenheit.apicontext.core.exception.ApiContextResourceException;
import de.leidenheit.apicontext.support.StubApiServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseAssertionsTest {

    private static final String TEST_JSON_PATH = "src/test/resources/testdata/test_json_path.json";
    private static final String TEST_ROOT_ARRAY = "src/test/resources/testdata/test_root_array.json";
    private static final String SCHEMAS_PATH = "src/test/resources/testdata/schemas";

    private StubApiServer server;
    private ApiContext context;
    private ResponseAssertions assertions;

    @BeforeEach
    void setupContext() throws Exception {
        server = new StubApiServer();
        context = new ApiContext()
                .withBaseUrl(server.getBaseUrl())
                .withDebug(true)
                .withJsonSchemasPath(SCHEMAS_PATH);
        assertions = new ResponseAssertions(context);
    }

    @AfterEach
    void shutdown() {
        server.close();
    }

    @Test
    void shouldFailEveryCheckBeforeAnyRequestWasSent() {
        assertThatThrownBy(() -> assertions.assertStatusCode(200))
                .isInstanceOf(ApiContextIllegalStateException.class);
        assertThatThrownBy(() -> assertions.assertJsonPathValue("$.a", "a"))
                .isInstanceOf(ApiContextIllegalStateException.class);
        assertThatThrownBy(() -> assertions.storeResponseHeader("Content-Type", "type"))
                .isInstanceOf(ApiContextIllegalStateException.class);
    }

    @Test
    void shouldCheckStatusCode() {
        // given
        server.respondWith(404, "{\"error\":\"not found\"}");
        context.sendRequest("GET", "/missing");

        // when & then
        assertThatCode(() -> assertions.assertStatusCode(404)).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertStatusCode(200))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("expected status code to be 200, but actual is 404")
                .hasMessageContaining("not found");
    }

    @Test
    void shouldCheckJsonPathValuesByKindOfActualValue() {
        // given
        server.respondWithFile(TEST_JSON_PATH);
        context.sendRequest("GET", "/document");

        // when & then
        assertThatCode(() -> {
            assertions.assertJsonPathValue("$.a", "a");
            assertions.assertJsonPathValue("$.b", "2");
            assertions.assertJsonPathValue("$.c", "3.5");
            assertions.assertJsonPathValue("$.d", "true");
            assertions.assertJsonPathValue("$.e", "null");
            assertions.assertJsonPathValue("$.nested.tags", "[\"x\", \"y\"]");
            assertions.assertJsonPathValue("$.nested", "{\"tags\": [\"x\", \"y\"], \"id\": 42}");
        }).doesNotThrowAnyException();
    }

    @Test
    void shouldFailJsonPathValueOnMismatch() {
        // given
        server.respondWithFile(TEST_JSON_PATH);
        context.sendRequest("GET", "/document");

        // when & then
        assertThatThrownBy(() -> assertions.assertJsonPathValue("$.b", "3"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("expected json path $.b to have value 3 but it is 2");
        assertThatThrownBy(() -> assertions.assertJsonPathValue("$.b", "abc"))
                .isInstanceOf(ApiContextParseException.class);
        assertThatThrownBy(() -> assertions.assertJsonPathValue("$.e", "something"))
                .isInstanceOf(ApiContextParseException.class);
        assertThatThrownBy(() -> assertions.assertJsonPathValue("$.unknown", "a"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("$.unknown");
    }

    @Test
    void shouldResolveScopeReferenceInExpectedJsonPathValue() {
        // given
        server.respondWithFile(TEST_JSON_PATH);
        context.sendRequest("GET", "/document");
        context.storeScopeData("expectedName", "second");

        // when & then
        assertThatCode(() -> assertions.assertJsonPathValue("$.list[1].name", "`##expectedName`"))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldMatchJsonPathAgainstPattern() {
        // given
        server.respondWithFile(TEST_JSON_PATH);
        context.sendRequest("GET", "/document");

        // when & then
        assertThatCode(() -> assertions.assertJsonPathMatches("$.list[0].name", "^fir")).doesNotThrowAnyException();
        assertThatCode(() -> assertions.assertJsonPathMatches("$.c", "\\d\\.\\d")).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertJsonPathMatches("$.a", "^b"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("a does not match: ^b");
        assertThatThrownBy(() -> assertions.assertJsonPathMatches("$.a", "("))
                .isInstanceOf(ApiContextParseException.class);
    }

    @Test
    void shouldCountArrays() {
        // given
        server.respondWithFile(TEST_ROOT_ARRAY);
        context.sendRequest("GET", "/items");

        // when & then
        assertThatCode(() -> assertions.assertJsonPathCount("$", 2)).doesNotThrowAnyException();
        assertThatCode(() -> assertions.assertJsonPathCount("$[*].id", 2)).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertJsonPathCount("$", 3))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("does not have count 3 but 2");
        assertThatThrownBy(() -> assertions.assertJsonPathCount("$[0].id", 1))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("is not an array");
    }

    @Test
    void shouldCheckPresenceOfJsonPath() {
        // given
        server.respondWithFile(TEST_JSON_PATH);
        context.sendRequest("GET", "/document");

        // when & then
        assertThatCode(() -> assertions.assertJsonPathPresent("$.nested.id")).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertJsonPathPresent("$.e"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("the json path $.e was not present in the response");
        assertThatThrownBy(() -> assertions.assertJsonPathPresent("$.unknown"))
                .isInstanceOf(ApiContextAssertionException.class);
    }

    @Test
    void shouldCompareJsonDocumentsStructurally() {
        // given
        server.respondWithJson("{\"id\": 1, \"tags\": [\"a\", \"b\"], \"price\": 5}\n");
        context.sendRequest("GET", "/product");

        // when & then
        assertThatCode(() -> assertions.assertMatchesJson("""
                {
                  "price": 5.0,
                  "tags": ["a", "b"],
                  "id": 1
                }
                """)).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertMatchesJson("{\"id\": 1, \"tags\": [\"b\", \"a\"], \"price\": 5}"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("does not match actual")
                .hasMessageContaining("[\"b\", \"a\"]");
        assertThatThrownBy(() -> assertions.assertMatchesJson("{\"id\": 1"))
                .isInstanceOf(ApiContextParseException.class);
    }

    @Test
    void shouldResolveScopeReferenceInExpectedJson() {
        // given
        server.respondWithJson("{\"id\": \"abc-123\"}");
        context.sendRequest("GET", "/product");
        context.storeScopeData("productId", "abc-123");

        // when & then
        assertThatCode(() -> assertions.assertMatchesJson("{\"id\": \"`##productId`\"}")).doesNotThrowAnyException();
    }

    @Test
    void shouldCheckValidJson() {
        // given
        server.respondWith(200, "hello world!");
        context.sendRequest("GET", "/text");

        // when & then
        assertThatThrownBy(() -> assertions.assertValidJson()).isInstanceOf(ApiContextParseException.class);

        server.respondWithJson("[]");
        context.sendRequest("GET", "/json");
        assertThatCode(() -> assertions.assertValidJson()).doesNotThrowAnyException();
    }

    @Test
    void shouldValidateAgainstJsonSchema() {
        // given
        server.respondWithJson("{\"firstName\": \"Ada\", \"lastName\": \"Lovelace\", \"age\": 36}");
        context.sendRequest("GET", "/person");

        // when & then
        assertThatCode(() -> assertions.assertMatchesJsonSchema("person.json")).doesNotThrowAnyException();
        assertThatCode(() -> assertions.assertMatchesJsonSchema("/person.json")).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertMatchesJsonSchema("coordinates.json"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("not valid according to the specified schema coordinates.json")
                .hasMessageContaining("latitude");
        assertThatThrownBy(() -> assertions.assertMatchesJsonSchema("unknown.json"))
                .isInstanceOf(ApiContextResourceException.class)
                .hasMessageContaining("unknown.json");
        assertThatThrownBy(() -> assertions.assertMatchesJsonSchema("broken.json"))
                .isInstanceOf(ApiContextParseException.class);
    }

    @Test
    void shouldReportMalformedBodyBeforeSchemaValidation() {
        // given
        server.respondWith(200, "<html/>");
        context.sendRequest("GET", "/page");

        // when & then
        assertThatThrownBy(() -> assertions.assertMatchesJsonSchema("person.json"))
                .isInstanceOf(ApiContextParseException.class);
    }

    @Test
    void shouldCheckResponseHeaders() {
        // given
        server.respondWithJson("{}").withHeader("X-Request-Id", "42");
        context.sendRequest("GET", "/headers");
        context.storeScopeData("requestId", "42");

        // when & then
        assertThatCode(() -> {
            assertions.assertHeader("X-Request-Id", "42");
            assertions.assertHeader("x-request-id", "`##requestId`");
            assertions.assertHeader("Content-Type", "application/json");
        }).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertHeader("X-Request-Id", "43"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("expected header X-Request-Id to have value 43. actual : 42");
        assertThatThrownBy(() -> assertions.assertHeader("X-Unknown", "1"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("actual : null");
    }

    @Test
    void shouldCheckBodyContentAndPattern() {
        // given
        server.respondWith(200, "order 4711 accepted\n");
        context.sendRequest("POST", "/orders");
        context.storeScopeData("orderNumber", "4711");

        // when & then
        assertThatCode(() -> {
            assertions.assertBodyContains("4711");
            assertions.assertBodyContains("order `##orderNumber` accepted");
            assertions.assertBodyMatches("order \\d+");
        }).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertBodyContains("rejected"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("order 4711 accepted does not contain rejected");
        assertThatThrownBy(() -> assertions.assertBodyMatches("^\\d+$"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessageContaining("does not match pattern");
    }

    @Test
    void shouldStoreValuesFromResponseInScope() {
        // given
        server.respondWithFile(TEST_JSON_PATH).withHeader("Location", "/documents/7");
        context.sendRequest("GET", "/document");

        // when
        assertions.storeResponseHeader("location", "location");
        assertions.storeResponseHeader("X-Unknown", "unknown");
        assertions.storeJsonPathValue("$.a", "a");
        assertions.storeJsonPathValue("$.b", "b");
        assertions.storeJsonPathValue("$.c", "c");
        assertions.storeJsonPathValue("$.nested.tags", "tags");

        // then
        assertThat(context.getScope().asMap())
                .containsEntry("location", "/documents/7")
                .containsEntry("unknown", "")
                .containsEntry("a", "a")
                .containsEntry("b", "2")
                .containsEntry("c", "3.5")
                .containsEntry("tags", "[\"x\",\"y\"]");
    }

    @Test
    void shouldCompareScopeVariableLiterally() {
        // given
        context.storeScopeData("token", "secret");

        // when & then
        assertThatCode(() -> assertions.assertScopeVariable("token", "secret")).doesNotThrowAnyException();
        assertThatCode(() -> assertions.assertScopeVariable("unset", "")).doesNotThrowAnyException();
        assertThatThrownBy(() -> assertions.assertScopeVariable("token", "`##token`"))
                .isInstanceOf(ApiContextAssertionException.class)
                .hasMessage("expected scope variable token to have value `##token`. actual : secret");
    }
}
