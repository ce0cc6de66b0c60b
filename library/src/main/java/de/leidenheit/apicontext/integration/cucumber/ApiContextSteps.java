package de.leidenheit.apicontext.integration.cucumber;

import com.google.common.base.Strings;
import de.leidenheit.apicontext.core.context.ApiContext;
import de.leidenheit.apicontext.core.context.ApiContextOptions;
import de.leidenheit.apicontext.core.evaluation.ResponseAssertions;
import de.leidenheit.apicontext.core.exception.ApiContextParseException;
import de.leidenheit.apicontext.core.model.FormField;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.Before;
import io.cucumber.java.Scenario;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Step definitions for testing REST APIs from Cucumber scenarios.
 * <p>
 * Add {@code de.leidenheit.apicontext.integration.cucumber} to the glue path. Cucumber creates one
 * instance per scenario, so every scenario works on its own {@link ApiContext}, configured from the
 * {@code apicontext.*} system properties (see {@link ApiContextOptions#fromSystemProperties()}).
 * Data tables are read without a header row; empty cells count as empty strings.
 */
@Slf4j
public class ApiContextSteps {

    @Getter
    private final ApiContext context;
    private final ResponseAssertions assertions;

    public ApiContextSteps() {
        this(new ApiContext(ApiContextOptions.fromSystemProperties()));
    }

    public ApiContextSteps(final ApiContext context) {
        this.context = context;
        this.assertions = new ResponseAssertions(context);
    }

    @Before
    public void reset(final Scenario scenario) {
        log.debug("Starting scenario '{}'", scenario.getName());
        context.reset();
    }

    @Given("^I set header \"([^\"]*)\" with value \"([^\"]*)\"$")
    public void iSetHeaderWithValue(final String name, final String value) {
        context.setHeader(name, value);
    }

    @Given("^I set headers to:$")
    public void iSetHeadersTo(final DataTable dataTable) {
        context.setHeaders(toMap(dataTable));
    }

    @Given("^I set query param \"([^\"]*)\" with value \"([^\"]*)\"$")
    public void iSetQueryParamWithValue(final String name, final String value) {
        context.setQueryParam(name, value);
    }

    @Given("^I set query params to:$")
    public void iSetQueryParamsTo(final DataTable dataTable) {
        context.setQueryParams(toMap(dataTable));
    }

    @When("^I send \"([^\"]*)\" request to \"([^\"]*)\"$")
    public void iSendRequestTo(final String method, final String path) {
        context.sendRequest(method, path);
    }

    @When("^I send \"([^\"]*)\" request to \"([^\"]*)\" with form body:$")
    public void iSendRequestToWithFormBody(final String method, final String path, final DataTable dataTable) {
        List<FormField> formFields = dataTable.asLists().stream()
                .map(row -> requireCells(row, 3, "key | value | text or file"))
                .map(row -> FormField.builder()
                        .key(row.get(0))
                        .value(Strings.nullToEmpty(row.get(1)))
                        .kind(FormField.FormFieldKind.fromValue(row.get(2)))
                        .build())
                .collect(Collectors.toList());
        context.sendRequestWithFormBody(method, path, formFields);
    }

    @When("^I send \"([^\"]*)\" request to \"([^\"]*)\" with body:$")
    public void iSendRequestToWithBody(final String method, final String path, final String body) {
        context.sendRequestWithBody(method, path, body);
    }

    @Then("^The response code should be (\\d+)$")
    public void theResponseCodeShouldBe(final int statusCode) {
        assertions.assertStatusCode(statusCode);
    }

    @Then("^The response should be a valid json$")
    public void theResponseShouldBeAValidJson() {
        assertions.assertValidJson();
    }

    @Then("^The response should match json:$")
    public void theResponseShouldMatchJson(final String body) {
        assertions.assertMatchesJson(body);
    }

    @Then("^The response header \"([^\"]*)\" should have value \"([^\"]*)\"$")
    public void theResponseHeaderShouldHaveValue(final String name, final String expectedValue) {
        assertions.assertHeader(name, expectedValue);
    }

    @Then("^The response should match json schema \"([^\"]*)\"$")
    public void theResponseShouldMatchJsonSchema(final String path) {
        assertions.assertMatchesJsonSchema(path);
    }

    @Then("^The json path \"([^\"]*)\" should have value \"([^\"]*)\"$")
    public void theJsonPathShouldHaveValue(final String pathExpression, final String expectedValue) {
        assertions.assertJsonPathValue(pathExpression, expectedValue);
    }

    @Then("^The json path \"([^\"]*)\" should match \"([^\"]*)\"$")
    public void theJsonPathShouldMatch(final String pathExpression, final String pattern) {
        assertions.assertJsonPathMatches(pathExpression, pattern);
    }

    @Then("^The json path \"([^\"]*)\" should have count \"(\\d+)\"$")
    public void theJsonPathShouldHaveCount(final String pathExpression, final int expectedCount) {
        assertions.assertJsonPathCount(pathExpression, expectedCount);
    }

    @Then("^The json path \"([^\"]*)\" should be present$")
    public void theJsonPathShouldBePresent(final String pathExpression) {
        assertions.assertJsonPathPresent(pathExpression);
    }

    @Then("^The response body should contain \"([^\"]*)\"$")
    public void theResponseBodyShouldContain(final String expectedSubstring) {
        assertions.assertBodyContains(expectedSubstring);
    }

    @Then("^The response body should match \"([^\"]*)\"$")
    public void theResponseBodyShouldMatch(final String pattern) {
        assertions.assertBodyMatches(pattern);
    }

    @When("^I wait for (\\d+) seconds$")
    public void iWaitForSeconds(final int seconds) {
        context.waitFor(Duration.ofSeconds(seconds));
    }

    @Given("^I store data in scope variable \"([^\"]*)\" with value \"([^\"]*)\"$")
    public void iStoreDataInScopeVariable(final String scopeKey, final String value) {
        context.storeScopeData(scopeKey, value);
    }

    @When("^I store the value of response header \"([^\"]*)\" as \"([^\"]*)\" in scenario scope$")
    public void iStoreTheValueOfResponseHeader(final String name, final String scopeKey) {
        assertions.storeResponseHeader(name, scopeKey);
    }

    @When("^I store the value of body path \"([^\"]*)\" as \"([^\"]*)\" in scenario scope$")
    public void iStoreTheValueOfBodyPath(final String pathExpression, final String scopeKey) {
        assertions.storeJsonPathValue(pathExpression, scopeKey);
    }

    @Then("^The scope variable \"([^\"]*)\" should have value \"([^\"]*)\"$")
    public void theScopeVariableShouldHaveValue(final String scopeKey, final String expectedValue) {
        assertions.assertScopeVariable(scopeKey, expectedValue);
    }

    private Map<String, String> toMap(final DataTable dataTable) {
        Map<String, String> rows = new LinkedHashMap<>();
        dataTable.asLists().stream()
                .map(row -> requireCells(row, 2, "name | value"))
                .forEach(row -> rows.put(row.get(0), Strings.nullToEmpty(row.get(1))));
        return rows;
    }

    private List<String> requireCells(final List<String> row, final int expectedCells, final String layout) {
        if (row.size() < expectedCells) {
            throw new ApiContextParseException("Table row %s has %d cell(s) but %d are expected: %s"
                    .formatted(row, row.size(), expectedCells, layout));
        }
        return row;
    }
}
