package com.flowtest.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowtest.config.FlowProperties;
import com.flowtest.engine.HttpSession;
import com.flowtest.model.FlowCollection;
import com.flowtest.model.FlowResult;
import com.flowtest.model.Issue;
import com.flowtest.model.SingleRequest;
import com.flowtest.service.api.RequestExecutor;
import com.flowtest.service.api.ResultLogService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FlowEngineImplTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer mockWebServer;
    private FlowProperties properties;
    private FlowEngineImpl flowEngine;

    @Mock
    private ResultLogService resultLog;

    @Mock
    private RequestExecutor failingExecutor;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        properties = new FlowProperties();
        flowEngine = new FlowEngineImpl(new CollectionLoaderImpl(),
                new RequestExecutorImpl(WebClient.builder().build()),
                new ResponseValidatorImpl(), resultLog, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void runFlow_shouldThreadExtractedValuesAndSummarize() throws Exception {
        FlowCollection collection = collection("{\"variables\": {\"uname\": \"alice\"},"
                + "\"steps\": ["
                + "{\"method\": \"GET\", \"url\": \"/health\", \"expect\": {\"status\": 200}},"
                + "{\"method\": \"POST\", \"url\": \"/users\", \"body\": {\"name\": \"{{uname}}\"},"
                + "\"expect\": {\"status\": 201}, \"extract\": {\"id\": \"user.id\"}}"
                + "]}");
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        mockWebServer.enqueue(new MockResponse().setResponseCode(201)
                .setBody("{\"user\":{\"id\":7}}").addHeader("Content-Type", "application/json"));

        FlowResult result = flowEngine.runFlow(collection, "users.json", baseUrl());

        assertThat(result.success()).isTrue();
        assertThat(result.issues()).isEmpty();
        assertThat(result.summary()).isEqualTo("Successfully executed 2 steps in flow 'Unnamed Flow'");
        assertThat(result.extracted().get("id").intValue()).isEqualTo(7);

        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/health");
        RecordedRequest create = mockWebServer.takeRequest();
        assertThat(create.getPath()).isEqualTo("/users");
        // object bodies are sent without placeholder substitution
        assertThat(create.getBody().readUtf8()).isEqualTo("{\"name\":\"{{uname}}\"}");
        verify(resultLog).append(result);
    }

    @Test
    void runFlow_shouldSubstituteExtractedValuesIntoLaterSteps() throws Exception {
        FlowCollection collection = collection("{\"name\": \"Items\","
                + "\"headers\": {\"X-Tenant\": \"{{tenant}}\"},"
                + "\"variables\": {\"tenant\": \"acme\"},"
                + "\"steps\": ["
                + "{\"name\": \"Create\", \"method\": \"POST\", \"url\": \"/items\", \"body\": \"item for {{tenant}}\","
                + "\"extract\": {\"item_id\": \"id\", \"owner\": \"missing.path\"}},"
                + "{\"name\": \"Read\", \"url\": \"{{base_url}}/items/{{item_id}}\", \"headers\": {\"x-tenant\": \"override\"}},"
                + "{\"name\": \"Owner\", \"url\": \"/owners/{{owner}}\"}"
                + "]}");
        mockWebServer.enqueue(new MockResponse().setBody("{\"id\":\"it-9\"}"));
        mockWebServer.enqueue(new MockResponse());
        mockWebServer.enqueue(new MockResponse());

        FlowResult result = flowEngine.runFlow(collection, "items.json", baseUrl());

        assertThat(result.success()).isTrue();
        assertThat(result.summary()).isEqualTo("Successfully executed 3 steps in flow 'Items'");

        RecordedRequest create = mockWebServer.takeRequest();
        assertThat(create.getBody().readUtf8()).isEqualTo("item for acme");
        assertThat(create.getHeader("X-Tenant")).isEqualTo("acme");

        RecordedRequest read = mockWebServer.takeRequest();
        assertThat(read.getPath()).isEqualTo("/items/it-9");
        assertThat(read.getHeader("X-Tenant")).isEqualTo("override");

        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/owners/null");
    }

    @Test
    void runFlow_shouldStopAtFirstFailingStep() throws Exception {
        FlowCollection collection = collection("{\"name\": \"Fail fast\","
                + "\"steps\": ["
                + "{\"name\": \"First\", \"url\": \"/one\"},"
                + "{\"name\": \"Second\", \"url\": \"/two\", \"extract\": {\"x\": \"value\"}},"
                + "{\"name\": \"Third\", \"url\": \"/three\"}"
                + "]}");
        mockWebServer.enqueue(new MockResponse());
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("{\"value\":1}"));
        mockWebServer.enqueue(new MockResponse());

        FlowResult result = flowEngine.runFlow(collection, "fail.json", baseUrl());

        assertThat(result.success()).isFalse();
        assertThat(result.summary()).isNull();
        assertThat(result.extracted()).isNull();
        assertThat(result.issues()).containsExactly(Issue.withResponse("fail.json:2", "Second",
                "Expected status 200, got 500", 500, "{\"value\":1}"));
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    void runFlow_shouldReportEveryViolationOfTheFailingStep() throws Exception {
        FlowCollection collection = collection("{\"steps\": [{\"url\": \"/users/1\","
                + "\"expect\": {\"status\": 200, \"body\": {\"name\": \"alice\", \"role\": \"admin\"}, \"headers\": {\"X-Env\": \"prod\"}}}]}");
        mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("{\"name\":\"bob\"}"));

        FlowResult result = flowEngine.runFlow(collection, "users.json", baseUrl());

        assertThat(result.issues()).extracting(Issue::message).containsExactly(
                "Expected status 200, got 404",
                "Expected name='alice', got 'bob'",
                "Missing expected key 'role' in response",
                "Missing expected header 'X-Env'");
        assertThat(result.issues()).allSatisfy(issue -> {
            assertThat(issue.type()).isEqualTo("flow");
            assertThat(issue.location()).isEqualTo("users.json:1");
            assertThat(issue.step()).isEqualTo("Step 1");
            assertThat(issue.responseStatus()).isEqualTo(404);
        });
    }

    @Test
    void runFlow_shouldTruncateLongResponseBodies() throws Exception {
        properties.setResponseBodyLimit(10);
        FlowCollection collection = collection("{\"steps\": [{\"url\": \"/big\", \"expect\": {\"status\": 204}}]}");
        mockWebServer.enqueue(new MockResponse().setBody("0123456789abcdef"));

        FlowResult result = flowEngine.runFlow(collection, "big.json", baseUrl());

        assertThat(result.issues().get(0).responseBody()).isEqualTo("0123456789...");
    }

    @Test
    void runFlow_shouldReportMissingSteps() throws Exception {
        FlowResult result = flowEngine.runFlow(collection("{\"name\": \"Empty\", \"steps\": []}"), "empty.json", baseUrl());

        assertThat(result.success()).isFalse();
        assertThat(result.issues()).containsExactly(Issue.setup("empty.json", "No test steps found in collection"));
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void runFlow_shouldRejectCollectionFileWithoutSteps() throws Exception {
        String path = resource("collections/no-steps.yml");

        FlowResult result = flowEngine.runFlow(path, baseUrl());

        assertThat(result.issues()).containsExactly(Issue.setup(path, "No test steps found in collection"));
        verify(resultLog).append(result);
    }

    @Test
    void runFlow_shouldHaltOnConnectionFailure() throws Exception {
        FlowCollection collection = collection("{\"steps\": [{\"name\": \"Ping\", \"url\": \"/ping\"}, {\"url\": \"/next\"}]}");
        MockWebServer closedServer = new MockWebServer();
        closedServer.start();
        String closedBaseUrl = closedServer.url("/").toString();
        closedServer.shutdown();

        FlowResult result = flowEngine.runFlow(collection, "ping.json", closedBaseUrl);

        assertThat(result.issues()).hasSize(1);
        Issue issue = result.issues().get(0);
        assertThat(issue.step()).isEqualTo("Ping");
        assertThat(issue.message()).startsWith("Request failed: connection failure: ");
        assertThat(issue.responseStatus()).isNull();
    }

    @Test
    void runFlow_shouldHaltWhenStepFailsUnexpectedly() throws Exception {
        FlowEngineImpl engine = new FlowEngineImpl(new CollectionLoaderImpl(), failingExecutor,
                new ResponseValidatorImpl(), resultLog, properties);
        when(failingExecutor.newSession()).thenReturn(new HttpSession(WebClient.builder().build()));
        when(failingExecutor.execute(any(), any())).thenThrow(new IllegalStateException("connection pool closed"));
        FlowCollection collection = collection("{\"steps\": [{\"url\": \"/one\"}, {\"url\": \"/two\"}]}");

        FlowResult result = engine.runFlow(collection, "pool.json", "http://localhost:8080");

        assertThat(result.success()).isFalse();
        assertThat(result.issues()).containsExactly(
                Issue.of("pool.json:1", "Step 1", "Step execution failed: connection pool closed"));
        verify(failingExecutor, times(1)).execute(any(), any());
        verify(resultLog).append(result);
    }

    @Test
    void runFlow_shouldReportTimeoutsWithTheStepTimeout() throws Exception {
        FlowCollection collection = collection("{\"steps\": [{\"url\": \"/slow\", \"timeout\": 0.2}]}");
        mockWebServer.enqueue(new MockResponse().setHeadersDelay(2, TimeUnit.SECONDS));

        FlowResult result = flowEngine.runFlow(collection, "slow.json", baseUrl());

        assertThat(result.issues()).extracting(Issue::message).containsExactly("Request failed: timed out after 0.2s");
    }

    @Test
    void runFlow_shouldReportOversizedResponseAsRequestFailure() throws Exception {
        FlowEngineImpl smallBufferEngine = new FlowEngineImpl(new CollectionLoaderImpl(),
                new RequestExecutorImpl(WebClient.builder().codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(1024)).build()),
                new ResponseValidatorImpl(), resultLog, properties);
        FlowCollection collection = collection("{\"steps\": [{\"url\": \"/big\"}, {\"url\": \"/next\"}]}");
        mockWebServer.enqueue(new MockResponse().setBody("x".repeat(4096)));

        FlowResult result = smallBufferEngine.runFlow(collection, "big.json", baseUrl());

        assertThat(result.issues()).extracting(Issue::message)
                .singleElement().asString().startsWith("Request failed: malformed response: ");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void runFlow_shouldLoadYamlCollectionFromFile() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(201)
                .setBody("{\"user\":{\"id\":42}}").addHeader("Content-Type", "application/json"));
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"id\":42,\"name\":\"alice\"}").addHeader("Content-Type", "application/json"));

        FlowResult result = flowEngine.runFlow(resource("collections/users-flow.yaml"), baseUrl() + "/");

        assertThat(result.success()).isTrue();
        assertThat(result.summary()).isEqualTo("Successfully executed 2 steps in flow 'User lifecycle'");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/users");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/users/42");
    }

    @Test
    void runFlow_shouldReportMissingCollectionFile() {
        FlowResult result = flowEngine.runFlow("does/not/exist.yaml", baseUrl());

        assertThat(result.success()).isFalse();
        Issue issue = result.issues().get(0);
        assertThat(issue.location()).isEqualTo("does/not/exist.yaml");
        assertThat(issue.step()).isEqualTo("setup");
        assertThat(issue.message()).startsWith("Collection file not found");
        verify(resultLog).append(result);
    }

    @Test
    void runFlow_shouldReportUnparsableCollection() throws Exception {
        FlowResult result = flowEngine.runFlow(resource("collections/broken.yaml"), baseUrl());

        assertThat(result.issues()).extracting(Issue::message)
                .singleElement().asString().startsWith("YAML parsing error: ");
    }

    @Test
    void runFlow_shouldReturnResultWhenResultLogFails() throws Exception {
        doThrow(new IllegalStateException("disk full")).when(resultLog).append(any());
        mockWebServer.enqueue(new MockResponse());

        FlowResult result = flowEngine.runFlow(collection("{\"steps\": [{\"url\": \"/ok\"}]}"), "ok.json", baseUrl());

        assertThat(result.success()).isTrue();
    }

    @Test
    void runSingle_shouldCheckStatusAndExtract() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(201).setBody("{\"data\":{\"token\":\"t-1\"}}"));

        FlowResult result = flowEngine.runSingle(new SingleRequest("POST", "/login", baseUrl(), 201,
                "{\"user\":\"alice\"}", "{\"X-Trace\":\"abc\"}", "{\"token\":\"data.token\"}", Duration.ofSeconds(5)));

        assertThat(result.success()).isTrue();
        assertThat(result.extracted()).containsEntry("token", TextNode.valueOf("t-1"));

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getHeader("X-Trace")).isEqualTo("abc");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).get("user").asText()).isEqualTo("alice");
    }

    @Test
    void runSingle_shouldReportUnexpectedStatus() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("down"));

        FlowResult result = flowEngine.runSingle(new SingleRequest("GET", "/health", baseUrl(), 200,
                null, null, null, null));

        assertThat(result.issues()).containsExactly(Issue.withResponse("cli", "GET /health",
                "Expected status 200, got 503", 503, "down"));
    }

    @Test
    void runSingle_shouldRejectInvalidHeaders() {
        FlowResult result = flowEngine.runSingle(new SingleRequest("GET", "/health", baseUrl(), 200,
                null, "{not json", null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.issues().get(0).step()).isEqualTo("setup");
        assertThat(result.issues().get(0).message()).startsWith("Invalid headers JSON: ");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void runSingle_shouldSendNonJsonBodyAsText() throws Exception {
        mockWebServer.enqueue(new MockResponse());

        FlowResult result = flowEngine.runSingle(new SingleRequest("POST", "/notes", baseUrl(), 200,
                "just text", null, "oops", null));

        assertThat(mockWebServer.takeRequest().getBody().readUtf8()).isEqualTo("just text");
        assertThat(result.issues()).extracting(Issue::message)
                .singleElement().asString().startsWith("Invalid extract JSON: ");
    }

    @Test
    void runSingle_shouldSendJsonScalarBodyAsJson() throws Exception {
        mockWebServer.enqueue(new MockResponse());
        mockWebServer.enqueue(new MockResponse());

        flowEngine.runSingle(new SingleRequest("PUT", "/limit", baseUrl(), 200, " 42 ", null, null, null));
        flowEngine.runSingle(new SingleRequest("PUT", "/limit", baseUrl(), 200, "42 apples", null, null, null));

        RecordedRequest json = mockWebServer.takeRequest();
        assertThat(json.getHeader("Content-Type")).startsWith("application/json");
        assertThat(json.getBody().readUtf8()).isEqualTo("42");
        RecordedRequest text = mockWebServer.takeRequest();
        assertThat(text.getHeader("Content-Type")).startsWith("text/plain");
        assertThat(text.getBody().readUtf8()).isEqualTo("42 apples");
    }

    private String baseUrl() {
        String url = mockWebServer.url("/").toString();
        return url.substring(0, url.length() - 1);
    }

    private FlowCollection collection(String json) throws Exception {
        return objectMapper.readValue(json, FlowCollection.class);
    }

    private String resource(String name) throws Exception {
        URL url = getClass().getClassLoader().getResource(name);
        assertThat(url).isNotNull();
        return Paths.get(url.toURI()).toString();
    }
}
