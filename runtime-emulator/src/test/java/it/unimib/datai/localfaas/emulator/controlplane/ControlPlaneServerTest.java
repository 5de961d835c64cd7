package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.localfaas.common.model.ErrorKind;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.state.RuntimeState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ControlPlaneServerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicLong generation = new AtomicLong(1);

    private RuntimeSession session;
    private Handoff handoff;
    private ControlPlaneServer server;

    @BeforeEach
    void setUp() {
        session = new RuntimeSession();
        handoff = new Handoff();
        server = new ControlPlaneServer("127.0.0.1", 0, objectMapper, session, handoff, generation::get);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private URI uri(String suffix) {
        return URI.create("http://127.0.0.1:" + server.port() + RuntimeApiHeaders.runtimePath(suffix));
    }

    private CompletableFuture<HttpResponse<String>> fetchNext() {
        return client.sendAsync(HttpRequest.newBuilder(uri("/runtime/invocation/next")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String suffix, String body) throws Exception {
        return post(suffix, body, null, null);
    }

    private HttpResponse<String> post(String suffix, String body, String header, String value) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(suffix))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (header != null) {
            builder.header(header, value);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private InvocationContext context(String requestId) {
        return InvocationContext.builder(requestId)
                .invokedFunctionArn("arn:aws:lambda:us-east-1:000000000000:function:test-fn")
                .traceId("Root=1-abc")
                .clientContext("{\"custom\":{}}")
                .payload("{\"n\":1}".getBytes(StandardCharsets.UTF_8))
                .timeoutSeconds(30)
                .build();
    }

    private HttpResponse<String> serve(InvocationContext ctx) throws Exception {
        CompletableFuture<HttpResponse<String>> next = fetchNext();
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);
        assertThat(handoff.publish(ctx, Duration.ofSeconds(5))).isTrue();
        return next.get(5, TimeUnit.SECONDS);
    }

    @Test
    void pingAnswers200() throws Exception {
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri("/ping")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    void nextServesPayloadAndIdentityHeaders() throws Exception {
        InvocationContext ctx = context("req-1");

        HttpResponse<String> response = serve(ctx);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"n\":1}");
        assertThat(response.headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-1");
        assertThat(response.headers().firstValue(RuntimeApiHeaders.DEADLINE_MS))
                .contains(String.valueOf(ctx.deadline().toEpochMilli()));
        assertThat(response.headers().firstValue(RuntimeApiHeaders.INVOKED_FUNCTION_ARN))
                .contains("arn:aws:lambda:us-east-1:000000000000:function:test-fn");
        assertThat(response.headers().firstValue(RuntimeApiHeaders.TRACE_ID)).contains("Root=1-abc");
        assertThat(response.headers().firstValue(RuntimeApiHeaders.CLIENT_CONTEXT)).contains("{\"custom\":{}}");
        assertThat(response.headers().firstValue(RuntimeApiHeaders.COGNITO_IDENTITY)).isEmpty();
        assertThat(session.served()).isSameAs(ctx);
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_NEXT);
    }

    @Test
    void responseCompletesServedInvocation() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);

        HttpResponse<String> response = post("/runtime/invocation/req-1/response", "{\"n\":2}",
                RuntimeApiHeaders.LOG_RESULT, Base64.getEncoder().encodeToString("log line".getBytes(StandardCharsets.UTF_8)));

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(objectMapper.readTree(response.body()).get("status").asText()).isEqualTo("OK");
        assertThat(ctx.isCompleted()).isTrue();
        assertThat(ctx.failed()).isFalse();
        assertThat(new String(ctx.response(), StandardCharsets.UTF_8)).isEqualTo("{\"n\":2}");
        assertThat(new String(ctx.logTail().snapshot(), StandardCharsets.UTF_8)).isEqualTo("log line");
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_RESPONSE);
    }

    @Test
    void responseBeforeFetchIsInvalidStateTransition() throws Exception {
        HttpResponse<String> response = post("/runtime/invocation/req-1/response", "{}");

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(objectMapper.readTree(response.body()).get("errorType").asText()).isEqualTo("InvalidStateTransition");
        assertThat(session.state()).isEqualTo(RuntimeState.INIT);
    }

    @Test
    void secondResponseIsRejected() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);
        assertThat(post("/runtime/invocation/req-1/response", "{}").statusCode()).isEqualTo(202);

        HttpResponse<String> again = post("/runtime/invocation/req-1/error", "{\"errorMessage\":\"late\"}");

        assertThat(again.statusCode()).isEqualTo(403);
        assertThat(ctx.failed()).isFalse();
    }

    @Test
    void mismatchedRequestIdIsRejectedWithoutFailingInvocation() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);

        HttpResponse<String> response = post("/runtime/invocation/other-id/response", "{}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(objectMapper.readTree(response.body()).get("errorType").asText()).isEqualTo("InvalidRequestID");
        assertThat(ctx.isCompleted()).isFalse();
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_NEXT);
    }

    @Test
    void errorIsParsedIntoFunctionError() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);

        HttpResponse<String> response = post("/runtime/invocation/req-1/error",
                "{\"errorMessage\":\"boom\",\"errorType\":\"ValueError\",\"stackTrace\":[\"a\",\"b\"],"
                        + "\"cause\":{\"errorMessage\":\"root\"}}");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(ctx.error().kind()).isEqualTo(ErrorKind.UNHANDLED);
        assertThat(ctx.error().errorMessage()).isEqualTo("boom");
        assertThat(ctx.error().errorType()).isEqualTo("ValueError");
        assertThat(ctx.error().stackTrace()).containsExactly("a", "b");
        assertThat(ctx.error().cause().errorMessage()).isEqualTo("root");
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_ERROR);
    }

    @Test
    void errorTypeFallsBackToHeader() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);

        post("/runtime/invocation/req-1/error", "{\"errorMessage\":\"boom\"}",
                RuntimeApiHeaders.FUNCTION_ERROR_TYPE, "Runtime.Custom");

        assertThat(ctx.error().errorType()).isEqualTo("Runtime.Custom");
    }

    @Test
    void malformedErrorPayloadBecomesInvalidShape() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);

        HttpResponse<String> response = post("/runtime/invocation/req-1/error", "not json at all");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(ctx.error().kind()).isEqualTo(ErrorKind.INVALID_ERROR_SHAPE);
        assertThat(ctx.error().errorType()).isEqualTo("InvalidErrorShape");
    }

    @Test
    void initErrorFailsCurrentInvocation() throws Exception {
        InvocationContext ctx = context("req-1");
        session.begin(ctx);

        HttpResponse<String> response = post("/runtime/init/error",
                "{\"errorMessage\":\"cannot import handler\",\"errorType\":\"Runtime.ImportModuleError\"}");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(ctx.error().kind()).isEqualTo(ErrorKind.INIT_ERROR);
        assertThat(ctx.error().errorType()).isEqualTo("Runtime.ImportModuleError");
        assertThat(session.state()).isEqualTo(RuntimeState.INIT_ERROR);
        assertThat(post("/runtime/init/error", "{\"errorMessage\":\"again\"}").statusCode()).isEqualTo(403);
    }

    @Test
    void fetchingAgainCompletesUnacknowledgedInvocation() throws Exception {
        InvocationContext first = context("req-1");
        serve(first);
        assertThat(first.isCompleted()).isFalse();

        InvocationContext second = context("req-2");
        HttpResponse<String> response = serve(second);

        assertThat(first.isCompleted()).isTrue();
        assertThat(first.failed()).isFalse();
        assertThat(response.headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-2");
    }

    @Test
    void completedWorkIsSkipped() throws Exception {
        InvocationContext stale = context("req-1");
        stale.completeWithResponse(new byte[0]);
        CompletableFuture<HttpResponse<String>> next = fetchNext();
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);
        assertThat(handoff.publish(stale, Duration.ofSeconds(5))).isTrue();

        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);
        assertThat(handoff.publish(context("req-2"), Duration.ofSeconds(5))).isTrue();

        assertThat(next.get(5, TimeUnit.SECONDS).headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-2");
    }

    @Test
    void abandonedWaiterOfExitedWorkerDoesNotWedgeServer() throws Exception {
        CompletableFuture<HttpResponse<String>> abandoned = fetchNext();
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);

        generation.set(-1);
        handoff.wakeWaiters();
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 0);
        assertThat(abandoned).failsWithin(Duration.ofSeconds(5));

        generation.set(2);
        HttpResponse<String> response = serve(context("req-2"));
        assertThat(response.headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-2");
    }

    @Test
    void waiterOfExitedWorkerGivesWayToCurrentWorker() throws Exception {
        CompletableFuture<HttpResponse<String>> stale = fetchNext();
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);

        generation.set(2);
        CompletableFuture<HttpResponse<String>> fresh = fetchNext();
        assertThat(stale).failsWithin(Duration.ofSeconds(5));
        await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);

        InvocationContext ctx = context("req-1");
        assertThat(handoff.publish(ctx, Duration.ofSeconds(5))).isTrue();

        HttpResponse<String> response = fresh.get(5, TimeUnit.SECONDS);
        assertThat(response.headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-1");
        assertThat(ctx.isCompleted()).isFalse();
    }

    @Test
    void disconnectedWaiterOfLiveWorkerDoesNotWedgeServer() throws Exception {
        try (Socket socket = new Socket("127.0.0.1", server.port())) {
            OutputStream out = socket.getOutputStream();
            out.write(("GET " + RuntimeApiHeaders.runtimePath("/runtime/invocation/next") + " HTTP/1.1\r\n"
                    + "Host: 127.0.0.1\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
            out.flush();
            await().atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);
        }

        CompletableFuture<HttpResponse<String>> live = fetchNext();
        await().pollDelay(Duration.ofMillis(300)).atMost(5, TimeUnit.SECONDS).until(() -> handoff.waiting() == 1);

        InvocationContext ctx = context("req-1");
        assertThat(handoff.publish(ctx, Duration.ofSeconds(5))).isTrue();

        HttpResponse<String> response = live.get(5, TimeUnit.SECONDS);
        assertThat(response.headers().firstValue(RuntimeApiHeaders.REQUEST_ID)).contains("req-1");
        assertThat(session.served()).isSameAs(ctx);
        assertThat(ctx.isCompleted()).isFalse();
        assertThat(post("/runtime/invocation/req-1/response", "{}").statusCode()).isEqualTo(202);
        assertThat(ctx.isCompleted()).isTrue();
    }

    @Test
    void stopReleasesParkedWaiters() {
        Handoff own = new Handoff();
        ControlPlaneServer other = new ControlPlaneServer("127.0.0.1", 0, objectMapper, new RuntimeSession(), own,
                generation::get);
        other.start();
        client.sendAsync(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + other.port()
                        + RuntimeApiHeaders.runtimePath("/runtime/invocation/next"))).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        await().atMost(5, TimeUnit.SECONDS).until(() -> own.waiting() == 1);

        other.stop();

        await().atMost(5, TimeUnit.SECONDS).until(() -> own.waiting() == 0);
    }

    @Test
    void wrongMethodIs405() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(uri("/runtime/invocation/next")).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    void unknownActionIs404() throws Exception {
        InvocationContext ctx = context("req-1");
        serve(ctx);
        assertThat(post("/runtime/invocation/req-1/bogus", "{}").statusCode()).isEqualTo(404);
    }

    @Test
    void errorBodyContainsMessage() throws Exception {
        HttpResponse<String> response = post("/runtime/init/error", "{}");
        assertThat(response.statusCode()).isEqualTo(202);

        HttpResponse<String> rejected = post("/runtime/invocation/x/response", "{}");
        JsonNode body = objectMapper.readTree(rejected.body());
        assertThat(body.get("errorMessage").asText()).contains("INIT_ERROR").contains("INVOKE_RESPONSE");
    }
}
