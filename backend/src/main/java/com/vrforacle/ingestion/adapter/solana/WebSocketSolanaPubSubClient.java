package com.vrforacle.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongConsumer;

/**
 * {@code logsSubscribe} over a websocket connection per subscription.
 */
@Slf4j
public class WebSocketSolanaPubSubClient implements SolanaPubSubClient {

    private final WebSocketClient webSocketClient;
    private final URI wsUri;
    private final ObjectMapper objectMapper;

    public WebSocketSolanaPubSubClient(WebSocketClient webSocketClient, String wsUrl, ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.wsUri = URI.create(wsUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public Flux<LogsNotification> logsSubscribe(PublicKey programId, Commitment commitment, LongConsumer onSubscribed) {
        return Flux.create(sink -> {
            String request = subscribeRequest(programId, commitment);
            Disposable connection = webSocketClient.execute(wsUri, session -> session
                            .send(Mono.just(session.textMessage(request)))
                            .thenMany(session.receive().map(WebSocketMessage::getPayloadAsText))
                            .doOnNext(frame -> handleFrame(frame, sink, onSubscribed))
                            .then())
                    .subscribe(null,
                            e -> sink.error(e instanceof RpcException ? e : new RpcException("logs subscription failed: " + e.getMessage(), e)),
                            sink::complete);
            sink.onDispose(connection);
        });
    }

    String subscribeRequest(PublicKey programId, Commitment commitment) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", "logsSubscribe",
                "params", List.of(
                        Map.of("mentions", List.of(programId.toBase58())),
                        Map.of("commitment", commitment.value())));
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize logsSubscribe request", e);
        }
    }

    void handleFrame(String frame, FluxSink<LogsNotification> sink, LongConsumer onSubscribed) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed pub/sub frame: {}", e.getOriginalMessage());
            return;
        }
        if ("logsNotification".equals(root.path("method").asText())) {
            JsonNode value = root.path("params").path("result").path("value");
            JsonNode err = value.path("err");
            List<String> logs = new ArrayList<>();
            value.path("logs").forEach(l -> logs.add(l.asText()));
            sink.next(new LogsNotification(
                    value.path("signature").asText(),
                    err.isNull() || err.isMissingNode() ? null : err.toString(),
                    logs));
            return;
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            sink.error(new SolanaRpcErrorException("logsSubscribe", error.path("code").asInt(),
                    error.path("message").asText(""), error.get("data")));
            return;
        }
        if (root.has("id") && root.path("result").isNumber()) {
            onSubscribed.accept(root.path("result").asLong());
        }
    }
}
