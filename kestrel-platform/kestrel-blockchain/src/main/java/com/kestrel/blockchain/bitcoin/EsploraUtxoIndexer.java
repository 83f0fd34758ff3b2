package com.kestrel.blockchain.bitcoin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kestrel.vault.error.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link UtxoIndexer} against a Blockstream/Esplora compatible REST API.
 *
 * {@code GET /address/{address}/utxo} lists outputs, {@code POST /tx} relays a raw transaction.
 */
public class EsploraUtxoIndexer implements UtxoIndexer {

    private static final Logger log = LoggerFactory.getLogger(EsploraUtxoIndexer.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public EsploraUtxoIndexer(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Indexer URL cannot be null or blank");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<List<Utxo>> confirmedUtxos(String address) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/address/" + address + "/utxo"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> parseUtxos(requireSuccess(response, "UTXO query")));
    }

    @Override
    public CompletableFuture<String> broadcast(String rawTransactionHex) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/tx"))
                .timeout(timeout)
                .header("Content-Type", "text/plain")
                .POST(HttpRequest.BodyPublishers.ofString(rawTransactionHex))
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> requireSuccess(response, "Broadcast").trim());
    }

    List<Utxo> parseUtxos(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new NetworkException("Indexer returned malformed UTXO data", e);
        }
        if (root == null || !root.isArray()) {
            throw new NetworkException("Indexer returned malformed UTXO data");
        }
        List<Utxo> utxos = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.path("status").path("confirmed").asBoolean(false)) {
                continue;
            }
            utxos.add(new Utxo(node.path("txid").asText(), node.path("vout").asInt(), node.path("value").asLong()));
        }
        log.debug("Indexer returned {} confirmed outputs of {}", utxos.size(), root.size());
        return utxos;
    }

    private static String requireSuccess(HttpResponse<String> response, String operation) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NetworkException(operation + " failed with HTTP " + status);
        }
        return response.body();
    }
}
