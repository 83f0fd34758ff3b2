package com.kestrel.blockchain.bitcoin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kestrel.vault.error.NetworkException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EsploraUtxoIndexerTest {

    private final EsploraUtxoIndexer indexer = new EsploraUtxoIndexer(
            "https://blockstream.info/api/", HttpClient.newHttpClient(), new ObjectMapper(), Duration.ofSeconds(5));

    @Test
    void keepsOnlyConfirmedOutputs() {
        String body = """
                [
                  {"txid": "%s", "vout": 0, "value": 150000,
                   "status": {"confirmed": true, "block_height": 800000}},
                  {"txid": "%s", "vout": 2, "value": 9000,
                   "status": {"confirmed": false}},
                  {"txid": "%s", "vout": 1, "value": 42000,
                   "status": {"confirmed": true, "block_height": 800001}}
                ]
                """.formatted("a".repeat(64), "b".repeat(64), "c".repeat(64));

        List<Utxo> utxos = indexer.parseUtxos(body);

        assertThat(utxos).containsExactly(
                new Utxo("a".repeat(64), 0, 150_000),
                new Utxo("c".repeat(64), 1, 42_000));
    }

    @Test
    void emptyArrayGivesNoOutputs() {
        assertThat(indexer.parseUtxos("[]")).isEmpty();
    }

    @Test
    void malformedBodyIsNetworkError() {
        assertThatThrownBy(() -> indexer.parseUtxos("<html>busy</html>"))
                .isInstanceOf(NetworkException.class);
        assertThatThrownBy(() -> indexer.parseUtxos("{\"error\": \"rate limited\"}"))
                .isInstanceOf(NetworkException.class);
    }
}
