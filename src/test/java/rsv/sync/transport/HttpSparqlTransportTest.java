package rsv.sync.transport;

import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HttpSparqlTransportTest {

    private HttpServer server;
    private String endpoint;
    private final AtomicReference<String> lastAccept = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @Before
    public void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/query", exchange -> {
            lastAccept.set(exchange.getRequestHeaders().getFirst("Accept"));
            String rawQuery = exchange.getRequestURI().getRawQuery();
            lastQuery.set(URLDecoder.decode(rawQuery.substring("query=".length()), StandardCharsets.UTF_8));
            byte[] body;
            if (lastQuery.get().startsWith("SELECT")) {
                body = ("{\"head\":{\"vars\":[\"item\"]},\"results\":{\"bindings\":["
                        + "{\"item\":{\"type\":\"uri\",\"value\":\"https://example.org/a\"}}]}}")
                        .getBytes(StandardCharsets.UTF_8);
            } else {
                body = "<https://example.org/a> <https://example.org/p> \"x\" .\n".getBytes(StandardCharsets.UTF_8);
            }
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/broken", exchange -> {
            byte[] body = "Query evaluation failed".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(500, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/latin1", exchange -> {
            byte[] body = ("{\"results\":{\"bindings\":[{\"item\":{\"type\":\"literal\",\"value\":\"caf\u00e9\"}}]}}")
                    .getBytes(StandardCharsets.ISO_8859_1);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        endpoint = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @After
    public void stopServer() {
        server.stop(0);
    }

    @Test
    public void testConstructQuery() throws Exception {
        String query = "CONSTRUCT { ?s ?p ?o } WHERE { GRAPH <https://example.org/g> { ?s ?p ?o . } }";
        byte[] payload = new HttpSparqlTransport().executeConstructQuery(endpoint + "/query", query,
                RdfSyntax.NTRIPLES, Duration.ofSeconds(5));
        assertTrue(new String(payload, StandardCharsets.UTF_8).startsWith("<https://example.org/a>"));
        assertEquals("application/n-triples", lastAccept.get());
        assertEquals(query, lastQuery.get());
    }

    @Test
    public void testSelectQuery() throws Exception {
        List<Map<String, String>> rows = new HttpSparqlTransport().executeSelectQuery(endpoint + "/query",
                "SELECT DISTINCT ?item WHERE { ?item a <https://cube.link/Cube> }", Duration.ofSeconds(5));
        assertEquals(1, rows.size());
        assertEquals("https://example.org/a", rows.get(0).get("item"));
        assertEquals(HttpSparqlTransport.SPARQL_RESULTS_JSON, lastAccept.get());
    }

    @Test
    public void testErrorStatus() {
        try {
            new HttpSparqlTransport().executeConstructQuery(endpoint + "/broken", "CONSTRUCT {} WHERE {}",
                    RdfSyntax.TURTLE, Duration.ofSeconds(5));
            fail("Expected TransportException");
        } catch (TransportException e) {
            assertEquals(500, e.getStatusCode());
            assertTrue(e.getMessage().contains("Query evaluation failed"));
            assertEquals(endpoint + "/broken", e.getEndpoint());
        }
    }

    @Test
    public void testTimeout() {
        try {
            new HttpSparqlTransport().executeConstructQuery(endpoint + "/slow", "CONSTRUCT {} WHERE {}",
                    RdfSyntax.TURTLE, Duration.ofSeconds(1));
            fail("Expected TransportException");
        } catch (TransportException e) {
            assertTrue(e.getMessage().contains("timed out"));
            assertEquals(-1, e.getStatusCode());
        }
    }

    @Test
    public void testSelectRejectsInvalidUtf8() {
        try {
            new HttpSparqlTransport().executeSelectQuery(endpoint + "/latin1",
                    "SELECT DISTINCT ?item WHERE { ?item a <https://cube.link/Cube> }", Duration.ofSeconds(5));
            fail("Expected TransportException");
        } catch (TransportException e) {
            assertTrue(e.getMessage().contains("not valid UTF-8"));
            assertEquals(endpoint + "/latin1", e.getEndpoint());
        }
    }

    @Test
    public void testParseBindingsSkipsUnboundVariables() {
        String json = "{\"results\":{\"bindings\":[{\"item\":{\"type\":\"uri\",\"value\":\"https://example.org/a\"}},{}]}}";
        List<Map<String, String>> rows = HttpSparqlTransport.parseBindings(JsonParser.parseString(json));
        assertEquals(2, rows.size());
        assertTrue(rows.get(1).isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testParseBindingsRejectsMissingResults() {
        HttpSparqlTransport.parseBindings(JsonParser.parseString("{\"boolean\":true}"));
    }
}
