package rsv.sync.transport;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * {@link SparqlTransport} over HTTP GET ({@code endpoint?query=...}).
 * Any status other than 200 and any timeout raise {@link TransportException}; nothing is retried.
 */
public class HttpSparqlTransport implements SparqlTransport {

    private static final Logger logger = Logger.getLogger(HttpSparqlTransport.class.getName());

    static final String SPARQL_RESULTS_JSON = "application/sparql-results+json";
    private static final int MAX_ERROR_BODY = 500;

    @Override
    public byte[] executeConstructQuery(String endpoint, String query, RdfSyntax syntax, Duration timeout) throws TransportException {
        HttpURLConnection conn = open(endpoint, query, syntax.getMediaType(), timeout);
        try (InputStream in = conn.getInputStream()) {
            byte[] payload = in.readAllBytes();
            logger.fine("Received " + payload.length + " bytes from " + endpoint);
            return payload;
        } catch (SocketTimeoutException e) {
            throw new TransportException(endpoint, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new TransportException(endpoint, "failed reading response: " + e.getMessage(), e);
        } finally {
            conn.disconnect();
        }
    }

    @Override
    public List<Map<String, String>> executeSelectQuery(String endpoint, String query, Duration timeout) throws TransportException {
        HttpURLConnection conn = open(endpoint, query, SPARQL_RESULTS_JSON, timeout);
        try (Reader reader = new InputStreamReader(conn.getInputStream(), strictUtf8())) {
            return parseBindings(JsonParser.parseReader(reader));
        } catch (SocketTimeoutException e) {
            throw new TransportException(endpoint, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (CharacterCodingException e) {
            throw new TransportException(endpoint, "response is not valid UTF-8", e);
        } catch (IOException e) {
            throw new TransportException(endpoint, "failed reading response: " + e.getMessage(), e);
        } catch (JsonParseException e) {
            if (ExceptionUtils.indexOfType(e, CharacterCodingException.class) >= 0) {
                throw new TransportException(endpoint, "response is not valid UTF-8", e);
            }
            throw new TransportException(endpoint, "invalid SPARQL JSON results: " + e.getMessage(), e);
        } catch (IllegalStateException | ClassCastException e) {
            throw new TransportException(endpoint, "invalid SPARQL JSON results: " + e.getMessage(), e);
        } finally {
            conn.disconnect();
        }
    }

    static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    static List<Map<String, String>> parseBindings(JsonElement json) {
        JsonObject results = json.getAsJsonObject().getAsJsonObject("results");
        JsonArray bindings = results == null ? null : results.getAsJsonArray("bindings");
        if (bindings == null) {
            throw new IllegalStateException("missing results.bindings");
        }
        List<Map<String, String>> rows = new ArrayList<>(bindings.size());
        for (JsonElement binding : bindings) {
            Map<String, String> row = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : binding.getAsJsonObject().entrySet()) {
                JsonElement value = entry.getValue().getAsJsonObject().get("value");
                if (value == null) {
                    throw new IllegalStateException("binding of ?" + entry.getKey() + " has no value");
                }
                row.put(entry.getKey(), value.getAsString());
            }
            rows.add(row);
        }
        return rows;
    }

    private HttpURLConnection open(String endpoint, String query, String accept, Duration timeout) throws TransportException {
        String separator = endpoint.contains("?") ? "&" : "?";
        String requestUrl = endpoint + separator + "query=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(requestUrl).openConnection();
            conn.setRequestMethod("GET");
            conn.setRequestProperty("Accept", accept);
            conn.setConnectTimeout((int) timeout.toMillis());
            conn.setReadTimeout((int) timeout.toMillis());
            int status = conn.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                String body = readErrorBody(conn);
                conn.disconnect();
                throw new TransportException(endpoint, status, "HTTP " + status + ": " + body, null);
            }
            return conn;
        } catch (SocketTimeoutException e) {
            disconnect(conn);
            throw new TransportException(endpoint, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException | IllegalArgumentException e) {
            disconnect(conn);
            throw new TransportException(endpoint, "request failed: " + e.getMessage(), e);
        }
    }

    private static String readErrorBody(HttpURLConnection conn) {
        try (InputStream err = conn.getErrorStream()) {
            if (err == null) {
                return "";
            }
            String body = new String(err.readAllBytes(), StandardCharsets.UTF_8);
            return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
        } catch (IOException e) {
            return "(error body unreadable: " + e.getMessage() + ")";
        }
    }

    private static void disconnect(HttpURLConnection conn) {
        if (conn != null) {
            conn.disconnect();
        }
    }
}
