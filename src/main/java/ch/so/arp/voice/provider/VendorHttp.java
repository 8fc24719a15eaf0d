package ch.so.arp.voice.provider;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request plumbing shared by the vendor adapters.
 */
final class VendorHttp {

    private static final Logger LOGGER = LoggerFactory.getLogger(VendorHttp.class);

    static final int MAX_ERROR_BODY = 300;

    private VendorHttp() {
    }

    /**
     * Sends the request and returns the streaming body of a 2xx response.
     * Closes the body and throws for any other status. Cancelling the token
     * while the vendor has not answered yet abandons the request.
     */
    static InputStream openStream(HttpClient httpClient, HttpRequest request, String provider,
            CancellationToken token) {
        CompletableFuture<HttpResponse<InputStream>> pending = httpClient.sendAsync(request,
                HttpResponse.BodyHandlers.ofInputStream());
        token.onCancel(() -> pending.cancel(true));
        HttpResponse<InputStream> response;
        try {
            response = pending.get();
        } catch (CancellationException ex) {
            throw new ProviderException(provider, "request to " + request.uri().getPath()
                    + " abandoned (" + token.reason() + ")", ex);
        } catch (ExecutionException ex) {
            throw new ProviderException(provider, "network error calling " + request.uri().getPath(),
                    ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new ProviderException(provider, "interrupted while calling " + request.uri().getPath(), ex);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = readTruncated(response.body());
            LOGGER.error("{} returned HTTP {}: {}", provider, status, body);
            throw new ProviderException(provider, "HTTP " + status + ": " + body, status, null);
        }
        return response.body();
    }

    static String send(HttpClient httpClient, HttpRequest request, String provider) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ProviderException(provider, "network error calling " + request.uri().getPath(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException(provider, "interrupted while calling " + request.uri().getPath(), ex);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = truncate(response.body());
            LOGGER.error("{} returned HTTP {}: {}", provider, status, body);
            throw new ProviderException(provider, "HTTP " + status + ": " + body, status, null);
        }
        return response.body();
    }

    static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException ex) {
            LOGGER.debug("Closing vendor stream failed: {}", ex.getMessage());
        }
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > MAX_ERROR_BODY ? value.substring(0, MAX_ERROR_BODY) + "..." : value;
    }

    private static String readTruncated(InputStream body) {
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY + 1);
            return truncate(new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            return "<unreadable body: " + ex.getMessage() + ">";
        }
    }
}
