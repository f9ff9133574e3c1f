package com.example.berry.infrastructure.librespot;

import com.example.berry.common.config.AppLibrespotProperties;
import com.example.berry.domain.model.StatusReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.PreDestroy;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * REST client for go-librespot. Every call carries its own timeout so a hung player never
 * stalls the poll loop or a user action.
 */
@Component
public class HttpLibrespotClient implements LibrespotClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLibrespotClient.class);

    private final AppLibrespotProperties properties;
    private final ObjectMapper objectMapper;
    private final LibrespotStatusParser statusParser;
    private final CloseableHttpClient httpClient;

    public HttpLibrespotClient(AppLibrespotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.statusParser = new LibrespotStatusParser(objectMapper);
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(8);
        connectionManager.setDefaultMaxPerRoute(8);
        this.httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public StatusReport status() {
        HttpGet get = new HttpGet(url("/status"));
        get.setConfig(requestConfig(properties.getStatusTimeoutMs()));
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int code = response.getStatusLine().getStatusCode();
            if (code == HttpStatus.SC_NO_CONTENT || response.getEntity() == null) {
                EntityUtils.consumeQuietly(response.getEntity());
                return StatusReport.noPlayback();
            }
            String body = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (code != HttpStatus.SC_OK) {
                log.debug("Status request returned code={}, treating as no playback", code);
                return StatusReport.noPlayback();
            }
            return statusParser.parse(body);
        } catch (IOException e) {
            log.debug("Status request failed: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isConnected() {
        HttpGet get = new HttpGet(url("/status"));
        get.setConfig(requestConfig(properties.getProbeTimeoutMs()));
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int code = response.getStatusLine().getStatusCode();
            EntityUtils.consumeQuietly(response.getEntity());
            return code == HttpStatus.SC_OK || code == HttpStatus.SC_NO_CONTENT;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public boolean play(String contextUri, String skipToTrackUri) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("uri", contextUri);
        if (skipToTrackUri != null) {
            body.put("skip_to_uri", skipToTrackUri);
            log.info("Resuming at track: {}", skipToTrackUri);
        }
        boolean ok = post("/player/play", body, properties.getPlayTimeoutMs());
        if (ok) {
            log.info("Play request sent, contextUri={}", contextUri);
        }
        return ok;
    }

    @Override
    public boolean pause() {
        return post("/player/pause", null, properties.getCommandTimeoutMs());
    }

    @Override
    public boolean resume() {
        return post("/player/resume", null, properties.getCommandTimeoutMs());
    }

    @Override
    public boolean next() {
        return post("/player/next", null, properties.getCommandTimeoutMs());
    }

    @Override
    public boolean prev() {
        return post("/player/prev", null, properties.getCommandTimeoutMs());
    }

    @Override
    public boolean seek(long positionMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("position", positionMs);
        return post("/player/seek", body, properties.getCommandTimeoutMs());
    }

    @Override
    public boolean setVolume(int level) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("volume", Math.max(0, Math.min(100, level)));
        return post("/player/volume", body, properties.getCommandTimeoutMs());
    }

    @PreDestroy
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.debug("Closing librespot http client failed", e);
        }
    }

    private boolean post(String path, Map<String, Object> body, int timeoutMs) {
        HttpPost post = new HttpPost(url(path));
        post.setConfig(requestConfig(timeoutMs));
        try {
            if (body != null) {
                post.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
            }
        } catch (JsonProcessingException e) {
            log.error("Cannot encode player command, path={}", path, e);
            return false;
        }
        try (CloseableHttpResponse response = httpClient.execute(post)) {
            int code = response.getStatusLine().getStatusCode();
            String responseBody = response.getEntity() == null
                    ? ""
                    : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            boolean ok = code >= 200 && code < 300;
            if (ok) {
                log.debug("Player command path={} code={}", path, code);
            } else {
                log.warn("Player command failed, path={} code={} body={}", path, code, responseBody);
            }
            return ok;
        } catch (IOException e) {
            log.error("Player command error, path={}: {}", path, e.getMessage());
            return false;
        }
    }

    private RequestConfig requestConfig(int timeoutMs) {
        return RequestConfig.custom()
                .setConnectTimeout(Math.min(properties.getConnectTimeoutMs(), timeoutMs))
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .build();
    }

    private String url(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
