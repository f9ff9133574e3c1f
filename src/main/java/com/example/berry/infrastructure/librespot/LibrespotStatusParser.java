package com.example.berry.infrastructure.librespot;

import com.example.berry.domain.model.StatusReport;
import com.example.berry.domain.model.TrackInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the player's {@code /status} body onto a {@link StatusReport}. Anything unusable
 * degrades to "no playback" instead of failing the poll.
 */
public class LibrespotStatusParser {

    private static final Logger log = LoggerFactory.getLogger(LibrespotStatusParser.class);

    private final ObjectMapper objectMapper;

    public LibrespotStatusParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StatusReport parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            return StatusReport.noPlayback();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Malformed status payload, treating as no playback: {}", e.getOriginalMessage());
            return StatusReport.noPlayback();
        }
        if (root == null || !root.isObject()) {
            return StatusReport.noPlayback();
        }
        JsonNode volumeNode = root.get("volume");
        return StatusReport.builder()
                .stopped(root.path("stopped").asBoolean(true))
                .paused(root.path("paused").asBoolean(false))
                .volume(volumeNode != null && volumeNode.isNumber() ? volumeNode.asInt() : null)
                .contextUri(textOrNull(root, "context_uri"))
                .track(parseTrack(root.get("track")))
                .build();
    }

    private TrackInfo parseTrack(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        List<String> artists = new ArrayList<>();
        JsonNode artistNames = node.get("artist_names");
        if (artistNames != null && artistNames.isArray()) {
            for (JsonNode artist : artistNames) {
                if (artist.isTextual() && !artist.asText().isEmpty()) {
                    artists.add(artist.asText());
                }
            }
        }
        return TrackInfo.builder()
                .uri(textOrNull(node, "uri"))
                .name(textOrNull(node, "name"))
                .artistNames(artists)
                .albumName(textOrNull(node, "album_name"))
                .albumCoverUrl(textOrNull(node, "album_cover_url"))
                .positionMs(Math.max(0L, node.path("position").asLong(0L)))
                .durationMs(Math.max(0L, node.path("duration").asLong(0L)))
                .build();
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
