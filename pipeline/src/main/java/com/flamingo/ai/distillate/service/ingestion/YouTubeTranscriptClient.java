package com.flamingo.ai.distillate.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.distillate.exception.FetchException;
import com.flamingo.ai.distillate.exception.TranscriptUnavailableException;
import com.flamingo.ai.distillate.service.fetch.Fetcher;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * {@link TranscriptClient} reading the caption tracks advertised on a YouTube watch page.
 *
 * <p>English tracks are preferred, manually created before auto-generated; otherwise the first
 * listed track is used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YouTubeTranscriptClient implements TranscriptClient {

  private static final String CAPTION_TRACKS_KEY = "\"captionTracks\":";
  private static final String PREFERRED_LANGUAGE = "en";

  private final Fetcher fetcher;
  private final ObjectMapper objectMapper;

  @Override
  public List<String> fetchSegments(String videoId, String watchPage) {
    try {
      String trackUrl = selectTrackUrl(videoId, watchPage);
      List<String> segments = parseTimedText(videoId, fetcher.fetch(trackUrl));
      log.debug("Transcript of video {}: {} segments", videoId, segments.size());
      return segments;
    } catch (FetchException e) {
      throw new TranscriptUnavailableException(
          videoId, "Transcript of video " + videoId + " could not be fetched: " + e.getMessage(), e);
    }
  }

  String selectTrackUrl(String videoId, String watchPage) {
    String tracksJson = extractJsonArray(watchPage, CAPTION_TRACKS_KEY);
    if (tracksJson == null) {
      throw new TranscriptUnavailableException(videoId, "Video " + videoId + " has no captions");
    }
    JsonNode tracks;
    try {
      tracks = objectMapper.readTree(tracksJson);
    } catch (JsonProcessingException e) {
      throw new TranscriptUnavailableException(
          videoId, "Caption tracks of video " + videoId + " are malformed", e);
    }

    JsonNode chosen = null;
    int chosenRank = Integer.MAX_VALUE;
    for (JsonNode track : tracks) {
      if (!track.hasNonNull("baseUrl")) {
        continue;
      }
      int rank = rank(track);
      if (rank < chosenRank) {
        chosen = track;
        chosenRank = rank;
      }
    }
    if (chosen == null) {
      throw new TranscriptUnavailableException(videoId, "Video " + videoId + " has no caption track");
    }
    return chosen.get("baseUrl").asText();
  }

  private static int rank(JsonNode track) {
    boolean english = track.path("languageCode").asText().startsWith(PREFERRED_LANGUAGE);
    boolean generated = "asr".equals(track.path("kind").asText());
    if (english) {
      return generated ? 1 : 0;
    }
    return 2;
  }

  /** Segment texts of a timed-text document, unescaped, blank segments dropped. */
  List<String> parseTimedText(String videoId, String xml) {
    Document document;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      document =
          factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    } catch (Exception e) {
      throw new TranscriptUnavailableException(
          videoId, "Transcript of video " + videoId + " is malformed", e);
    }

    List<String> segments = new ArrayList<>();
    collectSegments(document.getElementsByTagName("text"), segments);
    if (segments.isEmpty()) {
      // srv3 format
      collectSegments(document.getElementsByTagName("p"), segments);
    }
    return segments;
  }

  private static void collectSegments(NodeList nodes, List<String> segments) {
    for (int i = 0; i < nodes.getLength(); i++) {
      String text = HtmlUtils.htmlUnescape(((Element) nodes.item(i)).getTextContent());
      text = text.replaceAll("\\s+", " ").strip();
      if (!text.isEmpty()) {
        segments.add(text);
      }
    }
  }

  /** Returns the JSON array following {@code key}, honouring brackets inside string literals. */
  static String extractJsonArray(String page, String key) {
    int keyIndex = page.indexOf(key);
    if (keyIndex < 0) {
      return null;
    }
    int start = page.indexOf('[', keyIndex + key.length());
    if (start < 0) {
      return null;
    }
    int depth = 0;
    boolean inString = false;
    for (int i = start; i < page.length(); i++) {
      char c = page.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
      } else if (c == '"') {
        inString = true;
      } else if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
        if (depth == 0) {
          return page.substring(start, i + 1);
        }
      }
    }
    return null;
  }
}
