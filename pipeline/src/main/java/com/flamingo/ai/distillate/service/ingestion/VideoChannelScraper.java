package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.exception.FetchException;
import com.flamingo.ai.distillate.service.fetch.Fetcher;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/** Reads video ids from a channel listing page and metadata from watch pages. */
@Component
@RequiredArgsConstructor
public class VideoChannelScraper {

  static final String WATCH_URL = "https://www.youtube.com/watch?v=";

  private static final Pattern VIDEO_ID = Pattern.compile("\"videoId\":\"([^\"]+)\"");
  private static final Pattern PUBLISH_DATE = Pattern.compile("\"publishDate\":\"([^\"]+)\"");
  private static final Pattern META_TAG = Pattern.compile("<meta\\b[^>]*>", Pattern.CASE_INSENSITIVE);
  private static final Pattern ATTRIBUTE =
      Pattern.compile("([\\w:-]+)\\s*=\\s*\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);

  private final Fetcher fetcher;

  /**
   * Lists the newest video ids of a channel in page order.
   *
   * @throws FetchException if the listing page cannot be fetched
   */
  public List<String> listVideoIds(String channelUrl, int limit) {
    return extractVideoIds(fetcher.fetch(channelUrl), limit);
  }

  /** Distinct video ids in first-seen order, at most {@code limit}. */
  static List<String> extractVideoIds(String page, int limit) {
    Set<String> ids = new LinkedHashSet<>();
    Matcher matcher = VIDEO_ID.matcher(page);
    while (matcher.find() && ids.size() < limit) {
      ids.add(matcher.group(1));
    }
    return new ArrayList<>(ids);
  }

  /**
   * Downloads the watch page of a video. The page carries both the metadata and the caption tracks,
   * so callers fetch it once and hand it to {@link #metadataOf} and the {@link TranscriptClient}.
   *
   * @throws FetchException if the page cannot be fetched
   */
  public String fetchWatchPage(String videoId) {
    return fetcher.fetch(watchUrl(videoId));
  }

  /** Title and publication time read from a watch page, with fallbacks for missing tags. */
  public VideoMetadata metadataOf(String videoId, String watchPage) {
    return parseMetadata(videoId, watchUrl(videoId), watchPage);
  }

  static String watchUrl(String videoId) {
    return WATCH_URL + videoId;
  }

  static VideoMetadata parseMetadata(String videoId, String url, String page) {
    Map<String, String> meta = metaContent(page);
    String title = meta.get("title");
    if (title == null || title.isBlank()) {
      title = meta.get("og:title");
    }
    if (title == null || title.isBlank()) {
      title = fallbackTitle(videoId);
    }

    LocalDateTime publishedAt = null;
    Matcher matcher = PUBLISH_DATE.matcher(page);
    if (matcher.find()) {
      publishedAt = FeedParser.parseDate(matcher.group(1));
    }
    if (publishedAt == null && meta.containsKey("datepublished")) {
      publishedAt = FeedParser.parseDate(meta.get("datepublished"));
    }
    return new VideoMetadata(videoId, title.strip(), url, publishedAt);
  }

  /** Meta tag contents keyed by lower-cased {@code name}, {@code property} or {@code itemprop}. */
  private static Map<String, String> metaContent(String page) {
    Map<String, String> meta = new HashMap<>();
    Matcher tags = META_TAG.matcher(page);
    while (tags.find()) {
      Map<String, String> attributes = new HashMap<>();
      Matcher attribute = ATTRIBUTE.matcher(tags.group());
      while (attribute.find()) {
        attributes.put(attribute.group(1).toLowerCase(Locale.ROOT), attribute.group(2));
      }
      String content = attributes.get("content");
      if (content == null) {
        continue;
      }
      for (String key : List.of("name", "property", "itemprop")) {
        String name = attributes.get(key);
        if (name != null) {
          meta.putIfAbsent(name.toLowerCase(Locale.ROOT), HtmlUtils.htmlUnescape(content));
        }
      }
    }
    return meta;
  }

  private static String fallbackTitle(String videoId) {
    return "Video " + videoId;
  }
}
