package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.exception.ContentExtractionException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.BodyContentHandler;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Extracts readable article text from an HTML page.
 *
 * <p>The page is first cleaned with jsoup: scripts, styles and page chrome ({@code nav}, {@code
 * header}, {@code footer}, {@code aside}) are removed together with their content. Tika then
 * extracts the body text, and whitespace is collapsed to single spaces.
 */
@Component
@Slf4j
public class ArticleTextExtractor {

  static final String BOILERPLATE_SELECTOR = "script,style,noscript,nav,header,footer,aside";

  private final AutoDetectParser parser = new AutoDetectParser();

  /**
   * Returns the visible body text of the page.
   *
   * @throws ContentExtractionException if the page cannot be parsed
   */
  public String extract(String html) {
    Document page = Jsoup.parse(html);
    page.select(BOILERPLATE_SELECTOR).remove();
    String cleaned = page.outerHtml();

    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, "text/html; charset=UTF-8");
    try {
      parser.parse(
          new ByteArrayInputStream(cleaned.getBytes(StandardCharsets.UTF_8)), handler, metadata);
    } catch (Exception e) {
      throw new ContentExtractionException("Failed to extract page text: " + e.getMessage(), e);
    }

    String text = handler.toString().replaceAll("\\s+", " ").strip();
    log.debug("Extracted {} chars from {} chars of HTML", text.length(), html.length());
    return text;
  }
}
