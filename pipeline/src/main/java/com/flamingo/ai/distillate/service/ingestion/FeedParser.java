package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.exception.SourceCollectionException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Parses RSS 2.0, RSS 1.0 (RDF) and Atom documents into {@link FeedEntry} values.
 *
 * <p>Elements are matched by local name, so namespaced variants ({@code dc:date}, Atom's default
 * namespace) are handled alike. Entries are returned in document order.
 */
@Component
@Slf4j
public class FeedParser {

  private static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

  private static final List<String> DATE_ELEMENTS = List.of("pubDate", "published", "updated", "date");

  private static final List<Function<String, LocalDateTime>> DATE_FORMATS =
      List.of(
          text ->
              ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME)
                  .withZoneSameInstant(ZoneOffset.UTC)
                  .toLocalDateTime(),
          text -> OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(),
          LocalDateTime::parse,
          text -> LocalDate.parse(text).atStartOfDay());

  /**
   * Parses a feed document.
   *
   * @param sourceName registry name, used in errors
   * @param xml the feed document
   * @param limit maximum number of entries to return
   * @throws SourceCollectionException if the document is not well-formed XML
   */
  public List<FeedEntry> parse(String sourceName, String xml, int limit) {
    Document document;
    try {
      document =
          newDocumentBuilder().parse(new ByteArrayInputStream(xml.strip().getBytes(StandardCharsets.UTF_8)));
    } catch (Exception e) {
      throw new SourceCollectionException(
          sourceName, "Feed of '" + sourceName + "' is not parseable: " + e.getMessage(), e);
    }

    NodeList nodes = document.getElementsByTagNameNS("*", "*");
    List<FeedEntry> entries = new ArrayList<>();
    for (int i = 0; i < nodes.getLength() && entries.size() < limit; i++) {
      Element element = (Element) nodes.item(i);
      String name = localName(element);
      if ("item".equals(name) || "entry".equals(name)) {
        entries.add(toEntry(element));
      }
    }
    log.debug("Parsed {} entries from feed of '{}'", entries.size(), sourceName);
    return entries;
  }

  private FeedEntry toEntry(Element element) {
    String id = firstNonBlank(childText(element, "guid"), childText(element, "id"));
    if (id == null) {
      String about = element.getAttributeNS(RDF_NS, "about");
      id = about.isBlank() ? null : about.strip();
    }
    String summary =
        firstNonBlank(
            childText(element, "description"),
            childText(element, "summary"),
            childText(element, "content"));
    return new FeedEntry(
        id,
        childText(element, "title"),
        link(element),
        summary,
        publishedAt(element),
        audioEnclosure(element));
  }

  private String link(Element element) {
    for (Element link : children(element, "link")) {
      if (link.hasAttribute("href")) {
        String rel = link.getAttribute("rel");
        if (rel.isBlank() || "alternate".equals(rel)) {
          return link.getAttribute("href").strip();
        }
      } else if (!link.getTextContent().isBlank()) {
        return link.getTextContent().strip();
      }
    }
    return null;
  }

  private String audioEnclosure(Element element) {
    for (Element enclosure : children(element, "enclosure")) {
      if (isAudio(enclosure.getAttribute("type")) && !enclosure.getAttribute("url").isBlank()) {
        return enclosure.getAttribute("url").strip();
      }
    }
    for (Element link : children(element, "link")) {
      if ("enclosure".equals(link.getAttribute("rel"))
          && isAudio(link.getAttribute("type"))
          && !link.getAttribute("href").isBlank()) {
        return link.getAttribute("href").strip();
      }
    }
    return null;
  }

  private LocalDateTime publishedAt(Element element) {
    for (String name : DATE_ELEMENTS) {
      String value = childText(element, name);
      if (value != null) {
        LocalDateTime parsed = parseDate(value);
        if (parsed != null) {
          return parsed;
        }
      }
    }
    return null;
  }

  /** Parses RFC 1123 and ISO-8601 timestamps into UTC; null when no format matches. */
  static LocalDateTime parseDate(String value) {
    String text = value.strip();
    for (Function<String, LocalDateTime> format : DATE_FORMATS) {
      LocalDateTime parsed = tryParse(format, text);
      if (parsed != null) {
        return parsed;
      }
    }
    log.debug("Unrecognized feed date '{}'", text);
    return null;
  }

  private static LocalDateTime tryParse(Function<String, LocalDateTime> format, String text) {
    try {
      return format.apply(text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static boolean isAudio(String type) {
    return type != null && type.toLowerCase(Locale.ROOT).contains("audio");
  }

  private static String childText(Element parent, String name) {
    for (Element child : children(parent, name)) {
      String text = child.getTextContent();
      if (text != null && !text.isBlank()) {
        return text.strip();
      }
    }
    return null;
  }

  private static List<Element> children(Element parent, String name) {
    List<Element> matches = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
        matches.add((Element) node);
      }
    }
    return matches;
  }

  private static String localName(Node node) {
    return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private static DocumentBuilder newDocumentBuilder() throws Exception {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setExpandEntityReferences(false);
    return factory.newDocumentBuilder();
  }
}
