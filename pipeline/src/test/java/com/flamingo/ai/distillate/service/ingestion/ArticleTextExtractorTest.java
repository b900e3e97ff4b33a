package com.flamingo.ai.distillate.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ArticleTextExtractorTest {

  private final ArticleTextExtractor extractor = new ArticleTextExtractor();

  @Test
  @DisplayName("should keep article text and drop scripts, styles and page chrome")
  void shouldRemoveBoilerplate() {
    String html =
        """
        <html>
          <head><title>Page title</title><style>body { color: red; }</style></head>
          <body>
            <header>Site header</header>
            <nav><a href="/">Home</a> <a href="/ai">AI</a></nav>
            <article>
              <h1>Model released</h1>
              <p>The new model   beats the old one.</p>
              <script>var tracking = "secret";</script>
            </article>
            <footer>Copyright notice</footer>
          </body>
        </html>
        """;

    String text = extractor.extract(html);

    assertThat(text).contains("Model released").contains("The new model beats the old one.");
    assertThat(text)
        .doesNotContain("tracking")
        .doesNotContain("color: red")
        .doesNotContain("Site header")
        .doesNotContain("Home")
        .doesNotContain("Copyright notice");
  }

  @Test
  @DisplayName("should drop HTML5 chrome elements that appear outside an article")
  void shouldDropHtml5Chrome_whenNotNested() {
    String html =
        "<nav>Home</nav><header>Site header</header><aside>Related links</aside><p>Body</p>";

    assertThat(extractor.extract(html)).isEqualTo("Body");
  }

  @Test
  @DisplayName("should return empty text for an empty body")
  void shouldReturnEmpty_whenBodyEmpty() {
    assertThat(extractor.extract("<html><body></body></html>")).isEmpty();
  }
}
