package com.flamingo.ai.distillate.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/** WebClients for the page fetcher and the speech-synthesis service. */
@Configuration
public class HttpClientConfig {

  private static final int CONNECT_TIMEOUT_MS = 10_000;

  @Bean
  @Qualifier("fetchWebClient")
  public WebClient fetchWebClient(PipelineConfig pipelineConfig) {
    PipelineConfig.Fetch fetch = pipelineConfig.getFetch();
    HttpClient httpClient =
        HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .responseTimeout(fetch.getTimeout());
    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .defaultHeader(HttpHeaders.USER_AGENT, fetch.getUserAgent())
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(fetch.getMaxInMemoryBytes()))
        .build();
  }

  @Bean
  @Qualifier("speechWebClient")
  public WebClient speechWebClient(PipelineConfig pipelineConfig) {
    PipelineConfig.Speech speech = pipelineConfig.getSpeech();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .responseTimeout(speech.getTimeout());
    return WebClient.builder()
        .baseUrl(speech.getBaseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
        .build();
  }
}
