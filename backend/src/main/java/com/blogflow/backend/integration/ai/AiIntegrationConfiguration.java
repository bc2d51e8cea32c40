package com.blogflow.backend.integration.ai;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AiIntegrationProperties.class)
@ConditionalOnProperty(prefix = "app.integrations.ai", name = "enabled", havingValue = "true")
public class AiIntegrationConfiguration {

  @Bean
  public ChatClient pipelineChatClient(ChatModel chatModel) {
    return ChatClient.builder(chatModel).defaultAdvisors(new SimpleLoggerAdvisor()).build();
  }

  @Bean
  public BeanOutputConverter<AnalysisReply> analysisReplyOutputConverter() {
    return new BeanOutputConverter<>(AnalysisReply.class);
  }

  @Bean
  public BeanOutputConverter<DraftReply> draftReplyOutputConverter() {
    return new BeanOutputConverter<>(DraftReply.class);
  }

  @Bean
  public ChatClientContentAnalyzer chatClientContentAnalyzer(
      ChatClient pipelineChatClient,
      BeanOutputConverter<AnalysisReply> analysisReplyOutputConverter,
      AiIntegrationProperties properties) {
    return new ChatClientContentAnalyzer(
        pipelineChatClient, analysisReplyOutputConverter, properties);
  }

  @Bean
  public ChatClientDraftGenerator chatClientDraftGenerator(
      ChatClient pipelineChatClient,
      BeanOutputConverter<DraftReply> draftReplyOutputConverter,
      AiIntegrationProperties properties) {
    return new ChatClientDraftGenerator(pipelineChatClient, draftReplyOutputConverter, properties);
  }
}
