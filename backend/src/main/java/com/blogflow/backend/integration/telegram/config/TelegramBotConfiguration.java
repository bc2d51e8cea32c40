package com.blogflow.backend.integration.telegram.config;

import com.blogflow.backend.integration.telegram.bot.TelegramBotLifecycle;
import com.blogflow.backend.integration.telegram.bot.TelegramMessageSender;
import com.blogflow.backend.integration.telegram.bot.TelegramWebhookRegistrar;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TelegramBotProperties.class)
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramBotConfiguration {

  @Bean
  public TelegramMessageSender telegramMessageSender(TelegramBotProperties properties) {
    return new TelegramMessageSender(properties.getBot().getToken());
  }

  @Bean
  public TelegramWebhookRegistrar telegramWebhookRegistrar(TelegramBotProperties properties) {
    return new TelegramWebhookRegistrar(properties);
  }

  @Bean
  public TelegramBotLifecycle telegramBotLifecycle(
      TelegramBotProperties properties, TelegramWebhookRegistrar webhookRegistrar) {
    return new TelegramBotLifecycle(properties, webhookRegistrar);
  }
}
