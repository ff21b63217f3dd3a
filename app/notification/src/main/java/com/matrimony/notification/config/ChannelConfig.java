/*
 * どこで: Notification チャネル設定
 * 何を: 設定の provider 一覧からチャネルアダプタを組み立てる
 * なぜ: provider の順序 (fallback 順) と種類を設定だけで決められるようにするため
 */
package com.matrimony.notification.config;

import com.matrimony.notification.channel.ChannelAdapter;
import com.matrimony.notification.channel.ChannelAdapterRegistry;
import com.matrimony.notification.channel.DeliveryProvider;
import com.matrimony.notification.channel.FailureInjectingDeliveryProvider;
import com.matrimony.notification.channel.FallbackChannelAdapter;
import com.matrimony.notification.channel.FieldCipher;
import com.matrimony.notification.channel.HttpDeliveryProvider;
import com.matrimony.notification.channel.LoggingDeliveryProvider;
import com.matrimony.notification.channel.PassthroughFieldCipher;
import com.matrimony.notification.channel.PushChannelAdapter;
import com.matrimony.notification.channel.RecipientContactResolver;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.repository.ChannelSubscriptionRepository;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ChannelConfig {

  private static final Logger logger = LoggerFactory.getLogger(ChannelConfig.class);

  // 暗号化サービスが別途 Bean 登録されていればそちらを使う
  @Bean
  @ConditionalOnMissingBean(FieldCipher.class)
  FieldCipher fieldCipher() {
    return new PassthroughFieldCipher();
  }

  @Bean
  ChannelAdapterRegistry channelAdapterRegistry(
      NotificationChannelProperties channelProperties,
      NotificationDeliveryProperties deliveryProperties,
      RecipientContactResolver contactResolver,
      ChannelSubscriptionRepository subscriptionRepository,
      RestClient.Builder restClientBuilder,
      Environment environment,
      Clock clock) {
    final ProviderFactory factory =
        new ProviderFactory(restClientBuilder, failureInjectionPrefix(deliveryProperties, environment));
    final List<ChannelAdapter> adapters =
        List.of(
            new FallbackChannelAdapter(
                NotificationChannel.EMAIL,
                factory.build(NotificationChannel.EMAIL, channelProperties.email()),
                contactResolver),
            new FallbackChannelAdapter(
                NotificationChannel.SMS,
                factory.build(NotificationChannel.SMS, channelProperties.sms()),
                contactResolver),
            new PushChannelAdapter(
                factory.build(NotificationChannel.PUSH, channelProperties.push()),
                subscriptionRepository,
                clock));
    return new ChannelAdapterRegistry(adapters);
  }

  private String failureInjectionPrefix(
      NotificationDeliveryProperties properties, Environment environment) {
    if (!properties.failureInjection().enabled()) {
      return null;
    }
    if (!environment.acceptsProfiles(Profiles.of("ci", "test"))) {
      logger.warn("delivery failure injection ignored outside ci/test profiles");
      return null;
    }
    return properties.failureInjection().recipientIdPrefix();
  }

  static final class ProviderFactory {

    private final RestClient.Builder restClientBuilder;
    private final String failureInjectionPrefix;

    ProviderFactory(RestClient.Builder restClientBuilder, String failureInjectionPrefix) {
      this.restClientBuilder = restClientBuilder;
      this.failureInjectionPrefix = failureInjectionPrefix;
    }

    List<DeliveryProvider> build(
        NotificationChannel channel, NotificationChannelProperties.Channel config) {
      final List<DeliveryProvider> providers =
          config.providers().stream().map(this::create).toList();
      logger.info(
          "channel providers configured channel={} providers={}",
          channel.value(),
          providers.stream().map(DeliveryProvider::name).toList());
      return providers;
    }

    private DeliveryProvider create(NotificationChannelProperties.Provider provider) {
      final DeliveryProvider created =
          switch (provider.type()) {
            case LOG -> new LoggingDeliveryProvider(provider.name());
            case HTTP -> httpProvider(provider);
          };
      return failureInjectionPrefix == null
          ? created
          : new FailureInjectingDeliveryProvider(created, failureInjectionPrefix);
    }

    private DeliveryProvider httpProvider(NotificationChannelProperties.Provider provider) {
      if (provider.baseUrl() == null || provider.baseUrl().isBlank()) {
        throw new IllegalStateException("base-url is required for provider " + provider.name());
      }
      // provider ごとに接続/読み取りタイムアウトを分ける
      final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(provider.timeout());
      requestFactory.setReadTimeout(provider.timeout());
      final RestClient restClient =
          restClientBuilder
              .clone()
              .baseUrl(provider.baseUrl())
              .requestFactory(requestFactory)
              .build();
      return new HttpDeliveryProvider(
          provider.name(), restClient, provider.path(), provider.apiKeyHeader(), provider.apiKey());
    }
  }
}
