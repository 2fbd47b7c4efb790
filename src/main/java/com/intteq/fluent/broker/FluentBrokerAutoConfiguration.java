package com.intteq.fluent.broker;

import com.intteq.fluent.broker.consumer.ConsumersOptions;
import com.intteq.fluent.broker.core.ChannelResolver;
import com.intteq.fluent.broker.core.ProducerRegistry;
import com.intteq.fluent.broker.producer.ProducersConfiguration;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the fluent message broker.
 *
 * <p>Every {@link FluentBrokerCustomizer} bean is applied, in order, to a single
 * {@link FluentBrokerBuilder} seeded from {@link FluentBrokerProperties}; the resulting
 * {@link BrokerConfiguration} and its parts are exposed as beans. Enabled by default and can be
 * disabled by setting:
 *
 * <pre>
 *   fluent.broker.enabled = false
 * </pre>
 *
 * <p>When a {@link MeterRegistry} is present, route counts are published as {@code fmb.routes}
 * gauges.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(FluentBrokerProperties.class)
@ConditionalOnProperty(prefix = "fluent.broker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FluentBrokerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConfiguration brokerConfiguration(FluentBrokerProperties properties,
                                                   ObjectProvider<FluentBrokerCustomizer> customizers,
                                                   ObjectProvider<MeterRegistry> meterRegistry) {
        FluentBrokerBuilder builder = new FluentBrokerBuilder()
                .setDuplicateRoutePolicy(properties.getDuplicateRoutePolicy())
                .setDefaultRetryPolicy(properties.getRetry().toRetryPolicy());

        customizers.orderedStream().forEach(customizer -> customizer.customize(builder));

        BrokerConfiguration configuration = builder.build();
        meterRegistry.ifAvailable(registry -> registerGauges(registry, configuration));
        return configuration;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ChannelResolver channelResolver(BrokerConfiguration configuration) {
        return configuration.channelResolver();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ProducerRegistry producerRegistry(BrokerConfiguration configuration) {
        return configuration.producerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumersOptions consumersOptions(BrokerConfiguration configuration) {
        return configuration.getConsumers();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProducersConfiguration producersConfiguration(BrokerConfiguration configuration) {
        return configuration.getProducers();
    }

    private void registerGauges(MeterRegistry registry, BrokerConfiguration configuration) {
        Gauge.builder("fmb.routes", configuration, c -> c.channelResolver().identities().size())
                .tag("kind", "subscription")
                .description("Subscriptions bound to a channel factory")
                .register(registry);
        Gauge.builder("fmb.routes", configuration, c -> c.producerRegistry().destinations().size())
                .tag("kind", "publication")
                .description("Destinations served by a producer")
                .register(registry);
        log.debug("Registered fmb.routes gauges");
    }
}
