package relay.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import relay.TelemetryPipeline;
import relay.jdbc.ConnectionProvider;
import relay.jdbc.JdbcSink;
import relay.lifecycle.Lifecycle;
import relay.spi.MetricsExporter;
import relay.spi.Sink;

import javax.sql.DataSource;

/**
 * Auto-configuration for the telemetry relay.
 *
 * <p>Wires a started {@link TelemetryPipeline} from {@link RelayProperties}. When a
 * {@link DataSource} is present and no other {@link Sink} is defined, batches go to a
 * {@link JdbcSink}. Without any sink the pipeline is created inactive. The final flush is
 * tied to the context shutdown through {@link ContextClosedLifecycle}.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TelemetryPipeline.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Lifecycle.class)
  public ContextClosedLifecycle relayLifecycle() {
    return new ContextClosedLifecycle();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TelemetryPipeline telemetryPipeline(RelayProperties props,
      ObjectProvider<Sink> sinkProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      Lifecycle lifecycle) {
    TelemetryPipeline.Builder builder = TelemetryPipeline.builder()
        .config(props.toRelayConfig())
        .sink(sinkProvider.getIfAvailable())
        .lifecycle(lifecycle);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metricsExporter(metrics);
    }
    TelemetryPipeline pipeline = builder.build();
    pipeline.start();
    return pipeline;
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcSink.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcSinkConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public ConnectionProvider relayConnectionProvider(DataSource dataSource) {
      return ConnectionProvider.of(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(Sink.class)
    public JdbcSink jdbcSink(ConnectionProvider connectionProvider,
        ObjectProvider<ObjectMapper> objectMapperProvider) {
      return new JdbcSink(connectionProvider, objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }
  }
}
