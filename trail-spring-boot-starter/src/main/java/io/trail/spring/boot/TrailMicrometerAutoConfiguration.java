package io.trail.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.trail.micrometer.MicrometerMetricsExporter;
import io.trail.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code trail.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TrailAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the {@link io.trail.Trail}.
 */
@AutoConfiguration(before = TrailAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "trail.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TrailProperties.class)
public class TrailMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, TrailProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
