package io.trail.spring.boot;

import io.trail.Trail;
import io.trail.jdbc.JdbcEntityStore;
import io.trail.jdbc.JdbcVersionStore;
import io.trail.jdbc.dialect.Dialects;
import io.trail.jdbc.spi.Dialect;
import io.trail.query.VersionQueries;
import io.trail.spi.EntityStore;
import io.trail.spi.MetricsExporter;
import io.trail.spi.TransactionRunner;
import io.trail.spi.VersionStore;
import io.trail.spring.SpringTransactionRunner;
import io.trail.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for change versioning.
 *
 * <p>Wires a {@link Trail} from the application's {@link DataSource} and
 * {@link TrailProperties}. Plans run in Spring-managed transactions, joining the caller's
 * transaction when there is one.
 *
 * @see TrailProperties
 * @see TrailMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(Trail.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TrailProperties.class)
public class TrailAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Dialect trailDialect(DataSource dataSource, TrailProperties props) {
    String name = props.getDialect();
    if (name != null && !name.isBlank()) {
      return Dialects.get(name);
    }
    return Dialects.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonCodec trailJsonCodec() {
    return JsonCodec.getDefault();
  }

  @Bean
  @ConditionalOnMissingBean(EntityStore.class)
  public JdbcEntityStore trailEntityStore(Dialect dialect, JsonCodec jsonCodec) {
    return new JdbcEntityStore(dialect, jsonCodec, Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean(VersionStore.class)
  public JdbcVersionStore trailVersionStore(Dialect dialect, JsonCodec jsonCodec, TrailProperties props) {
    return new JdbcVersionStore(dialect, props.getVersionsTable(), jsonCodec, Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean(TransactionRunner.class)
  public SpringTransactionRunner trailTransactionRunner(DataSource dataSource,
      ObjectProvider<PlatformTransactionManager> transactionManager) {
    return new SpringTransactionRunner(dataSource,
        transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource)));
  }

  @Bean
  @ConditionalOnMissingBean
  public Trail trail(TrailProperties props,
      EntityStore entityStore,
      VersionStore versionStore,
      TransactionRunner transactionRunner,
      JsonCodec jsonCodec,
      ObjectProvider<MetricsExporter> metricsProvider) {
    Trail.Builder builder = Trail.builder()
        .entityStore(entityStore)
        .versionStore(versionStore)
        .transactionRunner(transactionRunner)
        .mode(props.getMode())
        .jsonCodec(jsonCodec);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public VersionQueries versionQueries(Trail trail) {
    return trail.queries();
  }
}
