package journal.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import journal.micrometer.MicrometerRouterMetrics;
import journal.spi.RouterMetrics;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerRouterMetrics} when Micrometer is on the classpath
 * and {@code journal.metrics.enabled} is true (default). Runs before
 * {@link JournalAutoConfiguration} so the router picks it up.
 */
@AutoConfiguration(before = JournalAutoConfiguration.class)
@ConditionalOnClass({MicrometerRouterMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "journal.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JournalProperties.class)
public class JournalMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(RouterMetrics.class)
  public MicrometerRouterMetrics micrometerRouterMetrics(
      MeterRegistry meterRegistry, JournalProperties props) {
    return new MicrometerRouterMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
