package journal.spring.boot;

import journal.admin.JournalOutputs;
import journal.dispatch.Router;
import journal.jdbc.DataSourceConnectionProvider;
import journal.jdbc.TableNames;
import journal.jdbc.store.AbstractJdbcListenerStore;
import journal.jdbc.store.JdbcListenerStores;
import journal.jdbc.tx.JdbcTransactionManager;
import journal.registry.DefaultListenerRegistry;
import journal.registry.ListenerRegistry;
import journal.spi.ConnectionProvider;
import journal.spi.DestinationResolver;
import journal.spi.ListenerStore;
import journal.spi.RouterMetrics;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the journal router.
 *
 * <p>Wires a {@link Router} and a JDBC-backed {@link JournalOutputs} from a
 * {@link DataSource} and {@link JournalProperties}. Persisted outputs are restored and the
 * router is started by {@link JournalOutputRegistrar} once all singletons exist.
 *
 * @see JournalProperties
 * @see JournalMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Router.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JournalProperties.class)
public class JournalAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ListenerStore.class)
  public AbstractJdbcListenerStore listenerStore(DataSource dataSource, JournalProperties props) {
    AbstractJdbcListenerStore detected = JdbcListenerStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcTransactionManager journalTransactionManager(ConnectionProvider connectionProvider) {
    return new JdbcTransactionManager(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(ListenerRegistry.class)
  public DefaultListenerRegistry listenerRegistry() {
    return new DefaultListenerRegistry();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Router router(JournalProperties props,
      ListenerRegistry listenerRegistry,
      ObjectProvider<RouterMetrics> metricsProvider) {
    Router.Builder builder = Router.builder()
        .registry(listenerRegistry)
        .historyCapacity(props.getHistoryCapacity())
        .queueCapacity(props.getQueueCapacity())
        .deliveryMode(props.getDeliveryMode())
        .deliveryWorkerCount(props.getDeliveryWorkerCount())
        .drainTimeoutMs(props.getDrainTimeoutMs());
    RouterMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DestinationResolver destinationResolver(ListableBeanFactory beanFactory) {
    return new BeanDestinationResolver(beanFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public JournalOutputs journalOutputs(Router router, ListenerStore listenerStore,
      DestinationResolver destinationResolver) {
    return new JournalOutputs(router, listenerStore, destinationResolver);
  }

  @Bean
  @ConditionalOnMissingBean
  public JournalOutputRegistrar journalOutputRegistrar(ListableBeanFactory beanFactory,
      Router router, JournalOutputs journalOutputs, ConnectionProvider connectionProvider,
      JournalProperties props) {
    return new JournalOutputRegistrar(beanFactory, router, journalOutputs, connectionProvider,
        props.isRestoreOnStartup());
  }
}
