package workqueue.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import workqueue.WorkQueue;
import workqueue.WorkQueueConfig;
import workqueue.jdbc.DataSourceConnectionProvider;
import workqueue.jdbc.store.AbstractJdbcQueueStore;
import workqueue.jdbc.store.JdbcQueueStores;
import workqueue.reclaim.OrphanReclaimScheduler;
import workqueue.spi.BackingStoreCheck;
import workqueue.spi.ConnectionProvider;
import workqueue.spi.MetricsExporter;

import javax.sql.DataSource;

/**
 * Auto-configuration for the work queue.
 *
 * <p>Wires a {@link WorkQueue} from a {@link DataSource} and {@link WorkQueueProperties}.
 * Any {@link BackingStoreCheck} beans are added to its health checks, and a
 * {@link MetricsExporter} bean is used when present.
 *
 * @see WorkQueueProperties
 * @see WorkQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WorkQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WorkQueueProperties.class)
public class WorkQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcQueueStore queueStore(DataSource dataSource, WorkQueueProperties props) {
    return JdbcQueueStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public WorkQueueConfig workQueueConfig(WorkQueueProperties props) {
    return props.toConfig();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public WorkQueue workQueue(WorkQueueProperties props,
                             WorkQueueConfig config,
                             ConnectionProvider connectionProvider,
                             AbstractJdbcQueueStore queueStore,
                             ObjectProvider<MetricsExporter> metricsProvider,
                             ObjectProvider<BackingStoreCheck> backingStores) {
    WorkQueue.Builder builder = WorkQueue.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .config(config);
    String instanceId = props.getInstanceId();
    if (instanceId != null && !instanceId.isEmpty()) {
      builder.instanceId(instanceId);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    backingStores.orderedStream().forEach(builder::backingStore);

    WorkQueue workQueue = builder.build();
    if (props.getHealth().isMonitorEnabled()) {
      workQueue.healthMonitor().start();
    }
    return workQueue;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "workqueue.reclaim", name = "enabled", matchIfMissing = true)
  public OrphanReclaimScheduler orphanReclaimScheduler(WorkQueue workQueue, WorkQueueProperties props) {
    return OrphanReclaimScheduler.builder()
        .workQueue(workQueue)
        .intervalSeconds(props.getReclaim().getIntervalSeconds())
        .build();
  }
}
