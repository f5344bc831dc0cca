package io.taskline.spring.boot;

import io.taskline.JobHandler;
import io.taskline.StandardJobType;
import io.taskline.Taskline;
import io.taskline.admin.JobAdmin;
import io.taskline.credential.TokenRefreshManager;
import io.taskline.jdbc.DataSourceConnectionProvider;
import io.taskline.jdbc.TableNames;
import io.taskline.jdbc.purge.AbstractJdbcJobPurger;
import io.taskline.jdbc.store.AbstractJdbcCredentialStore;
import io.taskline.jdbc.store.AbstractJdbcJobStore;
import io.taskline.jdbc.store.H2JobStore;
import io.taskline.jdbc.store.JdbcJobStores;
import io.taskline.jdbc.store.JdbcOAuthStateStore;
import io.taskline.jdbc.store.JdbcRecurringRunStore;
import io.taskline.jdbc.store.MySqlJobStore;
import io.taskline.jdbc.store.PostgresJobStore;
import io.taskline.jobs.RetentionCleanupHandler;
import io.taskline.jobs.TokenRefreshSweepHandler;
import io.taskline.oauth.OAuthStateManager;
import io.taskline.recurring.DefaultRecurringJobs;
import io.taskline.recurring.RecurringJobDefinition;
import io.taskline.registry.DefaultHandlerRegistry;
import io.taskline.registry.HandlerRegistry;
import io.taskline.scheduler.ExponentialBackoffRetryPolicy;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.CredentialStore;
import io.taskline.spi.JobPurger;
import io.taskline.spi.JobStore;
import io.taskline.spi.MetricsExporter;
import io.taskline.spi.OAuthStateStore;
import io.taskline.spi.RecurringRunStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the job scheduler and credential lifecycle.
 *
 * <p>Wires JDBC stores detected from the {@link DataSource}, a handler registry built from
 * {@link JobHandlerBinding} beans, a {@link TokenRefreshManager} built from
 * {@link ProviderRefresherBinding} beans, and a {@link Taskline} composite running the
 * built-in recurring definitions. A {@link Clock} bean, when present, replaces the system
 * clock.
 *
 * @see TasklineProperties
 * @see TasklineMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Taskline.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TasklineProperties.class)
public class TasklineAutoConfiguration {
  private static final Logger logger = Logger.getLogger(TasklineAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean(JobStore.class)
  public AbstractJdbcJobStore jobStore(DataSource dataSource, TasklineProperties props) {
    String tableName = props.getTables().getJob();
    AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
    if (!TableNames.JOB_TABLE.equals(tableName)) {
      return switch (detected.name()) {
        case "h2" -> new H2JobStore(tableName);
        case "mysql" -> new MySqlJobStore(tableName);
        case "postgresql" -> new PostgresJobStore(tableName);
        default -> detected;
      };
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(CredentialStore.class)
  public AbstractJdbcCredentialStore credentialStore(DataSource dataSource, TasklineProperties props) {
    return AbstractJdbcCredentialStore.forDatabase(
        JdbcJobStores.detect(dataSource).name(), props.getTables().getCredential());
  }

  @Bean
  @ConditionalOnMissingBean(RecurringRunStore.class)
  public JdbcRecurringRunStore recurringRunStore(TasklineProperties props) {
    return new JdbcRecurringRunStore(props.getTables().getRecurringRun());
  }

  @Bean
  @ConditionalOnMissingBean(OAuthStateStore.class)
  public JdbcOAuthStateStore oauthStateStore(TasklineProperties props) {
    return new JdbcOAuthStateStore(props.getTables().getOauthState());
  }

  @Bean
  @ConditionalOnMissingBean(JobPurger.class)
  public AbstractJdbcJobPurger jobPurger(DataSource dataSource, TasklineProperties props) {
    return AbstractJdbcJobPurger.forDatabase(
        JdbcJobStores.detect(dataSource).name(), props.getTables().getJob());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TokenRefreshManager tokenRefreshManager(TasklineProperties props,
      ConnectionProvider connectionProvider,
      CredentialStore credentialStore,
      ObjectProvider<ProviderRefresherBinding> refresherProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    TasklineProperties.Refresh refresh = props.getRefresh();
    TokenRefreshManager.Builder builder = TokenRefreshManager.builder()
        .connectionProvider(connectionProvider)
        .credentialStore(credentialStore)
        .clock(clockProvider.getIfAvailable(Clock::systemUTC))
        .metrics(metricsProvider.getIfAvailable())
        .safetyMargin(refresh.getSafetyMargin())
        .expiringSoonWindow(refresh.getExpiringSoonWindow())
        .sweepConcurrency(refresh.getSweepConcurrency());
    refresherProvider.orderedStream()
        .forEach(binding -> builder.refresher(binding.provider(), binding.refresher()));
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public OAuthStateManager oauthStateManager(TasklineProperties props,
      ConnectionProvider connectionProvider,
      OAuthStateStore oauthStateStore,
      ObjectProvider<Clock> clockProvider) {
    return OAuthStateManager.builder()
        .connectionProvider(connectionProvider)
        .stateStore(oauthStateStore)
        .clock(clockProvider.getIfAvailable(Clock::systemUTC))
        .ttl(props.getOauthState().getTtl())
        .build();
  }

  /**
   * Registers every {@link JobHandlerBinding} bean, plus the built-in {@code token_refresh}
   * and {@code cleanup} handlers for types no binding claims.
   */
  @Bean
  @ConditionalOnMissingBean(HandlerRegistry.class)
  public DefaultHandlerRegistry handlerRegistry(TasklineProperties props,
      ConnectionProvider connectionProvider,
      JobPurger jobPurger,
      OAuthStateStore oauthStateStore,
      TokenRefreshManager tokenRefreshManager,
      ObjectProvider<JobHandlerBinding> bindingProvider,
      ObjectProvider<Clock> clockProvider) {
    Map<String, JobHandler> handlers = new LinkedHashMap<>();
    handlers.put(StandardJobType.TOKEN_REFRESH.key(),
        new TokenRefreshSweepHandler(tokenRefreshManager, props.getRefresh().getSweepThreshold()));
    handlers.put(StandardJobType.CLEANUP.key(), RetentionCleanupHandler.builder()
        .connectionProvider(connectionProvider)
        .purger(jobPurger)
        .stateStore(oauthStateStore)
        .clock(clockProvider.getIfAvailable(Clock::systemUTC))
        .retention(props.getRetention().getPeriod())
        .batchSize(props.getRetention().getBatchSize())
        .build());

    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    bindingProvider.orderedStream().forEach(binding -> {
      if (handlers.remove(binding.jobType()) != null) {
        logger.log(Level.INFO, "Built-in handler for {0} replaced by application binding",
            binding.jobType());
      }
      registry.register(binding.jobType(), binding.handler());
    });
    handlers.forEach(registry::register);
    return registry;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Taskline taskline(TasklineProperties props,
      ConnectionProvider connectionProvider,
      JobStore jobStore,
      RecurringRunStore recurringRunStore,
      HandlerRegistry handlerRegistry,
      ObjectProvider<RecurringJobDefinition> definitionProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    TasklineProperties.Scheduler scheduler = props.getScheduler();
    TasklineProperties.Recurring recurring = props.getRecurring();

    Taskline.Builder builder = Taskline.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .runStore(recurringRunStore)
        .handlerRegistry(handlerRegistry)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .clock(clockProvider.getIfAvailable(Clock::systemUTC))
        .workerId(scheduler.getWorkerId())
        .workerCount(scheduler.getWorkerCount())
        .batchSize(scheduler.getBatchSize())
        .intervalMs(scheduler.getIntervalMs())
        .drainTimeoutMs(scheduler.getDrainTimeoutMs())
        .defaultTimeout(scheduler.getDefaultTimeout())
        .staleClaimTimeout(scheduler.getStaleClaimTimeout())
        .recurringIntervalMs(recurring.getIntervalMs());
    scheduler.getTimeouts().forEach(builder::timeout);

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (recurring.isEnabled()) {
      for (RecurringJobDefinition definition : DefaultRecurringJobs.definitions(recurring.getZone())) {
        if (!recurring.getExclude().contains(definition.id())) {
          builder.definition(definition);
        }
      }
    }
    definitionProvider.orderedStream().forEach(builder::definition);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "taskline.scheduler", name = "auto-start", matchIfMissing = true)
  public TasklineLifecycle tasklineLifecycle(Taskline taskline) {
    return new TasklineLifecycle(taskline);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobAdmin jobAdmin(ConnectionProvider connectionProvider,
      JobStore jobStore,
      Taskline taskline,
      ObjectProvider<Clock> clockProvider) {
    return new JobAdmin(connectionProvider, jobStore, clockProvider.getIfAvailable(Clock::systemUTC), taskline);
  }
}
