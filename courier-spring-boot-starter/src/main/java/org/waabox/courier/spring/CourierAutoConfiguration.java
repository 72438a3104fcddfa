package org.waabox.courier.spring;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import org.waabox.courier.BackoffPolicy;
import org.waabox.courier.Courier;
import org.waabox.courier.Subscription;
import org.waabox.courier.SupervisorConfig;
import org.waabox.courier.cursor.CursorStore;
import org.waabox.courier.cursor.fs.FileSystemCursorStore;
import org.waabox.courier.event.EventConsumer;
import org.waabox.courier.metrics.CourierMetrics;
import org.waabox.courier.push.HintChannel;
import org.waabox.courier.push.PushSessionConfig;
import org.waabox.courier.push.ws.JdkWebSocketHintChannel;

/**
 * Spring Boot auto-configuration for the Courier delivery gateway.
 *
 * <p>Creates a singleton {@link Courier} that serves every enabled and
 * configured account of {@link CourierProperties}, delivering to the
 * application's {@link EventConsumer} bean. Cursors are kept on disk
 * under {@code courier.state-dir} and hints travel over the JDK
 * WebSocket client unless the application declares its own
 * {@link CursorStore} or {@link HintChannel}.
 *
 * <p>The gateway lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CourierAutoConfiguration.class);

  /**
   * Creates the file system cursor store.
   *
   * @param properties the configuration properties, never null
   *
   * @return the cursor store, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public CursorStore courierCursorStore(final CourierProperties properties) {
    final Path stateDir = Path.of(properties.getStateDir());
    log.info("Courier keeps cursors under {}", stateDir.toAbsolutePath());
    return new FileSystemCursorStore(stateDir);
  }

  /**
   * Creates the WebSocket hint channel.
   *
   * @param properties the configuration properties, never null
   *
   * @return the hint channel, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public HintChannel courierHintChannel(final CourierProperties properties) {
    return new JdkWebSocketHintChannel(
        properties.getPush().getConnectTimeout());
  }

  /**
   * Validates the account settings and creates their event sources.
   *
   * @param properties the configuration properties, never null
   *
   * @return the served accounts, never null
   *
   * @throws IllegalStateException if an account setting is invalid
   */
  @Bean
  public CourierAccounts courierAccounts(final CourierProperties properties) {
    final List<String> problems = properties.validate();
    if (!problems.isEmpty()) {
      throw new IllegalStateException("Invalid Courier configuration: "
          + String.join("; ", problems));
    }
    return new CourierAccounts(properties);
  }

  /**
   * Creates the singleton {@link Courier} bean with one subscription per
   * served account.
   *
   * @param properties      the configuration properties, never null
   * @param accounts        the served accounts, never null
   * @param consumer        the application's event consumer, never null
   * @param cursorStore     the cursor store, never null
   * @param hintChannel     the hint channel, never null
   * @param metricsProvider provider for an optional CourierMetrics bean
   *
   * @return the configured gateway, never null
   */
  @Bean
  public Courier courier(
      final CourierProperties properties,
      final CourierAccounts accounts,
      final EventConsumer consumer,
      final CursorStore cursorStore,
      final HintChannel hintChannel,
      final ObjectProvider<CourierMetrics> metricsProvider) {

    final CourierProperties.Backoff backoff = properties.getBackoff();
    final CourierProperties.Push push = properties.getPush();
    final CourierProperties.Fallback fallback = properties.getFallback();

    final Courier.Builder builder = Courier.builder()
        .cursorStore(cursorStore)
        .hintChannel(hintChannel)
        .backoffPolicy(BackoffPolicy.of(backoff.getInitial(),
            backoff.getFactor(), backoff.getCap()))
        .pushSessionConfig(PushSessionConfig.create(push.getConnectTimeout(),
            push.getPingInterval(), push.getPongTimeout()))
        .supervisorConfig(SupervisorConfig.create(fallback.getCycles(),
            fallback.getInterval()))
        .healthSummaryInterval(properties.getHealthSummaryInterval());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Courier using custom CourierMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final Courier courier = builder.build();
    accounts.sources().forEach((id, source) ->
        courier.subscribe(new Subscription(id, source, consumer)));

    log.info("Courier created with {} account(s): {}",
        accounts.sources().size(), accounts.sources().keySet());
    return courier;
  }

  /**
   * Creates the status reporter.
   *
   * @param properties the configuration properties, never null
   * @param courier    the gateway, never null
   * @param accounts   the served accounts, never null
   *
   * @return the status reporter, never null
   */
  @Bean
  public CourierStatus courierStatus(final CourierProperties properties,
      final Courier courier, final CourierAccounts accounts) {
    return new CourierStatus(properties, courier, accounts);
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * gateway.
   *
   * <p>Starts late (phase {@code Integer.MAX_VALUE - 1}) so that the
   * consumer is ready before the first delivery, and stops early.
   *
   * @param courier the gateway to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle courierLifecycle(final Courier courier) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Courier lifecycle...");
        courier.start();
        running = true;
        log.info("Courier lifecycle started.");
      }

      @Override
      public void stop() {
        log.info("Stopping Courier lifecycle...");
        courier.stop();
        running = false;
        log.info("Courier lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
