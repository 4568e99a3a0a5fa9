package com.flamingo.ai.specshard;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specshard.service.export.ShardExportService;
import com.flamingo.ai.specshard.service.export.ShardPlanSummaryRenderer;
import com.flamingo.ai.specshard.service.sharding.ShardingService;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.strategy.ShardingStrategyRouter;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the Spring application context loads with every sharding component wired. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ShardingService.class)).isNotNull();
    assertThat(applicationContext.getBean(ShardExportService.class)).isNotNull();
    assertThat(applicationContext.getBean(ShardPlanSummaryRenderer.class)).isNotNull();
    assertThat(applicationContext.getBean(TimedAspect.class)).isNotNull();
  }

  @Test
  @DisplayName("Every strategy type should have a registered strategy")
  void everyStrategyTypeShouldBeRoutable() {
    ShardingStrategyRouter router = applicationContext.getBean(ShardingStrategyRouter.class);

    for (ShardStrategyType type : ShardStrategyType.values()) {
      assertThat(router.route(type).type()).isEqualTo(type);
    }
  }

  @Test
  @DisplayName("Sharding service should produce a plan end to end")
  void shardingServiceShouldProducePlan() {
    ShardingService service = applicationContext.getBean(ShardingService.class);

    assertThat(service.shard("# Title\n\n## A\nText", null).success()).isTrue();
  }

  @Test
  @DisplayName("Meters should carry the application tag once")
  void metersShouldCarrySingleCommonTag() {
    MeterRegistry registry = applicationContext.getBean(MeterRegistry.class);

    Counter counter = registry.counter("context_check_total");

    assertThat(counter.getId().getTag("application")).isEqualTo("spec-shard");
    assertThat(counter.getId().getTag("service")).isNull();
  }
}
