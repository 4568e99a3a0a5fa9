package com.flamingo.ai.specshard.api.rest;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.specshard.api.dto.request.MergeRequest;
import com.flamingo.ai.specshard.api.dto.request.ShardRequest;
import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.exception.GlobalExceptionHandler;
import com.flamingo.ai.specshard.exception.InvalidShardIdException;
import com.flamingo.ai.specshard.service.export.ShardExportService;
import com.flamingo.ai.specshard.service.export.ShardPlanSummaryRenderer;
import com.flamingo.ai.specshard.service.sharding.ShardingService;
import com.flamingo.ai.specshard.service.sharding.model.MergeResult;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardPlan;
import com.flamingo.ai.specshard.service.sharding.model.ShardResult;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShardController Tests")
class ShardControllerTest {

  private static final String SPEC = "# Title\n\n## API\nEndpoints.";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ShardingService shardingService;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper().findAndRegisterModules();
    ShardController controller =
        new ShardController(
            shardingService,
            new ShardExportService(objectMapper),
            new ShardPlanSummaryRenderer(),
            new ShardingConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("should return the plan when sharding succeeds")
  void shouldReturnPlan_whenShardingSucceeds() throws Exception {
    when(shardingService.shard(eq(SPEC), any(ShardOptions.class))).thenReturn(successResult());

    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec(SPEC).build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.plan.shards[0].id").value("section-01-api"))
        .andExpect(jsonPath("$.plan.shards[0].type").value("section"))
        .andExpect(jsonPath("$.plan.recommendedOrder[0]").value("section-01-api"));
  }

  @Test
  @DisplayName("should fill unset options from configured defaults")
  void shouldApplyDefaults_whenOptionsOmitted() throws Exception {
    when(shardingService.shard(anyString(), any(ShardOptions.class)))
        .thenReturn(successResult());

    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\":\"## A\"}"))
        .andExpect(status().isOk());

    verify(shardingService)
        .shard("## A", new ShardOptions(ShardStrategyType.AUTO, 2000, true, true));
  }

  @Test
  @DisplayName("should accept strategy wire names")
  void shouldParseStrategy_whenWireNameGiven() throws Exception {
    when(shardingService.shard(anyString(), any(ShardOptions.class)))
        .thenReturn(successResult());

    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"spec\":\"## A\",\"strategy\":\"by-scenario\","
                        + "\"maxTokensPerShard\":500,\"preserveContext\":false}"))
        .andExpect(status().isOk());

    verify(shardingService)
        .shard("## A", new ShardOptions(ShardStrategyType.BY_SCENARIO, 500, false, true));
  }

  @Test
  @DisplayName("should return 422 with the failed result when sharding fails")
  void shouldReturnUnprocessable_whenShardingFails() throws Exception {
    when(shardingService.shard(eq(SPEC), any(ShardOptions.class))).thenReturn(failedResult());

    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec(SPEC).build())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error").value("Strategy exploded"));
  }

  @Test
  @DisplayName("should reject a blank spec")
  void shouldReturnBadRequest_whenSpecBlank() throws Exception {
    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec("  ").build())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("spec: Spec is required"));

    verifyNoInteractions(shardingService);
  }

  @Test
  @DisplayName("should reject a negative budget")
  void shouldReturnBadRequest_whenBudgetNegative() throws Exception {
    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec(SPEC).maxTokensPerShard(-5).build())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("should reject an unknown strategy name")
  void shouldReturnBadRequest_whenStrategyUnknown() throws Exception {
    mockMvc
        .perform(
            post("/api/shards/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\":\"## A\",\"strategy\":\"by-magic\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_002"))
        .andExpect(jsonPath("$.message").value("Malformed request body"));
  }

  @Test
  @DisplayName("should merge shards")
  void shouldReturnMergeResult_whenMerging() throws Exception {
    when(shardingService.merge(anyList()))
        .thenReturn(new MergeResult("## API", false, List.of("ghost"), List.of()));

    mockMvc
        .perform(
            post("/api/shards/merge")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(MergeRequest.builder().shards(List.of(apiShard())).build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content").value("## API"))
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.missingShards[0]").value("ghost"));
  }

  @Test
  @DisplayName("should return 400 when a merged shard id is invalid")
  void shouldReturnBadRequest_whenShardIdInvalid() throws Exception {
    when(shardingService.merge(anyList()))
        .thenThrow(new InvalidShardIdException("", "must be a non-empty string"));

    mockMvc
        .perform(
            post("/api/shards/merge")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"shards\":[{\"id\":\"\",\"type\":\"section\",\"content\":\"x\"}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SHARD_001"))
        .andExpect(jsonPath("$.message").value("Invalid shard ID: must be a non-empty string"));
  }

  @Test
  @DisplayName("should export shard files and the plan summary")
  void shouldExportFiles_whenShardingSucceeds() throws Exception {
    when(shardingService.shard(eq(SPEC), any(ShardOptions.class))).thenReturn(successResult());

    mockMvc
        .perform(
            post("/api/shards/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    json(
                        ShardRequest.builder()
                            .spec(SPEC)
                            .includeMetadata(false)
                            .baseName("payments.md")
                            .build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.files[0].fileName").value("payments-section-01-api.md"))
        .andExpect(jsonPath("$.files[0].content").value("## API\nEndpoints."))
        .andExpect(jsonPath("$.planSummaryFileName").value("payments-plan.json"));
  }

  @Test
  @DisplayName("should return 422 when exporting a failed plan")
  void shouldReturnUnprocessable_whenExportingFailedPlan() throws Exception {
    when(shardingService.shard(eq(SPEC), any(ShardOptions.class))).thenReturn(failedResult());

    mockMvc
        .perform(
            post("/api/shards/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec(SPEC).build())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("SHARD_002"))
        .andExpect(jsonPath("$.message").value("Strategy exploded"))
        .andExpect(jsonPath("$.details").value("Sharding failed: Strategy exploded"));
  }

  @Test
  @DisplayName("should render a plain-text summary")
  void shouldReturnText_whenSummaryRequested() throws Exception {
    when(shardingService.shard(eq(SPEC), any(ShardOptions.class))).thenReturn(successResult());

    mockMvc
        .perform(
            post("/api/shards/summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(ShardRequest.builder().spec(SPEC).build())))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
        .andExpect(content().string(containsString("Total Shards: 1")))
        .andExpect(content().string(containsString("section-01-api")));
  }

  @Test
  @DisplayName("should return the analysis")
  void shouldReturnAnalysis_whenAnalyzing() throws Exception {
    when(shardingService.analyze(SPEC)).thenReturn(analysis());

    mockMvc
        .perform(
            post("/api/shards/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("spec", SPEC))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.recommendedStrategy").value("by-section"))
        .andExpect(jsonPath("$.sectionCount").value(1));
  }

  private String json(Object value) throws Exception {
    return objectMapper.writeValueAsString(value);
  }

  private static ShardAnalysis analysis() {
    return new ShardAnalysis(ShardStrategyType.BY_SECTION, 8, 1, 0, 0, 4, 7, "One section");
  }

  private static Shard apiShard() {
    return Shard.builder()
        .id("section-01-api")
        .type(ShardType.SECTION)
        .content("## API\nEndpoints.")
        .tokenCount(5)
        .priority(1)
        .sectionName("API")
        .build();
  }

  private static ShardResult successResult() {
    ShardPlan plan =
        new ShardPlan(List.of(apiShard()), 5, List.of("section-01-api"), List.of(), analysis());
    return new ShardResult(plan, true, null, 3);
  }

  private static ShardResult failedResult() {
    return new ShardResult(ShardPlan.empty(analysis()), false, "Strategy exploded", 1);
  }
}
