/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.columnar.compute.common.setting.PropertiesSettings;
import org.columnar.compute.common.setting.Settings;
import org.columnar.compute.executor.ChunkedExecutionEngine;
import org.columnar.compute.expression.evaluator.DefaultExpressionEvaluator;
import org.columnar.compute.expression.evaluator.ExpressionEvaluator;
import org.columnar.compute.expression.evaluator.PredicateCompiler;
import org.columnar.compute.monitor.MemoryMonitor;
import org.columnar.compute.monitor.RuntimeMemoryMonitor;
import org.columnar.compute.planner.chunked.ChunkExecutor;
import org.columnar.compute.planner.chunked.ExecutionOptions;
import org.columnar.compute.planner.chunked.ExpressionSplitter;
import org.columnar.compute.planner.chunked.MemoryPolicy;
import org.columnar.compute.planner.chunked.ResultMerger;
import org.columnar.compute.planner.chunked.StrategyResolver;
import org.columnar.compute.planner.chunked.concurrency.ConcurrencyStrategy;
import org.columnar.compute.planner.chunked.concurrency.ParallelStrategy;
import org.columnar.compute.planner.chunked.concurrency.SequentialStrategy;
import org.columnar.compute.planner.chunked.partition.PartitionPlanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the chunked execution engine and its collaborators. */
@Configuration
public class ComputeEngineConfig {

  /**
   * Settings Bean.
   *
   * @return settings read from {@code compute.properties} and system properties.
   */
  @Bean
  public Settings settings() {
    return new PropertiesSettings();
  }

  @Bean
  public MemoryMonitor memoryMonitor() {
    return new RuntimeMemoryMonitor();
  }

  @Bean
  public MemoryPolicy memoryPolicy(MemoryMonitor memoryMonitor, Settings settings) {
    long divisor = settings.getSettingValue(Settings.Key.MEMORY_DIVISOR);
    return new MemoryPolicy(memoryMonitor, divisor);
  }

  @Bean
  public ExpressionEvaluator expressionEvaluator() {
    return new DefaultExpressionEvaluator(new PredicateCompiler());
  }

  /**
   * Worker pool for chunk tasks, sized by {@code compute.chunk.parallelism}.
   *
   * @return the pool, shut down with the context.
   */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService chunkExecutorService(Settings settings) {
    int parallelism = settings.getSettingValue(Settings.Key.CHUNK_PARALLELISM);
    return Executors.newFixedThreadPool(
        Math.max(1, parallelism),
        new ThreadFactoryBuilder().setNameFormat("compute-chunk-%d").setDaemon(true).build());
  }

  @Bean
  public ConcurrencyStrategy concurrencyStrategy(
      Settings settings, ExecutorService chunkExecutorService) {
    int parallelism = settings.getSettingValue(Settings.Key.CHUNK_PARALLELISM);
    return parallelism > 1
        ? new ParallelStrategy(chunkExecutorService)
        : new SequentialStrategy();
  }

  /**
   * Default ExecutionOptions Bean.
   *
   * @return options from settings; callers may build their own per query.
   */
  @Bean
  public ExecutionOptions executionOptions(
      Settings settings, ConcurrencyStrategy concurrencyStrategy) {
    return ExecutionOptions.from(settings, concurrencyStrategy);
  }

  @Bean
  public ChunkedExecutionEngine chunkedExecutionEngine(
      MemoryPolicy memoryPolicy, ExpressionEvaluator expressionEvaluator) {
    return new ChunkedExecutionEngine(
        new StrategyResolver(memoryPolicy),
        expressionEvaluator,
        new ExpressionSplitter(),
        new PartitionPlanner(),
        new ChunkExecutor(expressionEvaluator),
        new ResultMerger());
  }
}
