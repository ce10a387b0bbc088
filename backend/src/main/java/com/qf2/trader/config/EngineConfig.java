package com.qf2.trader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qf2.trader.adapter.InMemoryMarketDataProvider;
import com.qf2.trader.adapter.InMemorySentimentProvider;
import com.qf2.trader.adapter.LoggingAuditSink;
import com.qf2.trader.adapter.PaperExchange;
import com.qf2.trader.compliance.ComplianceConfig;
import com.qf2.trader.port.AuditSink;
import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.port.MarketDataProvider;
import com.qf2.trader.rebalance.CircuitBreakerConfig;
import com.qf2.trader.rebalance.RebalanceConfig;
import com.qf2.trader.selection.AllocatorConfig;
import com.qf2.trader.selection.AlphaConfig;
import com.qf2.trader.selection.AnnealerConfig;
import com.qf2.trader.selection.CorrelationConfig;
import com.qf2.trader.selection.HamiltonianConfig;
import com.qf2.trader.selection.LambdaTuningConfig;
import com.qf2.trader.selection.RegimeConfig;
import com.qf2.trader.selection.UniverseConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Immutable engine configuration snapshots, executors and the default collaborator adapters.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UniverseConfig universeConfig(UniverseProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public RegimeConfig regimeConfig(SelectionProperties properties) {
        return properties.getRegime().toConfig();
    }

    @Bean
    public LambdaTuningConfig lambdaTuningConfig(SelectionProperties properties) {
        return properties.getRegime().getTuning().toConfig();
    }

    @Bean
    public AlphaConfig alphaConfig(SelectionProperties properties) {
        return properties.getAlpha().toConfig();
    }

    @Bean
    public CorrelationConfig correlationConfig(SelectionProperties properties) {
        return properties.getCorrelation().toConfig();
    }

    @Bean
    public HamiltonianConfig hamiltonianConfig(SelectionProperties properties) {
        return properties.getHamiltonian().toConfig();
    }

    @Bean
    public AnnealerConfig annealerConfig(SelectionProperties properties) {
        return properties.getAnnealer().toConfig();
    }

    @Bean
    public AllocatorConfig allocatorConfig(SelectionProperties properties) {
        return properties.getAllocator().toConfig();
    }

    @Bean
    public ComplianceConfig complianceConfig(ComplianceProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public RebalanceConfig rebalanceConfig(RebalanceProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public CircuitBreakerConfig circuitBreakerConfig(RebalanceProperties properties) {
        return properties.getCircuitBreaker().toConfig();
    }

    @Bean(name = "annealerExecutor")
    public Executor annealerExecutor(SelectionProperties properties) {
        int parallelism = properties.getAnnealer().effectiveParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(Math.max(properties.getAnnealer().getReads(), 1) * 4);
        executor.setThreadNamePrefix("anneal-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "gatewayExecutor")
    public Executor gatewayExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(4, processors));
        executor.setMaxPoolSize(Math.max(16, processors * 2));
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("gateway-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public InMemoryMarketDataProvider marketDataProvider() {
        return new InMemoryMarketDataProvider();
    }

    @Bean
    public InMemorySentimentProvider sentimentProvider() {
        return new InMemorySentimentProvider();
    }

    @Bean
    public ExecutionPort paperExchange(MarketDataProvider marketDataProvider, PaperExchangeProperties properties) {
        return new PaperExchange(marketDataProvider, properties.getStartingCash(), properties.getCommissionRate());
    }

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new LoggingAuditSink(objectMapper);
    }
}
