package com.example.search.config;

import com.example.search.config.properties.SourcesProperties;
import com.example.search.source.adapter.SourceAdapterFactory;
import com.example.search.source.adapter.SourceAdapterRegistry;
import com.example.search.source.adapter.sample.SampleSourceAdapterFactory;
import com.example.search.source.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Wires the source adapter registry.
 * Live adapter factories are beans; every configured sample source without a live factory
 * falls back to the fixture adapter.
 */
@Slf4j
@Configuration
public class SourceAdapterConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceAdapterRegistry sourceAdapterRegistry(
            ObjectProvider<SourceAdapterFactory> liveFactories,
            SourcesProperties sourcesProperties,
            Clock clock) {

        List<SourceAdapterFactory> factories = new ArrayList<>(liveFactories.orderedStream().toList());
        Set<SourceId> live = EnumSet.noneOf(SourceId.class);
        factories.forEach(factory -> live.add(factory.source()));

        for (SourceId source : sourcesProperties.sampleSources()) {
            if (live.add(source)) {
                factories.add(new SampleSourceAdapterFactory(source, clock));
            }
        }

        log.info("Live adapters: {}, sample adapters: {}",
                factories.stream().filter(f -> !(f instanceof SampleSourceAdapterFactory)).map(SourceAdapterFactory::source).toList(),
                factories.stream().filter(SampleSourceAdapterFactory.class::isInstance).map(SourceAdapterFactory::source).toList());

        return new SourceAdapterRegistry(factories);
    }
}
