package com.kotsin.hotspot.config;

import com.kotsin.hotspot.cluster.SeverityClassifier;
import com.kotsin.hotspot.cluster.SpatialClusterer;
import com.kotsin.hotspot.tracking.EventIdGenerator;
import com.kotsin.hotspot.tracking.EventPresenter;
import com.kotsin.hotspot.tracking.IdentityResolver;
import com.kotsin.hotspot.tracking.LifecycleStateMachine;
import com.kotsin.hotspot.tracking.NotificationPolicy;
import com.kotsin.hotspot.tracking.ScanMerger;
import com.kotsin.hotspot.tracking.TrendEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the framework-free clustering and tracking core from {@link TrackingProperties}.
 */
@Configuration
public class TrackingCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SeverityClassifier severityClassifier() {
        return new SeverityClassifier();
    }

    @Bean
    public SpatialClusterer spatialClusterer(SeverityClassifier severityClassifier) {
        return new SpatialClusterer(severityClassifier);
    }

    @Bean
    public IdentityResolver identityResolver(TrackingProperties properties) {
        return new IdentityResolver(properties.getMaxMatchKm());
    }

    @Bean
    public TrendEngine trendEngine() {
        return new TrendEngine();
    }

    @Bean
    public LifecycleStateMachine lifecycleStateMachine() {
        return new LifecycleStateMachine();
    }

    @Bean
    public NotificationPolicy notificationPolicy(TrackingProperties properties) {
        return new NotificationPolicy(
                properties.getNotification().getTitle(),
                properties.getNotification().getUrl());
    }

    @Bean
    public EventPresenter eventPresenter() {
        return new EventPresenter();
    }

    @Bean
    public EventIdGenerator eventIdGenerator() {
        return new EventIdGenerator();
    }

    @Bean
    public ScanMerger scanMerger(IdentityResolver identityResolver,
                                 TrendEngine trendEngine,
                                 LifecycleStateMachine lifecycleStateMachine,
                                 NotificationPolicy notificationPolicy,
                                 EventPresenter eventPresenter,
                                 EventIdGenerator eventIdGenerator,
                                 TrackingProperties properties) {
        return new ScanMerger(identityResolver, trendEngine, lifecycleStateMachine,
                notificationPolicy, eventPresenter, eventIdGenerator,
                properties.getHistoryCap(),
                Duration.ofSeconds(properties.getDuplicateWindowSeconds()));
    }
}
