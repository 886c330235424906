package com.fintech.marketmaking.config;

import com.fintech.marketmaking.closing.ClosingSchedule;
import com.fintech.marketmaking.strategy.SessionFactory;
import com.fintech.marketmaking.util.SessionWindowClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for core engine beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public SecurityConfigResolver securityConfigResolver(BacktestProperties properties) {
        return new SecurityConfigResolver(properties);
    }

    @Bean
    public SessionWindowClassifier sessionWindowClassifier(SecurityConfigResolver resolver) {
        return new SessionWindowClassifier(resolver.tradingHours());
    }

    @Bean
    public ClosingSchedule closingSchedule(SecurityConfigResolver resolver) {
        return resolver.closingSchedule();
    }

    @Bean
    public SessionFactory sessionFactory(SecurityConfigResolver resolver,
                                         SessionWindowClassifier classifier,
                                         ClosingSchedule closingSchedule) {
        return new SessionFactory(resolver, classifier, closingSchedule);
    }
}
