package com.example.roundtable.config;

import com.example.roundtable.analytics.JpaSessionAnalytics;
import com.example.roundtable.analytics.NoOpSessionAnalytics;
import com.example.roundtable.analytics.SessionAnalytics;
import com.example.roundtable.repository.DiscussionSessionRepository;
import com.example.roundtable.repository.TopicUsageRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsConfig {

  // Active unless features.analytics.enabled=false
  @Bean
  @ConditionalOnProperty(prefix = "features.analytics", name = "enabled", havingValue = "true", matchIfMissing = true)
  public SessionAnalytics jpaSessionAnalytics(DiscussionSessionRepository sessions, TopicUsageRepository topics) {
    return new JpaSessionAnalytics(sessions, topics);
  }

  @Bean
  @ConditionalOnMissingBean(SessionAnalytics.class)
  public SessionAnalytics noOpSessionAnalytics() {
    return new NoOpSessionAnalytics();
  }
}
