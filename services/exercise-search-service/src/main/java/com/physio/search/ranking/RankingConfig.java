package com.physio.search.ranking;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RankingWeightsProperties.class)
public class RankingConfig {
}
