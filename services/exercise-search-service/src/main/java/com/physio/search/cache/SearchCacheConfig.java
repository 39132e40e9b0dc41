package com.physio.search.cache;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SearchCacheProperties.class)
public class SearchCacheConfig {
}
