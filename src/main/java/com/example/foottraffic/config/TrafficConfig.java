package com.example.foottraffic.config;

import com.example.foottraffic.service.AttachedDetectionsDetector;
import com.example.foottraffic.service.PersonDetector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 客流分析配置
 */
@Configuration
@EnableScheduling  // 快照定时推送
@EnableConfigurationProperties(TrafficProperties.class)
public class TrafficConfig {

    /**
     * 未接入检测模型时，使用随帧提交的检测结果
     */
    @Bean
    @ConditionalOnMissingBean
    public PersonDetector personDetector() {
        return new AttachedDetectionsDetector();
    }
}
