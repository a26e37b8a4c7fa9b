package com.mahjongrules.config;

import com.mahjongrules.engine.ReactionChecker;
import com.mahjongrules.engine.ScoringEngine;
import com.mahjongrules.engine.WinAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 按规则开关创建判牌、算番、操作检查组件
 */
@Configuration
@EnableConfigurationProperties(RulesProperties.class)
public class RulesConfig {

    private static final Logger log = LoggerFactory.getLogger(RulesConfig.class);

    @Bean
    public WinAnalyzer winAnalyzer(RulesProperties properties) {
        return new WinAnalyzer(properties.isSevenPairsAllowQuads());
    }

    @Bean
    public ScoringEngine scoringEngine(RulesProperties properties) {
        log.info("规则配置：圈风 {}，七对可含四张 {}，只能吃上家 {}",
                properties.getRoundWind(), properties.isSevenPairsAllowQuads(), properties.isChiFromNextSeatOnly());
        return new ScoringEngine(properties.getRoundWind());
    }

    @Bean
    public ReactionChecker reactionChecker(RulesProperties properties, WinAnalyzer winAnalyzer) {
        return new ReactionChecker(properties.isChiFromNextSeatOnly(), winAnalyzer);
    }
}
