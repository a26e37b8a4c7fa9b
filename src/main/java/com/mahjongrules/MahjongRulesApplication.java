package com.mahjongrules;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 麻将规则核心主入口
 */
@SpringBootApplication
public class MahjongRulesApplication {
    public static void main(String[] args) {
        SpringApplication.run(MahjongRulesApplication.class, args);
    }
}
