package com.sheetcalc.app.config;

import com.sheetcalc.app.formula.FormulaEngine;
import com.sheetcalc.app.formula.functions.FunctionRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the formula engine. The clock is a bean so that TODAY() and NOW()
 * can be pinned in tests.
 */
@Configuration
@EnableConfigurationProperties(FormulaEngineProperties.class)
public class FormulaEngineConfig {

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.createDefault();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FormulaEngine formulaEngine(FunctionRegistry functionRegistry, Clock clock,
                                       FormulaEngineProperties properties) {
        return new FormulaEngine(functionRegistry, clock, properties.getMaxDepth(),
                properties.isStrictFunctionNames());
    }
}
