package com.loanorigination.config;

import com.loanorigination.rules.RuleEngine;
import com.loanorigination.rules.RuleSnapshot;
import com.loanorigination.rules.domain.CreditBureauRuleSet;
import com.loanorigination.rules.domain.CreditBureauSnapshot;
import com.loanorigination.rules.domain.EligibilityRuleSet;
import com.loanorigination.rules.domain.EligibilitySnapshot;
import com.loanorigination.rules.domain.KycRuleSet;
import com.loanorigination.rules.domain.KycSnapshot;
import com.loanorigination.rules.domain.RiskRuleSet;
import com.loanorigination.rules.domain.RiskSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * One engine per domain, built from the configured thresholds.
 */
@Configuration
@Slf4j
public class RuleEngineConfig {

    @Bean
    public RuleEngine<KycSnapshot> kycRuleEngine(RuleEngineProperties properties) {
        return logged(KycRuleSet.create(properties.getKyc().toThresholds()));
    }

    @Bean
    public RuleEngine<CreditBureauSnapshot> creditBureauRuleEngine(RuleEngineProperties properties) {
        return logged(CreditBureauRuleSet.create(properties.getCreditBureau().toThresholds()));
    }

    @Bean
    public RuleEngine<EligibilitySnapshot> eligibilityRuleEngine(RuleEngineProperties properties) {
        return logged(EligibilityRuleSet.create(properties.getEligibility().toThresholds()));
    }

    @Bean
    public RuleEngine<RiskSnapshot> riskRuleEngine(RuleEngineProperties properties) {
        return logged(RiskRuleSet.create(properties.getRisk().toThresholds()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static <S extends RuleSnapshot> RuleEngine<S> logged(RuleEngine<S> engine) {
        log.info("Configured {} rule engine with {} rules", engine.getName(), engine.getRules().size());
        return engine;
    }
}
