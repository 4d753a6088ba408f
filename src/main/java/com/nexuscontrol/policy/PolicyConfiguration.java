package com.nexuscontrol.policy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfiguration {

    @Bean
    public PolicyValidator policyValidator() {
        return new PolicyValidator();
    }
}
