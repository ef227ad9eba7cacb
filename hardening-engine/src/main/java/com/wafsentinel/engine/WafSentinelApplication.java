package com.wafsentinel.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WAF Sentinel: classifies firewall audit records and hardens the
 * high-paranoia rule set from the classified history.
 *
 * @author WAF Sentinel Team
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class WafSentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(WafSentinelApplication.class, args);
    }
}
