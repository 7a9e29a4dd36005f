package com.shadows.core.balance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shadows.generation")
public class GenerationProperties {

    private int maxAttempts = 5;
    private int poolSize = 3;
    private int poolDiversityRetries = 10;
    private int minBonusObjectives = 1;
    private int maxBonusObjectives = 2;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public int getPoolDiversityRetries() { return poolDiversityRetries; }
    public void setPoolDiversityRetries(int poolDiversityRetries) { this.poolDiversityRetries = poolDiversityRetries; }
    public int getMinBonusObjectives() { return minBonusObjectives; }
    public void setMinBonusObjectives(int minBonusObjectives) { this.minBonusObjectives = minBonusObjectives; }
    public int getMaxBonusObjectives() { return maxBonusObjectives; }
    public void setMaxBonusObjectives(int maxBonusObjectives) { this.maxBonusObjectives = maxBonusObjectives; }
}
