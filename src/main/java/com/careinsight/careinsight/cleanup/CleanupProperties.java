package com.careinsight.careinsight.cleanup;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retention limits for staged upload files.
 */
@ConfigurationProperties(prefix = "import.cleanup")
public class CleanupProperties {

    public static final double DEFAULT_MAX_AGE_HOURS = 24;
    public static final double DEFAULT_MAX_SIZE_MB = 500;
    public static final String DEFAULT_CRON = "0 0 * * * *";

    private double maxAgeHours = DEFAULT_MAX_AGE_HOURS;
    private double maxSizeMb = DEFAULT_MAX_SIZE_MB;
    private String cron = DEFAULT_CRON;

    public double getMaxAgeHours() {
        return maxAgeHours;
    }

    public void setMaxAgeHours(double maxAgeHours) {
        this.maxAgeHours = maxAgeHours;
    }

    public double getMaxSizeMb() {
        return maxSizeMb;
    }

    public void setMaxSizeMb(double maxSizeMb) {
        this.maxSizeMb = maxSizeMb;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }
}
