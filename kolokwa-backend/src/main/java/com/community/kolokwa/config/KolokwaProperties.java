package com.community.kolokwa.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;

/**
 * Tunable thresholds and reward amounts, bound from the {@code kolokwa.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "kolokwa")
public class KolokwaProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private Rewards rewards = new Rewards();

    @Valid
    private Badges badges = new Badges();

    @Valid
    private Streak streak = new Streak();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private Challenges challenges = new Challenges();

    @Data
    public static class Thresholds {
        /** accurate verifications that publish a pending entry */
        @Min(1)
        private int verify = 3;
        /** incorrect verifications that reject a pending entry */
        @Min(1)
        private int reject = 2;
    }

    @Data
    public static class Rewards {
        private int contribution = 2;
        private int vote = 1;
        private int verificationAccurate = 3;
        private int verificationVerified = 5;
        private int verificationReview = 2;
        private int contributionVerified = 10;
        private int verificationReceived = 2;
    }

    @Data
    public static class Badges {
        @Min(1)
        private int bonusDivisor = 10;
        private int bonusMinimum = 5;
        /** Members joined on or before this date are early adopters; unset means one year ago. */
        private LocalDate earlyAdopterCutoff;
    }

    @Data
    public static class Streak {
        @Min(1)
        private int bonusInterval = 7;
        private int bonusMultiplier = 2;
    }

    @Data
    public static class Reconciliation {
        @NotBlank
        private String cron = "0 30 3 * * *";
    }

    @Data
    public static class Challenges {
        @NotBlank
        private String cron = "0 5 0 * * *";
        @Min(0)
        private int defaultReward = 10;
    }
}
