package com.example.bottle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "bottle")
public class BottleProperties {

    /**
     * Switch breakage flagging on as soon as the inventory starts.
     */
    private boolean breakageFlaggedOnStartup = false;

    /**
     * Number of recent inventory events kept by the activity trail.
     */
    @Min(1)
    private int activityLogCapacity = 100;

    @Valid
    private Report report = new Report();

    @Valid
    private Demo demo = new Demo();

    @Data
    public static class Report {

        @NotBlank
        private String timestampPattern = "yyyy-MM-dd HH:mm:ss";

        @NotBlank
        private String zone = "UTC";
    }

    @Data
    public static class Demo {

        private boolean enabled = false;
    }
}
