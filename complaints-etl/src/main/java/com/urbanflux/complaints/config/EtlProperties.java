package com.urbanflux.complaints.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "urbanflux")
@Data
public class EtlProperties {

    private Etl etl = new Etl();
    private Loader loader = new Loader();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Etl {
        /** full | incremental */
        private String mode = "full";
        /** Local path or http(s) URL of the service request CSV */
        private String inputPath;
        private int chunkSize = 100_000;
        private boolean dryRun = false;
        private String badRowsDir = "/app/bad_rows";
        private String runsDir = "/app/runs";
    }

    @Data
    public static class Loader {
        /** Rows per INSERT statement, 8 bind parameters each */
        private int batchSize = 1000;
    }

    @Data
    public static class Scheduling {
        /** Spring cron expression, "-" disables the schedule */
        private String cron = "-";
        private boolean runOnStartup = false;
    }
}
