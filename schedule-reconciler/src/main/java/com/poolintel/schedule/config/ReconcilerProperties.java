package com.poolintel.schedule.config;

import com.poolintel.schedule.model.RunParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "schedule-reconciler")
@Data
public class ReconcilerProperties {

    private Run run = new Run();
    private Matching matching = new Matching();
    private Expansion expansion = new Expansion();
    private Quality quality = new Quality();
    private Sources sources = new Sources();
    private Http http = new Http();
    private Output output = new Output();

    public RunParameters toRunParameters() {
        return RunParameters.builder()
                .weeksAhead(run.getWeeksAhead())
                .optimize(run.isOptimize())
                .matchThreshold(matching.getThreshold())
                .build()
                .validate();
    }

    @Data
    public static class Run {
        private int weeksAhead = 4;
        private boolean optimize = true;
        private boolean dryRun = false;
        private boolean runOnStartup = false;
    }

    @Data
    public static class Matching {
        private double threshold = 0.6;

        /** Stopgap name → facility id table, consulted only after scored matching fails */
        private Map<String, String> manualOverrides = new LinkedHashMap<>();
    }

    @Data
    public static class Expansion {
        /** Extra whole weeks an explicitly dated session is projected forward */
        private int explicitDateProjectionWeeks = 3;
    }

    @Data
    public static class Quality {
        private int pastWindowDays = 30;
        private int futureWindowDays = 180;
        private int coverageStartHour = 6;
        private int coverageEndHour = 22;
        private int peakHours = 5;
        private double lowCoverageRatio = 0.5;
    }

    @Data
    public static class Sources {
        private Tabular tabular = new Tabular();
        private LocationFeed locationFeed = new LocationFeed();
        private Html html = new Html();

        @Data
        public static class Tabular {
            private boolean enabled = true;
            private String programsUrl;
            private String locationsUrl;
        }

        @Data
        public static class LocationFeed {
            private boolean enabled = true;
            private String baseUrl = "https://www.toronto.ca/data/parks/live/locations";
            private List<FeedLocation> locations = new ArrayList<>();
        }

        @Data
        public static class FeedLocation {
            private String locationId;
            private String name;
        }

        @Data
        public static class Html {
            private boolean enabled = true;
            private List<HtmlPage> pages = new ArrayList<>();
        }

        @Data
        public static class HtmlPage {
            private String url;
            private String locationName;
        }
    }

    @Data
    public static class Http {
        private int timeoutSeconds = 60;
        private String userAgent = "PoolIntel/1.0 (pool schedule aggregator)";
        private long rateLimitDelayMs = 250;
        private int fetchParallelism = 3;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();
        private String reportDir = "/data/reports";

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }
}
