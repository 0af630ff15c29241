package com.z254.robi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the ROBI service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "robi")
public class RobiProperties {

    private SessionProperties session = new SessionProperties();
    private LLMProperties llm = new LLMProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private MemoryProperties memory = new MemoryProperties();
    private BackgroundProperties background = new BackgroundProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class SessionProperties {
        /**
         * Key clients must present in the {@code auth} message.
         */
        private String apiKey;
        private Duration authTimeout = Duration.ofSeconds(10);
        private String path = "/ws/interact";
        private int maxMessageBytes = 50 * 1024 * 1024;
        /**
         * Cap on buffered header and open-tag text in the streaming decoder.
         */
        private int tagBufferCap = 500;
    }

    @Data
    public static class LLMProperties {
        private String defaultProvider = "gemini";
        private GeminiProperties gemini = new GeminiProperties();

        @Data
        public static class GeminiProperties {
            private boolean enabled = true;
            private String apiKey;
            private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";
            private String model = "gemini-2.0-flash-lite";
            private int maxTokens = 512;
            private double temperature = 0.7;
            private Duration timeout = Duration.ofSeconds(60);
        }
    }

    @Data
    public static class ConversationProperties {
        /**
         * History length at which compaction kicks in.
         */
        private int compactionThreshold = 20;
        /**
         * Most recent messages kept verbatim after compaction.
         */
        private int keepRecent = 5;
    }

    @Data
    public static class MemoryProperties {
        private int minImportance = 5;
        private int contextLimit = 5;
        private int zoneFactsLimit = 5;
        private CompactionProperties compaction = new CompactionProperties();

        @Data
        public static class CompactionProperties {
            private boolean enabled = true;
            private Duration interval = Duration.ofHours(6);
            private int maxPerScope = 50;
        }
    }

    @Data
    public static class BackgroundProperties {
        private int threadCap = 4;
        private int queuedTaskCap = 1000;
    }

    @Data
    public static class StorageProperties {
        /**
         * {@code memory} or {@code redis}.
         */
        private String type = "memory";
        private String keyPrefix = "robi:";
        private Duration historyTtl = Duration.ofDays(30);
    }
}
