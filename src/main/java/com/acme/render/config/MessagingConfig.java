package com.acme.render.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Naming of the Kafka topics the run lifecycle events are relayed to.
 */
@ConfigurationProperties("messaging")
public class MessagingConfig {

    private String bootstrapServers = "localhost:9092";
    private String clientId = "render-events-producer";
    private TopicNaming topicNaming = new TopicNaming();

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public void setBootstrapServers(String bootstrapServers) {
        this.bootstrapServers = bootstrapServers;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public TopicNaming getTopicNaming() {
        return topicNaming;
    }

    public void setTopicNaming(TopicNaming topicNaming) {
        this.topicNaming = topicNaming;
    }

    public static class TopicNaming {
        private String eventPrefix = "events.";

        public String getEventPrefix() {
            return eventPrefix;
        }

        public void setEventPrefix(String eventPrefix) {
            this.eventPrefix = eventPrefix;
        }

        /**
         * Build an event topic name from an event type.
         * Example: RunResubmissionRequired -> events.RunResubmissionRequired
         */
        public String buildEventTopic(String eventType) {
            return eventPrefix + eventType;
        }
    }
}
