package com.processflow.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Typed view over a node's configuration blob.
 * The variant is chosen by the node type; a blob that does not fit its
 * variant is kept as {@link UnknownConfig} so newer shapes survive a round trip.
 */
public sealed interface NodeConfig permits NodeConfig.TaskConfig, NodeConfig.ApprovalConfig,
        NodeConfig.ServiceConfig, NodeConfig.GatewayConfig, NodeConfig.TimerConfig, NodeConfig.EmailConfig,
        NodeConfig.EmptyConfig, NodeConfig.UnknownConfig {

    /**
     * The participant a step is assigned to, if the configuration names one.
     */
    default Optional<String> responsibleParty() {
        return Optional.empty();
    }

    record TaskConfig(String assignee, String formKey, Integer dueInHours) implements NodeConfig {
        @Override
        public Optional<String> responsibleParty() {
            return Optional.ofNullable(assignee);
        }
    }

    record ApprovalConfig(List<String> approvers, String approvalType) implements NodeConfig {
        public ApprovalConfig {
            approvers = approvers == null ? List.of() : List.copyOf(approvers);
        }

        @Override
        public Optional<String> responsibleParty() {
            return approvers.stream().findFirst();
        }
    }

    record ServiceConfig(String endpoint, String method) implements NodeConfig {}

    record GatewayConfig(String gatewayType, List<String> conditions) implements NodeConfig {
        public GatewayConfig {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    record TimerConfig(String duration) implements NodeConfig {}

    record EmailConfig(List<String> recipients, String subject, String template) implements NodeConfig {
        public EmailConfig {
            recipients = recipients == null ? List.of() : List.copyOf(recipients);
        }
    }

    /**
     * Start and end nodes carry no configuration.
     */
    record EmptyConfig() implements NodeConfig {}

    record UnknownConfig(JsonNode raw) implements NodeConfig {}

    /**
     * Interpret a raw configuration blob for the given node type.
     */
    static NodeConfig of(NodeType type, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            raw = Parsing.MAPPER.createObjectNode();
        }
        if (!raw.isObject()) {
            return new UnknownConfig(raw);
        }
        Class<? extends NodeConfig> variant = switch (type) {
            case START, END -> EmptyConfig.class;
            case TASK -> TaskConfig.class;
            case APPROVAL -> ApprovalConfig.class;
            case SERVICE -> ServiceConfig.class;
            case GATEWAY -> GatewayConfig.class;
            case TIMER -> TimerConfig.class;
            case EMAIL -> EmailConfig.class;
        };
        if (variant == EmptyConfig.class) {
            return raw.isEmpty() ? new EmptyConfig() : new UnknownConfig(raw);
        }
        try {
            return Parsing.MAPPER.treeToValue(raw, variant);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            Parsing.log.debug("Config for {} node does not match {}: {}", type.wireName(),
                variant.getSimpleName(), e.getMessage());
            return new UnknownConfig(raw);
        }
    }

    final class Parsing {
        private static final Logger log = LoggerFactory.getLogger(NodeConfig.class);
        private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        private Parsing() {
        }
    }
}
