package io.doncoin.indexer.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.doncoin.indexer.event.ProjectionMutation.OpenRound;
import io.doncoin.indexer.event.ProjectionMutation.UpsertProposal;
import io.doncoin.indexer.event.ProjectionView.ProposalRef;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GrantCreatedHandler implements EventHandler<GrantCreatedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GrantCreatedHandler.class);
    static final Duration DEFAULT_ROUND_LENGTH = Duration.ofDays(30);

    // funding_goal is NUMERIC(78, 18)
    static final int BUDGET_SCALE = 18;
    static final int BUDGET_MAX_INTEGER_DIGITS = 60;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GrantCreatedHandler(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public HandlerResult handle(GrantCreatedEvent event, EventContext context, ProjectionView view) {
        List<ProjectionMutation> mutations = new ArrayList<>();
        Instant now = clock.instant();

        UUID roundId;
        Optional<UUID> activeRound = view.findActiveRound();
        if (activeRound.isPresent()) {
            roundId = activeRound.get();
        } else {
            roundId = UUID.randomUUID();
            mutations.add(new OpenRound(roundId, UUID.randomUUID(), now, now.plus(DEFAULT_ROUND_LENGTH)));
            log.info("No active round, opening one roundId={} for grantId={}", roundId, event.grantId());
        }

        GrantMetadata metadata = parseMetadata(event);
        UUID proposalId = view.findProposal(event.grantId(), context.sessionId())
            .map(ProposalRef::proposalId)
            .orElseGet(UUID::randomUUID);

        mutations.add(new UpsertProposal(
            proposalId,
            context.sessionId(),
            event.grantId(),
            metadata.title(),
            metadata.description(),
            event.owner(),
            roundId,
            metadata.budget(),
            now
        ));
        return new HandlerResult(mutations, proposalId, roundId, null);
    }

    GrantMetadata parseMetadata(GrantCreatedEvent event) {
        String fallbackTitle = "Grant " + event.grantId();
        JsonNode root;
        try {
            root = objectMapper.readTree(event.metadata());
        } catch (JsonProcessingException e) {
            log.debug("Grant metadata is not JSON grantId={}", event.grantId());
            return new GrantMetadata(fallbackTitle, "No metadata", BigDecimal.ZERO);
        }
        if (root == null || !root.isObject()) {
            return new GrantMetadata(fallbackTitle, "No metadata", BigDecimal.ZERO);
        }

        String title = root.hasNonNull("title") ? stripNul(root.get("title").asText()) : fallbackTitle;
        String description = root.hasNonNull("description") ? stripNul(root.get("description").asText()) : "";
        return new GrantMetadata(title, description, parseBudget(root.get("budget"), event.grantId()));
    }

    private BigDecimal parseBudget(JsonNode node, long grantId) {
        if (node == null || node.isNull()) {
            return BigDecimal.ZERO;
        }
        BigDecimal budget;
        if (node.isNumber()) {
            budget = node.decimalValue();
        } else {
            try {
                budget = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric budget grantId={} budget={}", grantId, node.asText());
                return BigDecimal.ZERO;
            }
        }
        int integerDigits = budget.precision() - budget.scale();
        if (budget.signum() == 0 || integerDigits < -BUDGET_SCALE) {
            return BigDecimal.ZERO;
        }
        if (integerDigits > BUDGET_MAX_INTEGER_DIGITS) {
            log.warn("Ignoring out-of-range budget grantId={} budget={}", grantId, node.asText());
            return BigDecimal.ZERO;
        }
        return budget.setScale(BUDGET_SCALE, RoundingMode.HALF_UP);
    }

    private static String stripNul(String value) {
        return value.replace("\u0000", "");
    }

    record GrantMetadata(String title, String description, BigDecimal budget) {
    }
}
