package com.flagship.coin_economy.bot;

import com.flagship.coin_economy.bot.dto.AffordabilityResponse;
import com.flagship.coin_economy.bot.dto.BotActionResponse;
import com.flagship.coin_economy.bot.dto.DisqualifyRequest;
import com.flagship.coin_economy.bot.dto.DisqualifyResponse;
import com.flagship.coin_economy.bot.dto.RecordActionRequest;
import com.flagship.coin_economy.treasury.TreasuryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Endpoints used by the bot orchestrator and by moderators.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class BotActionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final BotActionRecorder recorder;
    private final TreasuryService treasuryService;

    @GetMapping("/api/v1/bots/{botId}/affordability")
    public ResponseEntity<AffordabilityResponse> canAfford(@PathVariable("botId") String botId,
                                                           @RequestParam("amount") long amount) {
        return ResponseEntity.ok(new AffordabilityResponse(botId, amount, treasuryService.canAfford(botId, amount)));
    }

    /**
     * Records a bot spend. With an Idempotency-Key a retried request answers
     * 200 with the action recorded the first time.
     */
    @PostMapping("/api/v1/bots/{botId}/actions")
    public ResponseEntity<BotActionResponse> recordAction(
            @PathVariable("botId") String botId,
            @Valid @RequestBody RecordActionRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received bot action: botId={}, type={}, target={}:{}, cost={}",
                botId, request.getActionType(), request.getTargetType(), request.getTargetId(), request.getCost());

        if (idempotencyKey != null) {
            var existing = recorder.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                return ResponseEntity.ok(BotActionResponse.from(existing.get()));
            }
        }

        UUID actionId = recorder.recordSpend(botId, request.getActionType(),
            ActionTarget.of(request.getTargetType(), request.getTargetId()),
            request.getCost(), request.getMetadata(), idempotencyKey);

        return ResponseEntity.status(HttpStatus.CREATED).body(BotActionResponse.from(recorder.getAction(actionId)));
    }

    @GetMapping("/api/v1/bots/{botId}/actions")
    public ResponseEntity<List<BotActionResponse>> listActions(@PathVariable("botId") String botId) {
        return ResponseEntity.ok(recorder.getActionsForBot(botId).stream().map(BotActionResponse::from).toList());
    }

    @GetMapping("/api/v1/bot-actions/{id}")
    public ResponseEntity<BotActionResponse> getAction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(BotActionResponse.from(recorder.getAction(id)));
    }

    @PostMapping("/api/v1/bot-actions/{id}/disqualify")
    public ResponseEntity<DisqualifyResponse> disqualify(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody DisqualifyRequest request) {
        boolean scheduled = recorder.disqualify(id, request.getReason());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DisqualifyResponse(id, scheduled));
    }
}
