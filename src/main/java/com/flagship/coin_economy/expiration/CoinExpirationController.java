package com.flagship.coin_economy.expiration;

import com.flagship.coin_economy.expiration.dto.CoinExpirationResponse;
import com.flagship.coin_economy.expiration.dto.ScheduleExpirationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/expirations")
@RequiredArgsConstructor
public class CoinExpirationController {

    private final CoinExpirationService expirationService;

    @PostMapping
    public ResponseEntity<CoinExpirationResponse> schedule(@Valid @RequestBody ScheduleExpirationRequest request) {
        CoinExpiration expiration = request.getExpiresAt() != null
            ? expirationService.schedule(request.getUserId(), request.getAmount(), request.getExpiresAt(),
                request.getSourceTransactionId())
            : expirationService.scheduleDefault(request.getUserId(), request.getAmount(),
                request.getSourceTransactionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(CoinExpirationResponse.from(expiration));
    }

    @GetMapping
    public ResponseEntity<List<CoinExpirationResponse>> listForUser(@RequestParam("user_id") String userId) {
        return ResponseEntity.ok(expirationService.findForUser(userId).stream()
            .map(CoinExpirationResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<CoinExpirationResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CoinExpirationResponse.from(expirationService.get(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@PathVariable("id") UUID id) {
        expirationService.cancel(id);
        return ResponseEntity.noContent().build();
    }
}
