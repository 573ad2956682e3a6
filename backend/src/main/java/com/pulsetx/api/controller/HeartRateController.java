package com.pulsetx.api.controller;

import com.pulsetx.api.dto.ErrorBody;
import com.pulsetx.api.dto.HeartRateAuthorizationDto;
import com.pulsetx.api.dto.HeartRateSamplesRequest;
import com.pulsetx.heartrate.HeartRateSample;
import com.pulsetx.heartrate.config.SwitchableHeartRateAuthorization;
import com.pulsetx.heartrate.store.InMemoryHeartRateStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Heart-rate sample ingestion (in-memory store only) and the read-grant switch.
 */
@RestController
@RequestMapping("/api/v1/heart-rate")
@RequiredArgsConstructor
@Slf4j
public class HeartRateController {

    private final ObjectProvider<InMemoryHeartRateStore> inMemoryStore;
    private final SwitchableHeartRateAuthorization authorization;

    @PostMapping("/samples")
    public ResponseEntity<?> addSamples(@Valid @RequestBody HeartRateSamplesRequest request) {
        InMemoryHeartRateStore store = inMemoryStore.getIfAvailable();
        if (store == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ErrorBody.of("SAMPLE_INGESTION_UNAVAILABLE", "Active heart-rate store does not accept samples"));
        }
        List<HeartRateSample> samples = request.samples().stream()
                .map(s -> new HeartRateSample(s.timestamp(), s.bpm()))
                .toList();
        store.recordAll(samples);
        log.debug("Recorded {} heart-rate samples", samples.size());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/authorization")
    public HeartRateAuthorizationDto getAuthorization() {
        return new HeartRateAuthorizationDto(authorization.isReadGranted());
    }

    @PutMapping("/authorization")
    public HeartRateAuthorizationDto setAuthorization(@RequestBody HeartRateAuthorizationDto request) {
        authorization.setReadGranted(request.readGranted());
        log.info("Heart-rate read grant set to {}", request.readGranted());
        return new HeartRateAuthorizationDto(authorization.isReadGranted());
    }
}
