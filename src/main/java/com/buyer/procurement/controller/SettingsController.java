package com.buyer.procurement.controller;

import com.buyer.procurement.model.Forex;
import com.buyer.procurement.service.ForexService;
import com.buyer.procurement.service.SettingsService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SettingsController {

    private final SettingsService settingsService;
    private final ForexService forexService;
    private final Clock clock;

    public SettingsController(SettingsService settingsService, ForexService forexService, Clock clock) {
        this.settingsService = settingsService;
        this.forexService = forexService;
        this.clock = clock;
    }

    @GetMapping("/settings")
    public Map<String, String> settings() {
        return settingsService.getAllSettings();
    }

    @PostMapping("/settings")
    public Map<String, String> updateSettings(@RequestBody Map<String, String> values) {
        values.forEach(settingsService::updateSetting);
        return settingsService.getAllSettings();
    }

    /** The rate the engine would use for a direct pair on the given date (today by default). */
    @GetMapping("/forex/rate")
    public ResponseEntity<Forex> forexRate(@RequestParam String from, @RequestParam String to,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        return forexService.getForexRate(from, to, date)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
