package com.buyer.procurement.service;

import com.buyer.procurement.engine.EngineSettings;
import com.buyer.procurement.model.AppSetting;
import com.buyer.procurement.repository.AppSettingRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class SettingsService {

    private final AppSettingRepository appSettingRepository;
    private final AuditService auditService;

    public static final String KEY_REFERENCE_CURRENCY = "reference_currency";
    public static final String KEY_EXPIRY_WARNING_DAYS = "expiry_warning_days";
    public static final String KEY_CONCENTRATION_THRESHOLD = "concentration_threshold";
    public static final String KEY_STALE_QUOTE_DAYS = "stale_quote_days";
    public static final String KEY_BALANCED_COST_WEIGHT = "balanced_cost_weight";
    public static final String KEY_BALANCED_VENDOR_WEIGHT = "balanced_vendor_weight";

    public static final List<String> KNOWN_KEYS = List.of(KEY_REFERENCE_CURRENCY, KEY_EXPIRY_WARNING_DAYS,
            KEY_CONCENTRATION_THRESHOLD, KEY_STALE_QUOTE_DAYS, KEY_BALANCED_COST_WEIGHT, KEY_BALANCED_VENDOR_WEIGHT);

    public SettingsService(AppSettingRepository appSettingRepository, AuditService auditService) {
        this.appSettingRepository = appSettingRepository;
        this.auditService = auditService;
    }

    public String getReferenceCurrency() {
        return appSettingRepository.findBySettingKey(KEY_REFERENCE_CURRENCY)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank())
                .map(val -> val.trim().toUpperCase())
                .orElse(EngineSettings.DEFAULT_REFERENCE_CURRENCY);
    }

    public int getExpiryWarningDays() {
        return intSetting(KEY_EXPIRY_WARNING_DAYS, EngineSettings.DEFAULT_EXPIRY_WARNING_DAYS);
    }

    public int getStaleQuoteDays() {
        return intSetting(KEY_STALE_QUOTE_DAYS, EngineSettings.DEFAULT_STALE_QUOTE_DAYS);
    }

    public BigDecimal getConcentrationThreshold() {
        return decimalSetting(KEY_CONCENTRATION_THRESHOLD, EngineSettings.DEFAULT_CONCENTRATION_THRESHOLD);
    }

    public BigDecimal getBalancedCostWeight() {
        return decimalSetting(KEY_BALANCED_COST_WEIGHT, EngineSettings.DEFAULT_COST_WEIGHT);
    }

    public BigDecimal getBalancedVendorWeight() {
        return decimalSetting(KEY_BALANCED_VENDOR_WEIGHT, EngineSettings.DEFAULT_VENDOR_WEIGHT);
    }

    /** Current tuning values for an engine run, falling back to defaults per key. */
    public EngineSettings getEngineSettings() {
        return new EngineSettings(getReferenceCurrency(), getExpiryWarningDays(), getConcentrationThreshold(),
                getStaleQuoteDays(), getBalancedCostWeight(), getBalancedVendorWeight());
    }

    /** Effective value of every known key, stored or default. */
    public Map<String, String> getAllSettings() {
        EngineSettings settings = getEngineSettings();
        Map<String, String> values = new LinkedHashMap<>();
        values.put(KEY_REFERENCE_CURRENCY, settings.referenceCurrency());
        values.put(KEY_EXPIRY_WARNING_DAYS, String.valueOf(settings.expiryWarningDays()));
        values.put(KEY_CONCENTRATION_THRESHOLD, settings.concentrationThreshold().toPlainString());
        values.put(KEY_STALE_QUOTE_DAYS, String.valueOf(settings.staleQuoteDays()));
        values.put(KEY_BALANCED_COST_WEIGHT, settings.balancedCostWeight().toPlainString());
        values.put(KEY_BALANCED_VENDOR_WEIGHT, settings.balancedVendorWeight().toPlainString());
        return values;
    }

    public void updateSetting(String key, String value) {
        if (!KNOWN_KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting '" + key + "'");
        }
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        String oldValue = existing.map(AppSetting::getSettingValue).orElse(null);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value != null ? value : "");
            appSettingRepository.save(setting);
        } else {
            AppSetting setting = new AppSetting(key, value != null ? value : "");
            appSettingRepository.save(setting);
        }
        auditService.log("UPDATE_SETTING", "Key: " + key + ", Old: " + oldValue + ", New: " + value);
    }

    private int intSetting(String key, int defaultValue) {
        return appSettingRepository.findBySettingKey(key)
                .map(AppSetting::getSettingValue)
                .map(val -> {
                    try {
                        return val.isBlank() ? defaultValue : Integer.parseInt(val.trim());
                    } catch (NumberFormatException e) {
                        return defaultValue;
                    }
                })
                .orElse(defaultValue);
    }

    private BigDecimal decimalSetting(String key, BigDecimal defaultValue) {
        return appSettingRepository.findBySettingKey(key)
                .map(AppSetting::getSettingValue)
                .map(val -> {
                    try {
                        return val.isBlank() ? defaultValue : new BigDecimal(val.trim());
                    } catch (NumberFormatException e) {
                        return defaultValue;
                    }
                })
                .orElse(defaultValue);
    }
}
