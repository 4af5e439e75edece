package com.buyer.procurement.engine;

import com.buyer.procurement.dto.ConversionResult;
import com.buyer.procurement.exception.UnconvertibleCurrencyException;
import com.buyer.procurement.model.Forex;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts amounts between currencies using an in-memory table of directed rates.
 * The authoritative rate for a pair is the latest one whose effective date is not
 * after the requested date; there is no interpolation between dated rates. When a
 * pair has no direct rate the conversion is composed through the reference currency.
 */
public class CurrencyNormalizer {

    private static final Comparator<Forex> NEWEST_FIRST = Comparator
            .comparing(Forex::getEffectiveDate).reversed()
            .thenComparing(Forex::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final String referenceCurrency;
    private final Map<String, List<Forex>> ratesByPair = new HashMap<>();

    public CurrencyNormalizer(Collection<Forex> rates, String referenceCurrency) {
        this.referenceCurrency = normalize(referenceCurrency);
        for (Forex forex : rates) {
            if (forex.getFromCurrency() == null || forex.getToCurrency() == null
                    || forex.getEffectiveDate() == null || forex.getRate() == null) {
                continue;
            }
            ratesByPair.computeIfAbsent(pairKey(normalize(forex.getFromCurrency()), normalize(forex.getToCurrency())),
                    k -> new ArrayList<>()).add(forex);
        }
        ratesByPair.values().forEach(list -> list.sort(NEWEST_FIRST));
    }

    public String getReferenceCurrency() {
        return referenceCurrency;
    }

    public ConversionResult toReference(BigDecimal amount, String fromCurrency, LocalDate asOf) {
        return convert(amount, fromCurrency, referenceCurrency, asOf);
    }

    public ConversionResult convert(BigDecimal amount, String fromCurrency, String toCurrency, LocalDate asOf) {
        String from = normalize(fromCurrency);
        String to = normalize(toCurrency);
        if (from == null || to == null) {
            throw new UnconvertibleCurrencyException(fromCurrency, toCurrency, "currency code missing");
        }
        if (from.equals(to)) {
            return new ConversionResult(amount, BigDecimal.ONE, from, to, false);
        }

        Optional<Forex> direct = latestRate(from, to, asOf);
        if (direct.isPresent()) {
            BigDecimal rate = direct.get().getRate();
            return new ConversionResult(amount.multiply(rate), rate, from, to, false);
        }

        if (from.equals(referenceCurrency) || to.equals(referenceCurrency)) {
            throw new UnconvertibleCurrencyException(from, to, "no rate effective on or before " + asOf);
        }
        Forex firstHop = latestRate(from, referenceCurrency, asOf)
                .orElseThrow(() -> new UnconvertibleCurrencyException(from, to,
                        "no direct rate and no " + from + "->" + referenceCurrency + " rate on or before " + asOf));
        Forex secondHop = latestRate(referenceCurrency, to, asOf)
                .orElseThrow(() -> new UnconvertibleCurrencyException(from, to,
                        "no direct rate and no " + referenceCurrency + "->" + to + " rate on or before " + asOf));
        BigDecimal rate = firstHop.getRate().multiply(secondHop.getRate());
        return new ConversionResult(amount.multiply(rate), rate, from, to, true);
    }

    public Optional<Forex> latestRate(String fromCurrency, String toCurrency, LocalDate asOf) {
        List<Forex> candidates = ratesByPair.get(pairKey(normalize(fromCurrency), normalize(toCurrency)));
        if (candidates == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(f -> !f.getEffectiveDate().isAfter(asOf))
                .findFirst();
    }

    private static String pairKey(String from, String to) {
        return from + "->" + to;
    }

    private static String normalize(String currency) {
        if (currency == null || currency.isBlank()) {
            return null;
        }
        return currency.trim().toUpperCase();
    }
}
