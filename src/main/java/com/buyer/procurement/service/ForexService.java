package com.buyer.procurement.service;

import com.buyer.procurement.engine.CurrencyNormalizer;
import com.buyer.procurement.model.Forex;
import com.buyer.procurement.repository.ForexRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class ForexService {

    private final ForexRepository forexRepository;

    public ForexService(ForexRepository forexRepository) {
        this.forexRepository = forexRepository;
    }

    /** Loads every rate already effective on {@code asOf} into a normalizer. */
    public CurrencyNormalizer loadNormalizer(LocalDate asOf, String referenceCurrency) {
        List<Forex> rates = forexRepository.findByEffectiveDateLessThanEqualOrderByEffectiveDateAscIdAsc(asOf);
        return new CurrencyNormalizer(rates, referenceCurrency);
    }

    public Optional<Forex> getForexRate(String fromCurrency, String toCurrency, LocalDate asOf) {
        return forexRepository.findFirstByFromCurrencyAndToCurrencyAndEffectiveDateLessThanEqualOrderByEffectiveDateDescIdDesc(
                fromCurrency.trim().toUpperCase(), toCurrency.trim().toUpperCase(), asOf);
    }
}
