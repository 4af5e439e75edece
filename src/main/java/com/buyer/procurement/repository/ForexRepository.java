package com.buyer.procurement.repository;

import com.buyer.procurement.model.Forex;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ForexRepository extends JpaRepository<Forex, Long> {
    Optional<Forex> findFirstByFromCurrencyAndToCurrencyAndEffectiveDateLessThanEqualOrderByEffectiveDateDescIdDesc(
            String fromCurrency, String toCurrency, LocalDate asOf);

    List<Forex> findByEffectiveDateLessThanEqualOrderByEffectiveDateAscIdAsc(LocalDate asOf);
}
