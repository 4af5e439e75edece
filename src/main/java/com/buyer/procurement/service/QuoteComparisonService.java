package com.buyer.procurement.service;

import com.buyer.procurement.dto.ComparisonMatrix;
import com.buyer.procurement.engine.ComplianceMatcher;
import com.buyer.procurement.engine.EngineSettings;
import com.buyer.procurement.engine.QuoteComparisonBuilder;
import com.buyer.procurement.exception.NotFoundException;
import com.buyer.procurement.model.Product;
import com.buyer.procurement.model.Quote;
import com.buyer.procurement.model.Specification;
import com.buyer.procurement.repository.ProductRepository;
import com.buyer.procurement.repository.QuoteRepository;
import com.buyer.procurement.repository.SpecificationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class QuoteComparisonService {

    private final SpecificationRepository specificationRepository;
    private final ProductRepository productRepository;
    private final QuoteRepository quoteRepository;
    private final ForexService forexService;
    private final SettingsService settingsService;
    private final Clock clock;

    public QuoteComparisonService(SpecificationRepository specificationRepository,
            ProductRepository productRepository, QuoteRepository quoteRepository, ForexService forexService,
            SettingsService settingsService, Clock clock) {
        this.specificationRepository = specificationRepository;
        this.productRepository = productRepository;
        this.quoteRepository = quoteRepository;
        this.forexService = forexService;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    /** All quotes for every product linked to the specification, across vendors. */
    public ComparisonMatrix compareForSpecification(Long specificationId, boolean includeExtras) {
        Specification specification = specificationRepository.findById(specificationId)
                .orElseThrow(() -> new NotFoundException("Specification", specificationId));
        List<Quote> quotes = quoteRepository.findByProductSpecificationIdOrderByIdAsc(specificationId);
        return builder().buildForSpecification(specification, quotes, includeExtras);
    }

    public ComparisonMatrix compareForProduct(Long productId, boolean includeExtras) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException("Product", productId));
        List<Quote> quotes = quoteRepository.findByProductIdOrderByIdAsc(productId);
        return builder().buildForProduct(product, quotes, includeExtras);
    }

    private QuoteComparisonBuilder builder() {
        LocalDate today = LocalDate.now(clock);
        EngineSettings settings = settingsService.getEngineSettings();
        return new QuoteComparisonBuilder(forexService.loadNormalizer(today, settings.referenceCurrency()),
                new ComplianceMatcher(), today, settings.staleQuoteDays());
    }
}
