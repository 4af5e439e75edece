package com.buyer.procurement.engine;

import com.buyer.procurement.dto.ComparisonMatrix;
import com.buyer.procurement.dto.ComplianceResult;
import com.buyer.procurement.dto.ConversionResult;
import com.buyer.procurement.dto.DegradationReason;
import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.dto.QuoteSelection;
import com.buyer.procurement.exception.UnconvertibleCurrencyException;
import com.buyer.procurement.model.Product;
import com.buyer.procurement.model.Quote;
import com.buyer.procurement.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns raw quotes into comparison rows (normalized price, expiry, compliance) and
 * holds the best-quote selection rule shared by every strategy.
 *
 * <p>A quote that satisfies every constraint (convertible, non-expired, compliant) is
 * always preferred. When no quote for an item does, candidates are grouped into tiers
 * by the constraints they fail, weighted so that convertibility matters most, then
 * expiry, then compliance, and the best tier present is used. The relaxed constraints
 * are reported as degradation reasons.
 */
public class QuoteComparisonBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QuoteComparisonBuilder.class);

    /** Converted price ascending, earliest quote date on ties. Unconvertible rows sort last. */
    public static final Comparator<QuoteComparison> PRICE_ORDER = Comparator
            .comparing(QuoteComparison::convertedPrice, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QuoteComparison::quoteDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QuoteComparison::price, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QuoteComparison::quoteId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final int UNCONVERTIBLE = 4;
    private static final int EXPIRED = 2;
    private static final int NON_COMPLIANT = 1;

    private final CurrencyNormalizer normalizer;
    private final ComplianceMatcher matcher;
    private final LocalDate asOf;
    private final int staleQuoteDays;

    public QuoteComparisonBuilder(CurrencyNormalizer normalizer, ComplianceMatcher matcher, LocalDate asOf,
            int staleQuoteDays) {
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.asOf = asOf;
        this.staleQuoteDays = staleQuoteDays;
    }

    public LocalDate getAsOf() {
        return asOf;
    }

    public ComparisonMatrix buildForSpecification(Specification specification, List<Quote> quotes,
            boolean includeExtras) {
        List<QuoteComparison> rows = quotes.stream()
                .map(q -> compare(q, specification, includeExtras))
                .sorted(PRICE_ORDER)
                .collect(Collectors.toList());
        return new ComparisonMatrix(specification.getId(), specification.getName(), null,
                normalizer.getReferenceCurrency(), asOf, rows);
    }

    public ComparisonMatrix buildForProduct(Product product, List<Quote> quotes, boolean includeExtras) {
        Specification specification = product.getSpecification();
        List<QuoteComparison> rows = quotes.stream()
                .map(q -> compare(q, specification, includeExtras))
                .sorted(PRICE_ORDER)
                .collect(Collectors.toList());
        return new ComparisonMatrix(specification != null ? specification.getId() : null,
                specification != null ? specification.getName() : null, product.getId(),
                normalizer.getReferenceCurrency(), asOf, rows);
    }

    /**
     * Builds one comparison row. Compliance is judged against the given specification,
     * or the product's own one when none is given.
     */
    public QuoteComparison compare(Quote quote, Specification specification, boolean includeExtras) {
        Product product = quote.getProduct();
        Specification target = specification != null ? specification : product.getSpecification();

        ConversionResult conversion = null;
        try {
            conversion = normalizer.toReference(quote.getPrice(), quote.effectiveCurrency(), asOf);
        } catch (UnconvertibleCurrencyException e) {
            logger.debug("Quote {} excluded from cost math: {}", quote.getId(), e.getMessage());
        }

        ComplianceResult compliance = matcher.evaluate(target, product);
        return new QuoteComparison(
                quote.getId(),
                quote.getVendor().getId(),
                quote.getVendor().getName(),
                product.getId(),
                product.getName(),
                quote.getPrice(),
                quote.effectiveCurrency(),
                conversion != null ? conversion.amount() : null,
                conversion != null ? conversion.rate() : null,
                quote.getQuoteDate(),
                quote.getValidUntil(),
                quote.isExpired(asOf),
                quote.isStale(asOf, staleQuoteDays),
                compliance,
                includeExtras ? compliance.extraAttributes() : List.of());
    }

    public static int constraintRank(QuoteComparison quote) {
        int rank = 0;
        if (!quote.convertible()) {
            rank += UNCONVERTIBLE;
        }
        if (quote.expired()) {
            rank += EXPIRED;
        }
        if (!quote.compliant()) {
            rank += NON_COMPLIANT;
        }
        return rank;
    }

    /** Quotes of the best constraint tier present, in price order. Empty for an empty input. */
    public static List<QuoteComparison> bestTier(List<QuoteComparison> quotes) {
        int best = quotes.stream().mapToInt(QuoteComparisonBuilder::constraintRank).min().orElse(-1);
        return quotes.stream()
                .filter(q -> constraintRank(q) == best)
                .sorted(PRICE_ORDER)
                .collect(Collectors.toList());
    }

    public static List<DegradationReason> reasonsFor(int rank) {
        List<DegradationReason> reasons = new ArrayList<>();
        if ((rank & UNCONVERTIBLE) != 0) {
            reasons.add(DegradationReason.NO_CONVERTIBLE_QUOTES);
        }
        if ((rank & EXPIRED) != 0) {
            reasons.add(DegradationReason.ONLY_EXPIRED_QUOTES);
        }
        if ((rank & NON_COMPLIANT) != 0) {
            reasons.add(DegradationReason.NO_COMPLIANT_QUOTE);
        }
        return reasons;
    }

    public static Optional<QuoteSelection> selectBest(List<QuoteComparison> quotes) {
        return selectBest(quotes, PRICE_ORDER);
    }

    /**
     * Picks the first quote under {@code order} from the best constraint tier present.
     */
    public static Optional<QuoteSelection> selectBest(List<QuoteComparison> quotes,
            Comparator<QuoteComparison> order) {
        if (quotes.isEmpty()) {
            return Optional.empty();
        }
        List<QuoteComparison> tier = bestTier(quotes);
        QuoteComparison pick = tier.stream().min(order).orElseThrow();
        List<DegradationReason> reasons = reasonsFor(constraintRank(pick));
        return Optional.of(new QuoteSelection(pick, !reasons.isEmpty(), reasons));
    }
}
