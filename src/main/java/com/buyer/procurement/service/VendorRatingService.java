package com.buyer.procurement.service;

import com.buyer.procurement.dto.VendorRatingSummary;
import com.buyer.procurement.model.VendorRating;
import com.buyer.procurement.repository.VendorRatingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Stream;

@Service
@Transactional(readOnly = true)
public class VendorRatingService {

    private final VendorRatingRepository vendorRatingRepository;

    public VendorRatingService(VendorRatingRepository vendorRatingRepository) {
        this.vendorRatingRepository = vendorRatingRepository;
    }

    public VendorRatingSummary summarize(Long vendorId) {
        List<VendorRating> ratings = vendorRatingRepository.findByVendorId(vendorId);
        if (ratings.isEmpty()) {
            return VendorRatingSummary.unrated(vendorId);
        }
        Double price = average(ratings, VendorRating::getPriceRating);
        Double quality = average(ratings, VendorRating::getQualityRating);
        Double delivery = average(ratings, VendorRating::getDeliveryRating);
        Double service = average(ratings, VendorRating::getServiceRating);
        OptionalDouble overall = Stream.of(price, quality, delivery, service)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return new VendorRatingSummary(vendorId, ratings.size(), price, quality, delivery, service,
                overall.isPresent() ? overall.getAsDouble() : null);
    }

    public Map<Long, VendorRatingSummary> summarize(Collection<Long> vendorIds) {
        Map<Long, VendorRatingSummary> summaries = new LinkedHashMap<>();
        vendorIds.stream().distinct().forEach(id -> summaries.put(id, summarize(id)));
        return summaries;
    }

    private static Double average(List<VendorRating> ratings, Function<VendorRating, Integer> category) {
        OptionalDouble average = ratings.stream()
                .map(category)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }
}
