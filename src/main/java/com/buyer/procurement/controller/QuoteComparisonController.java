package com.buyer.procurement.controller;

import com.buyer.procurement.dto.ComparisonMatrix;
import com.buyer.procurement.service.QuoteComparisonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class QuoteComparisonController {

    private final QuoteComparisonService quoteComparisonService;

    public QuoteComparisonController(QuoteComparisonService quoteComparisonService) {
        this.quoteComparisonService = quoteComparisonService;
    }

    @GetMapping("/specifications/{id}/quotes/comparison")
    public ComparisonMatrix forSpecification(@PathVariable Long id,
            @RequestParam(defaultValue = "false") boolean includeExtras) {
        return quoteComparisonService.compareForSpecification(id, includeExtras);
    }

    @GetMapping("/products/{id}/quotes/comparison")
    public ComparisonMatrix forProduct(@PathVariable Long id,
            @RequestParam(defaultValue = "false") boolean includeExtras) {
        return quoteComparisonService.compareForProduct(id, includeExtras);
    }
}
