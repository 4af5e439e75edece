package com.buyer.procurement.engine;

import com.buyer.procurement.exception.InvalidStrategyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StrategyTypeTest {

    @Test
    void fromCode_ShouldAcceptCodesIgnoringCaseAndWhitespace() {
        assertEquals(StrategyType.LOWEST_COST, StrategyType.fromCode("lowest_cost"));
        assertEquals(StrategyType.QUALITY_FOCUSED, StrategyType.fromCode("  Quality_Focused "));
        assertEquals(StrategyType.BALANCED, StrategyType.DEFAULT);
    }

    @Test
    void fromCode_UnknownName_ShouldListValidStrategies() {
        InvalidStrategyException ex = assertThrows(InvalidStrategyException.class,
                () -> StrategyType.fromCode("cheapest"));
        assertEquals("cheapest", ex.getStrategy());
        assertTrue(ex.getMessage().contains("fewest_vendors"));
    }

    @Test
    void fromCode_Null_ShouldThrow() {
        assertThrows(InvalidStrategyException.class, () -> StrategyType.fromCode(null));
    }

    @Test
    void values_ShouldKeepReportOrder() {
        StrategyType[] values = StrategyType.values();
        assertEquals("lowest_cost", values[0].getCode());
        assertEquals("fewest_vendors", values[1].getCode());
        assertEquals("balanced", values[2].getCode());
        assertEquals("quality_focused", values[3].getCode());
    }
}
