package com.pointbreak.award.model;

import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.exception.SearchValidationException;
import com.pointbreak.award.exception.UnsupportedCabinClassException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SearchRequestTest {

    @Test
    void of_normalizesAirportCodes() {
        SearchRequest request = SearchRequest.of(" lax", "Jfk ", "2025-12-15", 3, CabinClass.PREMIUM_ECONOMY);

        assertThat(request.getOrigin()).isEqualTo("LAX");
        assertThat(request.getDestination()).isEqualTo("JFK");
        assertThat(request.getDate()).isEqualTo(LocalDate.of(2025, 12, 15));
        assertThat(request.getPassengerCount()).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"LA", "LAXX", "L4X", ""})
    void of_badAirportCode_throws(String code) {
        assertThatThrownBy(() -> SearchRequest.of(code, "JFK", "2025-12-15", 1, CabinClass.MAIN))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("origin");
    }

    @Test
    void of_badDateOrPassengers_throws() {
        assertThatThrownBy(() -> SearchRequest.of("LAX", "JFK", "2025-13-45", 1, CabinClass.MAIN))
                .isInstanceOf(SearchValidationException.class);
        assertThatThrownBy(() -> SearchRequest.of("LAX", "JFK", "12/15/2025", 1, CabinClass.MAIN))
                .isInstanceOf(SearchValidationException.class);
        assertThatThrownBy(() -> SearchRequest.of("LAX", "JFK", "2025-12-15", 0, CabinClass.MAIN))
                .isInstanceOf(SearchValidationException.class);
    }

    @Test
    void cabinClass_fromValue_caseInsensitive() {
        assertThat(CabinClass.fromValue("main")).isEqualTo(CabinClass.MAIN);
        assertThat(CabinClass.fromValue(" Premium_Economy ")).isEqualTo(CabinClass.PREMIUM_ECONOMY);
        assertThat(CabinClass.PREMIUM_ECONOMY.lowerName()).isEqualTo("premium_economy");
    }

    @ParameterizedTest
    @ValueSource(strings = {"economy", "business", "first", " "})
    void cabinClass_unsupported_throws(String value) {
        assertThatThrownBy(() -> CabinClass.fromValue(value))
                .isInstanceOf(UnsupportedCabinClassException.class);
    }
}
