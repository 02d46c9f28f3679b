package com.pointbreak.award.controller;

import com.pointbreak.award.model.ComparisonResult;
import com.pointbreak.award.model.dto.FlightsResponse;
import com.pointbreak.award.service.FlightComparisonService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class FlightSearchController {

    private final FlightComparisonService flightComparisonService;

    /**
     * Cash and award prices for every flight both searches return, with cents per point.
     *
     * @param origin      departure airport, 3-letter IATA code
     * @param destination arrival airport, 3-letter IATA code
     * @param date        departure date, YYYY-MM-DD
     * @param passengers  adult passengers, 1 to 9
     * @param cabinClass  main or premium_economy
     */
    @GetMapping("/flights")
    public ResponseEntity<FlightsResponse> searchFlights(
            @RequestParam("origin")
            @Pattern(regexp = "^[A-Za-z]{3}$", message = "must be a 3-letter airport code") String origin,
            @RequestParam("destination")
            @Pattern(regexp = "^[A-Za-z]{3}$", message = "must be a 3-letter airport code") String destination,
            @RequestParam("date")
            @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "must be formatted as YYYY-MM-DD") String date,
            @RequestParam(value = "passengers", defaultValue = "1")
            @Min(value = 1, message = "must be at least 1")
            @Max(value = 9, message = "must be at most 9") int passengers,
            @RequestParam(value = "cabin_class", defaultValue = "main") String cabinClass
    ) {
        log.info("GET /flights - {} -> {} on {}, passengers={}, cabin={}",
                origin, destination, date, passengers, cabinClass);

        ComparisonResult result = flightComparisonService.compare(origin, destination, date, passengers, cabinClass);
        return ResponseEntity.ok(FlightsResponse.from(result));
    }
}
