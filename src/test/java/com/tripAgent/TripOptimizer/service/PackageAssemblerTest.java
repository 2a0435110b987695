package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.HotelCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripPackage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tripAgent.TripOptimizer.testutil.TripFixtures.SEPT_1;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.flight;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.hotel;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.intent;
import static com.tripAgent.TripOptimizer.testutil.TripFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

class PackageAssemblerTest {

    private final PackageAssembler assembler = new PackageAssembler();

    @Test
    void shouldBuildFullCrossProductFlightMajor() {
        // Given
        TravelWindow window = window(SEPT_1, 4);
        List<FlightCandidate> flights = List.of(flight("a", 120, 9), flight("b", 200, 19));
        List<HotelCandidate> hotels = List.of(hotel("x", 80, 1.0, false), hotel("y", 100, 2.5, true),
                hotel("z", 60, 4.0, false));

        // When
        List<TripPackage> packages = assembler.assemble(window, flights, hotels, intent());

        // Then
        assertThat(packages).hasSize(6);
        assertThat(packages).extracting(p -> p.getFlight().getSource() + p.getHotel().getSource())
                .containsExactly("ax", "ay", "az", "bx", "by", "bz");
        assertThat(packages).extracting(TripPackage::getId).doesNotHaveDuplicates();
        assertThat(packages.get(4).getId()).isEqualTo("2024-09-01+4/1/1");
    }

    @Test
    void shouldPriceEveryPackageWithTheDerivationFormula() {
        TravelWindow window = window(SEPT_1, 4);
        List<TripPackage> packages = assembler.assemble(window,
                List.of(flight("a", 120, 9), flight("b", 199.5, 19)),
                List.of(hotel("x", 80, 1.0, false), hotel("y", 72.25, 2.5, true)),
                intent());

        // (120 + 80 * 4) * 2
        assertThat(packages.get(0).getTotalCost()).isEqualTo(880.0);
        assertThat(packages).allSatisfy(p -> assertThat(p.getTotalCost()).isEqualTo(
                (p.getFlight().getCost() + p.getHotel().getCostPerNight() * p.getDuration()) * p.getTravelers()));
    }

    @Test
    void shouldReturnNothingWhenEitherSideIsEmpty() {
        TravelWindow window = window(SEPT_1, 3);

        assertThat(assembler.assemble(window, List.of(), List.of(hotel("x", 80, 1.0, false)), intent())).isEmpty();
        assertThat(assembler.assemble(window, List.of(flight("a", 120, 9)), List.of(), intent())).isEmpty();
    }
}
