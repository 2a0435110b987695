package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.HotelCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import com.tripAgent.TripOptimizer.model.TripPackage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross product of the flights and hotels gathered for one window, flight-major.
 */
@Component
public class PackageAssembler {

    public List<TripPackage> assemble(TravelWindow window, List<FlightCandidate> flights,
                                      List<HotelCandidate> hotels, TripIntent intent) {
        List<TripPackage> packages = new ArrayList<>(flights.size() * hotels.size());
        for (int f = 0; f < flights.size(); f++) {
            for (int h = 0; h < hotels.size(); h++) {
                packages.add(new TripPackage(packageId(window, f, h), window,
                        flights.get(f), hotels.get(h), intent.getTravelers()));
            }
        }
        return packages;
    }

    static String packageId(TravelWindow window, int flightIndex, int hotelIndex) {
        return window.getStartDate() + "+" + window.getDuration() + "/" + flightIndex + "/" + hotelIndex;
    }
}
