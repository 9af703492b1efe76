package com.vineroute.hoscompliance.config;

import com.vineroute.hoscompliance.entity.Driver;
import com.vineroute.hoscompliance.entity.Vehicle;
import com.vineroute.hoscompliance.repository.DriverRepository;
import com.vineroute.hoscompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the carrier roster on an empty database: three drivers and the
 * three Sprinter vans.
 */
@Component
@ConditionalOnProperty(name = "roster.seed.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final DriverRepository driverRepository;
    private final VehicleRepository vehicleRepository;

    @Override
    public void run(String... args) {
        if (driverRepository.count() > 0 || vehicleRepository.count() > 0) {
            log.info("Roster already present, skipping seed");
            return;
        }

        List<Driver> drivers = driverRepository.saveAll(List.of(
                Driver.builder().name("Owner").phoneNumber("509-555-0100").licenseNumber("WA-CDL-0001").active(true).build(),
                Driver.builder().name("Eric Critchlow").phoneNumber("509-555-0101").licenseNumber("WA-CDL-0002").active(true).build(),
                Driver.builder().name("Janine Bergevin").phoneNumber("509-555-0102").licenseNumber("WA-CDL-0003").active(true).build()
        ));
        drivers.forEach(d -> log.info("Driver created: #{} {}", d.getId(), d.getName()));

        List<Vehicle> vehicles = vehicleRepository.saveAll(List.of(
                Vehicle.builder().vehicleNumber("Sprinter 1").make("Mercedes-Benz").model("Sprinter").capacity(11).active(true).build(),
                Vehicle.builder().vehicleNumber("Sprinter 2").make("Mercedes-Benz").model("Sprinter").capacity(14).active(true).build(),
                Vehicle.builder().vehicleNumber("Sprinter 3").make("Mercedes-Benz").model("Sprinter").capacity(14).active(true).build()
        ));
        vehicles.forEach(v -> log.info("Vehicle created: #{} {} ({} seats)", v.getId(), v.getVehicleNumber(), v.getCapacity()));

        log.info("Roster seeded: {} driver(s), {} vehicle(s)", drivers.size(), vehicles.size());
    }
}
